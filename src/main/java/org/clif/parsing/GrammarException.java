package org.clif.parsing;

/**
 * Costrutto CLIF malformato: interrompe la lettura del file corrente.
 *
 * Riporta la riga (a partire da 1), il token inatteso e la ricostruzione dell'assioma
 * che lo contiene, con il token inatteso sottolineato.
 */
public class GrammarException extends RuntimeException {

    private final int line;
    private final String offendingToken;
    private final String context;

    public GrammarException(int line, String offendingToken, String context) {
        super(buildMessage(line, offendingToken, context));
        this.line = line;
        this.offendingToken = offendingToken;
        this.context = context;
    }

    private static String buildMessage(int line, String offendingToken, String context) {
        String message = "Errore alla riga " + line + "! Token inatteso: '" + offendingToken + "'";
        return context == null || context.isEmpty() ? message : message + " :: \"" + context + "\"";
    }

    public int getLine() {
        return line;
    }

    public String getOffendingToken() {
        return offendingToken;
    }

    /**
     * @return ricostruzione dell'assioma malformato, vuota se non disponibile
     */
    public String getContext() {
        return context;
    }
}
