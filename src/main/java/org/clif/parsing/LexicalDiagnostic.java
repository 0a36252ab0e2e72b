package org.clif.parsing;

/**
 * Carattere non riconosciuto dal lexer e saltato durante la lettura.
 *
 * @param line riga, a partire da 1
 * @param column colonna, a partire da 1
 * @param symbol carattere scartato
 */
public record LexicalDiagnostic(int line, int column, String symbol) {

    @Override
    public String toString() {
        return "Carattere non riconosciuto '" + symbol + "' alla riga " + line + ", colonna " + column;
    }
}
