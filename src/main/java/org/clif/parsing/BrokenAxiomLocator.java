package org.clif.parsing;

import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.clif.antlr.ClifLexer;
import org.clif.antlr.ClifParser;

/**
 * RICOSTRUZIONE DELL'ASSIOMA MALFORMATO
 *
 * Dato il token che ha causato l'errore, ricostruisce il testo dell'assioma che lo contiene:
 * 1. Risale lo stack delle regole fino all'assioma aperto più vicino
 * 2. Raccoglie i token dall'inizio di quell'assioma fino al token inatteso
 * 3. Prosegue nel flusso di token finché le parentesi non tornano in equilibrio
 *
 * Il token inatteso viene sottolineato con U+0332 dopo ogni carattere.
 */
final class BrokenAxiomLocator {

    private static final char UNDERLINE = '\u0332';

    private BrokenAxiomLocator() {
    }

    /**
     * @param current regola in corso al momento dell'errore (può essere null)
     * @param offending token inatteso
     * @param tokens flusso di token del parser
     * @return testo ricostruito, con token separati da spazi
     */
    static String locate(ParserRuleContext current, Token offending, BufferedTokenStream tokens) {
        ParserRuleContext axiom = current;
        // Un assioma senza figli è quello la cui predizione è fallita: si risale al contenitore
        while (axiom != null && !(axiom instanceof ClifParser.AxiomContext && axiom.getChildCount() > 0)) {
            axiom = axiom.getParent();
        }

        int offendingIndex = offending.getTokenIndex();
        int start = axiom != null && axiom.getStart() != null
                ? Math.min(axiom.getStart().getTokenIndex(), offendingIndex)
                : offendingIndex;

        tokens.fill();

        StringBuilder text = new StringBuilder();
        Token previous = null;
        int depth = 0;

        for (int i = Math.max(start, 0); i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.getType() == Token.EOF) {
                if (i == offendingIndex) {
                    appendSeparated(text, previous, token, underline(GrammarErrorListener.EOF_TOKEN));
                }
                break;
            }

            String tokenText = i == offendingIndex ? underline(token.getText()) : token.getText();
            appendSeparated(text, previous, token, tokenText);
            previous = token;

            if (token.getType() == ClifLexer.LPAREN) {
                depth++;
            } else if (token.getType() == ClifLexer.RPAREN) {
                depth--;
            }

            if (i >= offendingIndex && depth <= 0) {
                break;
            }
        }

        return text.toString();
    }

    private static void appendSeparated(StringBuilder text, Token previous, Token token, String tokenText) {
        boolean glued = previous == null
                || previous.getType() == ClifLexer.LPAREN
                || token.getType() == ClifLexer.RPAREN;
        if (!glued) {
            text.append(' ');
        }
        text.append(tokenText);
    }

    static String underline(String text) {
        StringBuilder underlined = new StringBuilder();
        for (char c : text.toCharArray()) {
            underlined.append(c).append(UNDERLINE);
        }
        return underlined.toString();
    }
}
