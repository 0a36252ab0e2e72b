package org.clif.parsing;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.BufferedTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Trasforma il primo errore sintattico in una {@link GrammarException}, interrompendo il parsing.
 */
class GrammarErrorListener extends BaseErrorListener {

    static final String EOF_TOKEN = "<EOF>";

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        Parser parser = (Parser) recognizer;
        Token offending = (Token) offendingSymbol;

        ParserRuleContext current = e != null && e.getCtx() instanceof ParserRuleContext ruleContext
                ? ruleContext
                : parser.getContext();

        String context = BrokenAxiomLocator.locate(current, offending, (BufferedTokenStream) parser.getInputStream());
        String text = offending.getType() == Token.EOF ? EOF_TOKEN : offending.getText();

        throw new GrammarException(line, text, context);
    }
}
