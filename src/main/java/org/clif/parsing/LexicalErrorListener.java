package org.clif.parsing;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.Interval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Raccoglie i caratteri non riconosciuti dal lexer. Il lexer scarta il carattere e
 * prosegue, per cui un file può produrre più diagnostiche in una sola lettura.
 */
class LexicalErrorListener extends BaseErrorListener {

    private static final Logger LOGGER = Logger.getLogger(LexicalErrorListener.class.getName());

    private final List<LexicalDiagnostic> diagnostics = new ArrayList<>();

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        String symbol = "";
        if (e instanceof LexerNoViableAltException lexerError) {
            int start = lexerError.getStartIndex();
            symbol = lexerError.getInputStream().getText(Interval.of(start, start));
        }

        LexicalDiagnostic diagnostic = new LexicalDiagnostic(line, charPositionInLine + 1, symbol);
        diagnostics.add(diagnostic);
        LOGGER.warning(diagnostic.toString());
    }

    List<LexicalDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
