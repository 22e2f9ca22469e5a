package com.cdlc.core.parser;

import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.diagnostics.SourceLocation;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * ANTLR error listener that aborts on the first lexer or parser error.
 *
 * <p>The reported diagnostic names the offending token and its position.
 */
final class SyntaxErrorListener extends BaseErrorListener {

    private final String fileName;

    SyntaxErrorListener(String fileName) {
        this.fileName = fileName;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                            int charPositionInLine, String msg, RecognitionException e) {
        String token = offendingSymbol instanceof Token t ? describe(t) : "input";
        throw CdlException.of(
            ErrorKind.SYNTAX_ERROR,
            null,
            new SourceLocation(fileName, line, charPositionInLine),
            "Unexpected " + token + ": " + msg,
            token
        );
    }

    static String describe(Token token) {
        if (token.getType() == Token.EOF) {
            return "end of file";
        }
        return "'" + token.getText() + "'";
    }
}
