package com.cdlc.core.parser;

import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.parser.CdlLexer;
import org.antlr.v4.runtime.Token;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Token-level check for Modelica constructs that CDL excludes.
 *
 * <p>Runs over the full token stream before parsing so that excluded keywords fail with
 * the position of the keyword, not with a generic parse error further down the file.
 * Clock constructs depend on where a name appears; the tree converters reject the
 * {@code Clock} type and calls of clock operators through {@link #isClockType} and
 * {@link #isClockOperator}.
 */
final class ExcludedConstructCheck {

    private static final Map<Integer, String> EXCLUDED_KEYWORDS = Map.of(
        CdlLexer.REDECLARE, "redeclare",
        CdlLexer.REPLACEABLE, "replaceable",
        CdlLexer.CONSTRAINEDBY, "constrainedby",
        CdlLexer.INNER, "inner",
        CdlLexer.OUTER, "outer",
        CdlLexer.CONSTANT, "constant",
        CdlLexer.ALGORITHM, "algorithm",
        CdlLexer.INITIAL, "initial"
    );

    private static final String CLOCK_TYPE = "Clock";

    private static final Set<String> CLOCK_OPERATORS = Set.of(
        "sample", "subSample", "superSample", "shiftSample", "backSample",
        "hold", "previous", "noClock", "interval", "firstTick"
    );

    private ExcludedConstructCheck() {
        // Utility class
    }

    static boolean isClockType(String typeName) {
        return CLOCK_TYPE.equals(typeName);
    }

    /**
     * Tells whether a called function is a clock operator or the clock constructor.
     *
     * @param functionName dotted name of the called function
     * @return {@code true} if a call of it is a clocked construct
     */
    static boolean isClockOperator(String functionName) {
        return CLOCK_TYPE.equals(functionName) || CLOCK_OPERATORS.contains(functionName);
    }

    /**
     * Fails on the first excluded keyword in {@code tokens}.
     *
     * @param tokens all tokens of the source, in order
     * @param fileName file name for diagnostics
     * @throws CdlException with {@code SYNTAX_ERROR}
     */
    static void check(List<Token> tokens, String fileName) {
        for (Token token : tokens) {
            String keyword = EXCLUDED_KEYWORDS.get(token.getType());
            if (keyword != null) {
                throw reject(token, fileName, "'" + keyword + "' is not permitted in CDL");
            }
            if (token.getType() == CdlLexer.ERROR_CHAR) {
                throw reject(token, fileName, "Unexpected character '" + token.getText() + "'");
            }
        }
    }

    private static CdlException reject(Token token, String fileName, String message) {
        return CdlException.of(
            ErrorKind.SYNTAX_ERROR,
            null,
            new SourceLocation(fileName, token.getLine(), token.getCharPositionInLine()),
            message,
            token.getText()
        );
    }
}
