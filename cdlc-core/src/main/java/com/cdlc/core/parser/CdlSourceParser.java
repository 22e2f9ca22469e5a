package com.cdlc.core.parser;

import com.cdlc.core.ast.CdlAst;
import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.expr.Expression;
import com.cdlc.parser.CdlLexer;
import com.cdlc.parser.CdlParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Parses CDL source text into a {@link CdlAst.StoredDefinition}.
 *
 * <p>Uses the ANTLR grammar {@code Cdl.g4}. Parsing fails fast: the first lexical or
 * syntax error, and any use of a Modelica construct that CDL excludes, raises a
 * {@link CdlException} with kind {@code SYNTAX_ERROR}.
 *
 * <p><b>Excluded constructs:</b>
 * <ul>
 *   <li>{@code redeclare}, {@code replaceable}, {@code constrainedby}, {@code inner}, {@code outer}</li>
 *   <li>{@code constant} declarations</li>
 *   <li>{@code algorithm}, {@code initial equation} and {@code initial algorithm} sections</li>
 *   <li>{@code Clock} and clock operators such as {@code sample(...)} and {@code hold(...)}</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CdlAst.StoredDefinition file = CdlSourceParser.parse(source, "Controller.mo");
 * System.out.println(file.qualifiedName());
 * }</pre>
 *
 * <p>Parsing has no side effects; the class is safe to use from several threads.
 *
 * @since 1.0.0
 */
public final class CdlSourceParser {

    private static final Logger log = LoggerFactory.getLogger(CdlSourceParser.class);

    private CdlSourceParser() {
        // Utility class
    }

    /**
     * Parses one CDL file.
     *
     * @param source file contents
     * @param fileName file name used in diagnostics, may be {@code null}
     * @return the syntax tree
     * @throws CdlException with kind {@code SYNTAX_ERROR} if the source is not valid CDL
     */
    public static CdlAst.StoredDefinition parse(String source, String fileName) {
        Objects.requireNonNull(source, "source must not be null");
        log.debug("Parsing {}", fileName != null ? fileName : "<source>");

        CdlParser parser = createParser(source, fileName);
        CdlParser.StoredDefinitionContext tree = parser.storedDefinition();
        return new CdlTreeConverter(fileName).convert(tree);
    }

    /**
     * Parses a standalone expression, e.g. a catalog default value.
     *
     * @param source expression text
     * @return the expression tree
     * @throws CdlException with kind {@code SYNTAX_ERROR} if the text is not a valid expression
     */
    public static Expression parseExpression(String source) {
        Objects.requireNonNull(source, "source must not be null");
        CdlParser parser = createParser(source, null);
        CdlParser.StandaloneExpressionContext tree = parser.standaloneExpression();
        return new CdlTreeConverter(null).expression(tree.expression());
    }

    private static CdlParser createParser(String source, String fileName) {
        SyntaxErrorListener errorListener = new SyntaxErrorListener(fileName);

        CdlLexer lexer = new CdlLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        ExcludedConstructCheck.check(tokens.getTokens(), fileName);

        CdlParser parser = new CdlParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errorListener);
        return parser;
    }
}
