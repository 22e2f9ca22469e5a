package com.cdlc.core.parser;

import com.cdlc.core.diagnostics.CdlException;
import com.cdlc.core.diagnostics.ErrorKind;
import com.cdlc.core.diagnostics.SourceLocation;
import com.cdlc.core.expr.BinaryOperator;
import com.cdlc.core.expr.Expression;
import com.cdlc.core.expr.UnaryOperator;
import com.cdlc.parser.CdlBaseVisitor;
import com.cdlc.parser.CdlParser;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts expression parse trees into the closed {@link Expression} tree.
 */
final class ExpressionConverter extends CdlBaseVisitor<Expression> {

    private final String fileName;

    ExpressionConverter(String fileName) {
        this.fileName = fileName;
    }

    @Override
    public Expression visitPrimaryExpression(CdlParser.PrimaryExpressionContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Expression visitPowerExpression(CdlParser.PowerExpressionContext ctx) {
        return new Expression.Binary(BinaryOperator.POWER, visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public Expression visitUnaryExpression(CdlParser.UnaryExpressionContext ctx) {
        UnaryOperator operator = ctx.op.getType() == CdlParser.MINUS ? UnaryOperator.MINUS : UnaryOperator.PLUS;
        return new Expression.Unary(operator, visit(ctx.expression()));
    }

    @Override
    public Expression visitNotExpression(CdlParser.NotExpressionContext ctx) {
        return new Expression.Unary(UnaryOperator.NOT, visit(ctx.expression()));
    }

    @Override
    public Expression visitMultiplicativeExpression(CdlParser.MultiplicativeExpressionContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitAdditiveExpression(CdlParser.AdditiveExpressionContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitRelationalExpression(CdlParser.RelationalExpressionContext ctx) {
        return binary(ctx.op.getText(), ctx.expression(0), ctx.expression(1));
    }

    @Override
    public Expression visitAndExpression(CdlParser.AndExpressionContext ctx) {
        return new Expression.Binary(BinaryOperator.AND, visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public Expression visitOrExpression(CdlParser.OrExpressionContext ctx) {
        return new Expression.Binary(BinaryOperator.OR, visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public Expression visitConditionalExpression(CdlParser.ConditionalExpressionContext ctx) {
        return new Expression.Conditional(
            visit(ctx.expression(0)), visit(ctx.expression(1)), visit(ctx.expression(2)));
    }

    @Override
    public Expression visitNumberLiteral(CdlParser.NumberLiteralContext ctx) {
        String text = ctx.UNSIGNED_NUMBER().getText();
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            try {
                return new Expression.IntegerLiteral(Integer.parseInt(text));
            } catch (NumberFormatException e) {
                // too large for Integer, keep it as a Real literal
                return new Expression.RealLiteral(Double.parseDouble(text));
            }
        }
        return new Expression.RealLiteral(Double.parseDouble(text));
    }

    @Override
    public Expression visitStringLiteral(CdlParser.StringLiteralContext ctx) {
        return new Expression.StringLiteral(unquote(ctx.STRING().getText()));
    }

    @Override
    public Expression visitBooleanLiteral(CdlParser.BooleanLiteralContext ctx) {
        return new Expression.BooleanLiteral(ctx.TRUE() != null);
    }

    @Override
    public Expression visitFunctionCall(CdlParser.FunctionCallContext ctx) {
        String function = dottedName(ctx.name());
        if (ExcludedConstructCheck.isClockOperator(function)) {
            throw CdlException.of(ErrorKind.SYNTAX_ERROR, null,
                new SourceLocation(fileName, ctx.getStart().getLine(), ctx.getStart().getCharPositionInLine()),
                "Clock operator '" + function + "' is not permitted in CDL",
                function);
        }
        List<Expression.Argument> arguments = new ArrayList<>();
        for (CdlParser.FunctionArgumentContext argument : ctx.functionCallArgs().functionArgument()) {
            String name = argument.IDENT() != null ? argument.IDENT().getText() : null;
            arguments.add(new Expression.Argument(name, visit(argument.expression())));
        }
        return new Expression.Call(function, arguments);
    }

    @Override
    public Expression visitReferencePrimary(CdlParser.ReferencePrimaryContext ctx) {
        List<CdlParser.ReferencePartContext> parts = ctx.componentReference().referencePart();
        StringBuilder name = new StringBuilder();
        Expression index = null;
        for (int i = 0; i < parts.size(); i++) {
            CdlParser.ReferencePartContext part = parts.get(i);
            if (i > 0) {
                name.append('.');
            }
            name.append(part.IDENT().getText());
            if (part.arraySubscripts() == null) {
                continue;
            }
            List<CdlParser.ExpressionContext> subscripts = part.arraySubscripts().expression();
            if (i < parts.size() - 1 || subscripts.size() > 1) {
                throw CdlException.of(ErrorKind.SYNTAX_ERROR, null,
                    new SourceLocation(fileName, part.getStart().getLine(), part.getStart().getCharPositionInLine()),
                    "Only a single subscript on the last name part is supported in expressions",
                    ctx.getText());
            }
            index = visit(subscripts.get(0));
        }
        return new Expression.Reference(name.toString(), index);
    }

    @Override
    public Expression visitParenthesized(CdlParser.ParenthesizedContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Expression visitArrayConstructor(CdlParser.ArrayConstructorContext ctx) {
        List<Expression> elements = new ArrayList<>();
        for (CdlParser.ExpressionContext element : ctx.expression()) {
            elements.add(visit(element));
        }
        return new Expression.ArrayConstructor(elements);
    }

    private Expression binary(String symbol, CdlParser.ExpressionContext left, CdlParser.ExpressionContext right) {
        return new Expression.Binary(BinaryOperator.fromSymbol(symbol), visit(left), visit(right));
    }

    static String dottedName(CdlParser.NameContext ctx) {
        StringBuilder sb = new StringBuilder();
        for (TerminalNode ident : ctx.IDENT()) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(ident.getText());
        }
        return sb.toString();
    }

    /**
     * Strips the surrounding quotes of a string token and resolves escape sequences.
     */
    static String unquote(String token) {
        String body = token.substring(1, token.length() - 1);
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 == body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }
}
