package com.cdlc.core.expr;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Closed expression tree used for parameter bindings, defaults and array dimensions.
 *
 * <p>Only literals, references, restricted arithmetic, comparisons, boolean operators,
 * array constructors and conditional expressions are representable. Function calls are
 * kept so annotations can be parsed, but {@link ExpressionEvaluator} rejects them.
 */
public interface Expression {

    /**
     * Renders the expression back to CDL notation.
     *
     * @return source text
     */
    String toSource();

    /**
     * Real literal, e.g. {@code 1.5} or {@code 2e-3}.
     *
     * @param value literal value
     */
    record RealLiteral(double value) implements Expression {
        @Override
        public String toSource() {
            return Double.toString(value);
        }
    }

    /**
     * Integer literal.
     *
     * @param value literal value
     */
    record IntegerLiteral(int value) implements Expression {
        @Override
        public String toSource() {
            return Integer.toString(value);
        }
    }

    /**
     * Boolean literal.
     *
     * @param value literal value
     */
    record BooleanLiteral(boolean value) implements Expression {
        @Override
        public String toSource() {
            return Boolean.toString(value);
        }
    }

    /**
     * String literal, stored without quotes and with escapes resolved.
     *
     * @param value literal value
     */
    record StringLiteral(String value) implements Expression {
        @Override
        public String toSource() {
            return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
    }

    /**
     * Reference to a parameter or an enumeration literal.
     *
     * @param name dotted name as written
     * @param index optional 1-based subscript on the last name part
     */
    record Reference(String name, Expression index) implements Expression {
        @Override
        public String toSource() {
            return index == null ? name : name + "[" + index.toSource() + "]";
        }
    }

    /**
     * Prefix operator application.
     *
     * @param operator operator
     * @param operand operand
     */
    record Unary(UnaryOperator operator, Expression operand) implements Expression {
        @Override
        public String toSource() {
            return operator.getSymbol() + (operator == UnaryOperator.NOT ? " " : "") + operand.toSource();
        }
    }

    /**
     * Infix operator application.
     *
     * @param operator operator
     * @param left left operand
     * @param right right operand
     */
    record Binary(BinaryOperator operator, Expression left, Expression right) implements Expression {
        @Override
        public String toSource() {
            return "(" + left.toSource() + " " + operator.getSymbol() + " " + right.toSource() + ")";
        }
    }

    /**
     * {@code if c then a else b}.
     *
     * @param condition condition
     * @param whenTrue value when the condition holds
     * @param whenFalse value otherwise
     */
    record Conditional(Expression condition, Expression whenTrue, Expression whenFalse) implements Expression {
        @Override
        public String toSource() {
            return "if " + condition.toSource() + " then " + whenTrue.toSource() + " else " + whenFalse.toSource();
        }
    }

    /**
     * Array constructor {@code {a, b, c}}.
     *
     * @param elements element expressions
     */
    record ArrayConstructor(List<Expression> elements) implements Expression {
        public ArrayConstructor {
            elements = List.copyOf(elements);
        }

        @Override
        public String toSource() {
            return elements.stream().map(Expression::toSource).collect(Collectors.joining(", ", "{", "}"));
        }
    }

    /**
     * Function call such as {@code Placement(transformation(...))} or {@code sin(x)}.
     *
     * @param function dotted function name
     * @param arguments positional and named arguments
     */
    record Call(String function, List<Argument> arguments) implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
        }

        @Override
        public String toSource() {
            return function + arguments.stream()
                .map(a -> a.name() == null ? a.value().toSource() : a.name() + "=" + a.value().toSource())
                .collect(Collectors.joining(", ", "(", ")"));
        }
    }

    /**
     * Function call argument.
     *
     * @param name argument name, or {@code null} for positional arguments
     * @param value argument value
     */
    record Argument(String name, Expression value) {
    }
}
