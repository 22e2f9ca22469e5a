package com.cdlc.core.expr;

import com.cdlc.core.expr.EvaluationException.Reason;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Eager evaluator for the restricted CDL expression grammar.
 *
 * <p>Values are represented as {@link Double} (Real), {@link Integer}, {@link Boolean},
 * {@link String}, {@link EnumValue} and {@link List} (1-D arrays).
 *
 * <p>Integer arithmetic stays Integer except for {@code /} and {@code ^}, which always
 * yield Real. Mixed Integer/Real operands are widened to Real. Integer results that
 * leave the 32-bit range are rejected, never wrapped.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
        // Utility class
    }

    /**
     * Evaluates an expression.
     *
     * @param expression expression to evaluate
     * @param environment name lookup
     * @return evaluated value, never {@code null}
     * @throws EvaluationException if the expression is not a constant in {@code environment}
     */
    public static Object evaluate(Expression expression, Environment environment) {
        Objects.requireNonNull(expression, "expression must not be null");

        if (expression instanceof Expression.RealLiteral real) {
            return real.value();
        }
        if (expression instanceof Expression.IntegerLiteral integer) {
            return integer.value();
        }
        if (expression instanceof Expression.BooleanLiteral bool) {
            return bool.value();
        }
        if (expression instanceof Expression.StringLiteral string) {
            return string.value();
        }
        if (expression instanceof Expression.Reference reference) {
            return evaluateReference(reference, environment);
        }
        if (expression instanceof Expression.Unary unary) {
            return evaluateUnary(unary, evaluate(unary.operand(), environment));
        }
        if (expression instanceof Expression.Binary binary) {
            Object left = evaluate(binary.left(), environment);
            Object right = evaluate(binary.right(), environment);
            return evaluateBinary(binary, left, right);
        }
        if (expression instanceof Expression.Conditional conditional) {
            Object condition = evaluate(conditional.condition(), environment);
            if (!(condition instanceof Boolean flag)) {
                throw typeError(conditional.condition(), "condition must be Boolean");
            }
            return evaluate(flag ? conditional.whenTrue() : conditional.whenFalse(), environment);
        }
        if (expression instanceof Expression.ArrayConstructor array) {
            List<Object> values = new ArrayList<>(array.elements().size());
            for (Expression element : array.elements()) {
                values.add(evaluate(element, environment));
            }
            return List.copyOf(values);
        }
        if (expression instanceof Expression.Call call) {
            throw new EvaluationException(Reason.UNSUPPORTED, call.toSource(),
                "Function calls are not permitted in parameter expressions: " + call.function());
        }
        throw new EvaluationException(Reason.UNSUPPORTED, expression.toSource(),
            "Unsupported expression: " + expression.toSource());
    }

    private static Object evaluateReference(Expression.Reference reference, Environment environment) {
        Object value = environment.lookup(reference.name());
        if (reference.index() == null) {
            return value;
        }
        if (!(value instanceof List<?> list)) {
            throw typeError(reference, reference.name() + " is not an array");
        }
        Object index = evaluate(reference.index(), environment);
        if (!(index instanceof Integer position)) {
            throw typeError(reference.index(), "array index must be Integer");
        }
        if (position < 1 || position > list.size()) {
            throw new EvaluationException(Reason.DIMENSION, reference.toSource(),
                "Index " + position + " out of range 1.." + list.size() + " for " + reference.name());
        }
        return list.get(position - 1);
    }

    private static Object evaluateUnary(Expression.Unary unary, Object operand) {
        if (unary.operator() == UnaryOperator.NOT) {
            if (operand instanceof Boolean flag) {
                return !flag;
            }
            throw typeError(unary, "'not' requires a Boolean operand");
        }
        if (operand instanceof Integer i) {
            if (unary.operator() != UnaryOperator.MINUS) {
                return i;
            }
            try {
                return Math.negateExact(i);
            } catch (ArithmeticException e) {
                throw overflow(unary, e);
            }
        }
        if (operand instanceof Double d) {
            return unary.operator() == UnaryOperator.MINUS ? -d : d;
        }
        throw typeError(unary, "unary '" + unary.operator().getSymbol() + "' requires a numeric operand");
    }

    private static Object evaluateBinary(Expression.Binary binary, Object left, Object right) {
        BinaryOperator op = binary.operator();

        if (op.isLogical()) {
            if (left instanceof Boolean a && right instanceof Boolean b) {
                return op == BinaryOperator.AND ? a && b : a || b;
            }
            throw typeError(binary, "'" + op.getSymbol() + "' requires Boolean operands");
        }

        if (op == BinaryOperator.ADD && left instanceof String a && right instanceof String b) {
            return a + b;
        }

        if (op.isArithmetic()) {
            if (!isNumber(left) || !isNumber(right)) {
                throw typeError(binary, "'" + op.getSymbol() + "' requires numeric operands");
            }
            return arithmetic(binary, op, (Number) left, (Number) right);
        }

        return compare(binary, op, left, right);
    }

    private static Object arithmetic(Expression.Binary binary, BinaryOperator op, Number left, Number right) {
        boolean integral = left instanceof Integer && right instanceof Integer;
        if (op == BinaryOperator.DIVIDE && right.doubleValue() == 0.0) {
            throw new EvaluationException(Reason.INVALID, binary.toSource(), "Division by zero");
        }
        if (integral && op != BinaryOperator.DIVIDE && op != BinaryOperator.POWER) {
            int a = left.intValue();
            int b = right.intValue();
            try {
                return switch (op) {
                    case ADD -> Math.addExact(a, b);
                    case SUBTRACT -> Math.subtractExact(a, b);
                    default -> Math.multiplyExact(a, b);
                };
            } catch (ArithmeticException e) {
                throw overflow(binary, e);
            }
        }
        double a = left.doubleValue();
        double b = right.doubleValue();
        return switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> a / b;
            default -> Math.pow(a, b);
        };
    }

    private static Object compare(Expression.Binary binary, BinaryOperator op, Object left, Object right) {
        if (isNumber(left) && isNumber(right)) {
            int cmp = Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
            return switch (op) {
                case LESS -> cmp < 0;
                case LESS_EQUAL -> cmp <= 0;
                case GREATER -> cmp > 0;
                case GREATER_EQUAL -> cmp >= 0;
                case EQUAL -> cmp == 0;
                default -> cmp != 0;
            };
        }
        if ((op == BinaryOperator.EQUAL || op == BinaryOperator.NOT_EQUAL)
            && left.getClass().equals(right.getClass())) {
            boolean equal = left.equals(right);
            return op == BinaryOperator.EQUAL ? equal : !equal;
        }
        throw typeError(binary, "operands of '" + op.getSymbol() + "' are not comparable");
    }

    private static boolean isNumber(Object value) {
        return value instanceof Integer || value instanceof Double;
    }

    private static EvaluationException overflow(Expression expression, ArithmeticException cause) {
        return new EvaluationException(Reason.INVALID, expression.toSource(),
            "Integer overflow in '" + expression.toSource() + "'", cause);
    }

    private static EvaluationException typeError(Expression expression, String message) {
        return new EvaluationException(Reason.TYPE, expression.toSource(), "Type error in '" + expression.toSource() + "': " + message);
    }
}
