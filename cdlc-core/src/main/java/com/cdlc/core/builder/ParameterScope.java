package com.cdlc.core.builder;

import com.cdlc.core.catalog.BlockCatalog;
import com.cdlc.core.expr.Environment;
import com.cdlc.core.expr.EvaluationException;
import com.cdlc.core.expr.EvaluationException.Reason;
import com.cdlc.core.expr.Expression;
import com.cdlc.core.expr.ExpressionEvaluator;
import com.cdlc.core.model.BindingOrigin;
import com.cdlc.core.model.ParameterBinding;
import com.cdlc.core.model.ParameterDecl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parameter environment of one block scope.
 *
 * <p>Each parameter is evaluated on first use, in the environment its expression was
 * written in: an explicit binding such as {@code gain(k=2*p)} is evaluated in the
 * enclosing scope, a declared default in the scope of the block itself. Names that are
 * not parameters are resolved as enumeration literals of the catalog.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ParameterScope outer = new ParameterScope(catalog);
 * outer.declare(pDecl, pDecl.defaultValue(), BindingOrigin.DEFAULT, null);
 *
 * ParameterScope gain = new ParameterScope(catalog);
 * gain.declare(kDecl, parse("2*p"), BindingOrigin.EXPLICIT, outer);
 * Object k = gain.lookup("k");
 * }</pre>
 *
 * <p>Not thread-safe; a scope belongs to a single compilation.
 */
public final class ParameterScope implements Environment {

    private final BlockCatalog catalog;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, Object> values = new HashMap<>();
    private final Set<String> evaluating = new HashSet<>();

    private record Entry(ParameterDecl decl, Expression expression, BindingOrigin origin, Environment environment) {
    }

    /**
     * Creates an empty scope.
     *
     * @param catalog catalog used to resolve enumeration literals
     */
    public ParameterScope(BlockCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Declares a parameter.
     *
     * @param decl declaration
     * @param expression binding or default expression, or {@code null} if unbound
     * @param origin where the expression comes from
     * @param environment environment the expression is evaluated in, or {@code null} for this scope
     */
    public void declare(ParameterDecl decl, Expression expression, BindingOrigin origin, Environment environment) {
        entries.put(decl.name(), new Entry(decl, expression, origin, environment));
    }

    public boolean isDeclared(String name) {
        return entries.containsKey(name);
    }

    @Override
    public Object lookup(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            return catalog.enumerationLiteral(name)
                .orElseThrow(() -> new EvaluationException(Reason.UNKNOWN_NAME, name, "Unknown name: " + name));
        }
        if (values.containsKey(name)) {
            return values.get(name);
        }
        if (entry.expression() == null) {
            throw new EvaluationException(Reason.UNBOUND, name, "Parameter " + name + " has no value");
        }
        if (!evaluating.add(name)) {
            throw new EvaluationException(Reason.INVALID, name, "Parameter " + name + " is defined in terms of itself");
        }
        try {
            Environment environment = entry.environment() != null ? entry.environment() : this;
            Object raw = ExpressionEvaluator.evaluate(entry.expression(), environment);
            Object value = ParameterValues.conform(entry.decl(), raw, declaredSize(entry.decl()));
            values.put(name, value);
            return value;
        } finally {
            evaluating.remove(name);
        }
    }

    /**
     * Evaluates an array dimension expression in this scope.
     *
     * @param dimension dimension expression
     * @return the non-negative size
     * @throws EvaluationException if the expression is not a non-negative Integer constant
     */
    public int evaluateSize(Expression dimension) {
        Object value = ExpressionEvaluator.evaluate(dimension, this);
        if (!(value instanceof Integer size)) {
            throw new EvaluationException(Reason.TYPE, dimension.toSource(),
                "Array dimension '" + dimension.toSource() + "' must be an Integer, was "
                    + ParameterValues.describe(value));
        }
        if (size < 0) {
            throw new EvaluationException(Reason.DIMENSION, dimension.toSource(),
                "Array dimension '" + dimension.toSource() + "' must not be negative, was " + size);
        }
        return size;
    }

    /**
     * Evaluates a parameter, returning empty when it has no value.
     *
     * @param name parameter name
     * @return value, or empty if the parameter or one it depends on is unbound
     * @throws EvaluationException for any other evaluation failure
     */
    public Optional<Object> valueOf(String name) {
        try {
            return Optional.of(lookup(name));
        } catch (EvaluationException e) {
            if (e.getReason() == Reason.UNBOUND) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Returns the bindings of all declared parameters with their values.
     *
     * <p>Only values computed so far are included; parameters that were not evaluated, or
     * failed to evaluate, get a {@code null} value. Call {@link #valueOf(String)} first.
     *
     * @return bindings in declaration order
     */
    public List<ParameterBinding> bindings() {
        List<ParameterBinding> result = new ArrayList<>();
        for (Entry entry : entries.values()) {
            String name = entry.decl().name();
            result.add(new ParameterBinding(name, entry.expression(), values.get(name), entry.origin()));
        }
        return result;
    }

    private Integer declaredSize(ParameterDecl decl) {
        if (!decl.isArray()) {
            return null;
        }
        try {
            return evaluateSize(decl.dimension());
        } catch (EvaluationException e) {
            if (e.getReason() == Reason.UNBOUND) {
                return null;
            }
            throw e;
        }
    }
}
