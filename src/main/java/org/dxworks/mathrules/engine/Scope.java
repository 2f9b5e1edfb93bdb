package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.expr.BooleanValue;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.expr.EvalContext;
import org.dxworks.mathrules.expr.NumberValue;
import org.dxworks.mathrules.expr.StringValue;
import org.dxworks.mathrules.expr.UnboundVariableException;
import org.dxworks.mathrules.expr.Value;
import org.dxworks.mathrules.expr.VariableResolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable chain of variable bindings. Binding a name returns a new scope and leaves this one
 * untouched, so a nested rule or {@code with:} block can shadow a name without affecting the
 * instructions that follow it.
 */
public final class Scope implements VariableResolver {

    private final Scope parent;
    private final Map<String, Value> values;
    private final String name;
    private final CompiledExpression expression;
    private final EvalContext context;
    private Value cached;

    private Scope(Scope parent, Map<String, Value> values, String name, CompiledExpression expression,
                  EvalContext context, Value cached) {
        this.parent = parent;
        this.values = values;
        this.name = name;
        this.expression = expression;
        this.context = context;
        this.cached = cached;
    }

    /**
     * The outermost scope, holding preference values. Booleans and numbers keep their type;
     * anything else is bound as a string.
     */
    public static Scope root(Map<String, ?> preferences) {
        Map<String, Value> values = new LinkedHashMap<>();
        preferences.forEach((key, value) -> values.put(key, toValue(value)));
        return new Scope(null, Collections.unmodifiableMap(values), null, null, null, null);
    }

    public static Value toValue(Object value) {
        if (value instanceof Value) return (Value) value;
        if (value instanceof Boolean) return BooleanValue.of((Boolean) value);
        if (value instanceof Number) return NumberValue.of(((Number) value).doubleValue());
        return StringValue.of(value == null ? "" : value.toString());
    }

    public Scope bind(String variable, Value value) {
        return new Scope(this, null, variable, null, null, value);
    }

    /**
     * Binds {@code variable} to {@code expression}, evaluated on first lookup against
     * {@code context}'s node with this scope (the one before the binding) for variables.
     */
    public Scope bindLazily(String variable, CompiledExpression expression, EvalContext context) {
        return new Scope(this, null, variable, expression, context, null);
    }

    @Override
    public Value resolve(String variable) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.values != null) {
                Value v = s.values.get(variable);
                if (v != null) return v;
            } else if (s.name.equals(variable)) {
                return s.value();
            }
        }
        throw new UnboundVariableException(variable);
    }

    public boolean isBound(String variable) {
        for (Scope s = this; s != null; s = s.parent) {
            if (s.values != null ? s.values.containsKey(variable) : s.name.equals(variable)) return true;
        }
        return false;
    }

    private Value value() {
        if (cached == null) {
            cached = expression.evaluate(context.withVariables(parent));
        }
        return cached;
    }
}
