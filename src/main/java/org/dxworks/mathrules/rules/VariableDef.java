package org.dxworks.mathrules.rules;

import org.dxworks.mathrules.expr.CompiledExpression;

public final class VariableDef {

    private final String name;
    private final CompiledExpression expression;

    public VariableDef(String name, CompiledExpression expression) {
        this.name = name;
        this.expression = expression;
    }

    public String getName() {
        return name;
    }

    public CompiledExpression getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return name + ": " + expression.getSource();
    }
}
