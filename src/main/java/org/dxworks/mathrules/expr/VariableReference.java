package org.dxworks.mathrules.expr;

final class VariableReference implements ExprNode {

    private final String name;

    VariableReference(String name) {
        this.name = name;
    }

    @Override
    public Value eval(EvalContext ctx) {
        return ctx.getVariables().resolve(name);
    }
}
