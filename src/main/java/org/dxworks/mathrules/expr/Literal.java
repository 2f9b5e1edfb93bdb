package org.dxworks.mathrules.expr;

final class Literal implements ExprNode {

    private final Value value;

    Literal(Value value) {
        this.value = value;
    }

    @Override
    public Value eval(EvalContext ctx) {
        return value;
    }
}
