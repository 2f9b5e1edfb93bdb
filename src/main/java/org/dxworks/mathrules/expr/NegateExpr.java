package org.dxworks.mathrules.expr;

final class NegateExpr implements ExprNode {

    private final ExprNode operand;

    NegateExpr(ExprNode operand) {
        this.operand = operand;
    }

    @Override
    public Value eval(EvalContext ctx) {
        return NumberValue.of(-Coerce.toNumber(operand.eval(ctx)));
    }
}
