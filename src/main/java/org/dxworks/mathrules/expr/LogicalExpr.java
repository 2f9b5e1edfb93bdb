package org.dxworks.mathrules.expr;

/**
 * {@code and} / {@code or}; the right operand is only evaluated when it decides the result.
 */
final class LogicalExpr implements ExprNode {

    private final boolean and;
    private final ExprNode left;
    private final ExprNode right;

    LogicalExpr(boolean and, ExprNode left, ExprNode right) {
        this.and = and;
        this.left = left;
        this.right = right;
    }

    @Override
    public Value eval(EvalContext ctx) {
        boolean l = Coerce.toBoolean(left.eval(ctx));
        if (and && !l) return BooleanValue.FALSE;
        if (!and && l) return BooleanValue.TRUE;
        return BooleanValue.of(Coerce.toBoolean(right.eval(ctx)));
    }
}
