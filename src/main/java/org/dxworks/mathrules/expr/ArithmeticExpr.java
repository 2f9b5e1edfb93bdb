package org.dxworks.mathrules.expr;

final class ArithmeticExpr implements ExprNode {

    private final ExprTokenType op;
    private final ExprNode left;
    private final ExprNode right;

    ArithmeticExpr(ExprTokenType op, ExprNode left, ExprNode right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    @Override
    public Value eval(EvalContext ctx) {
        double a = Coerce.toNumber(left.eval(ctx));
        double b = Coerce.toNumber(right.eval(ctx));
        switch (op) {
            case PLUS:
                return NumberValue.of(a + b);
            case MINUS:
                return NumberValue.of(a - b);
            case MULTIPLY:
                return NumberValue.of(a * b);
            case DIV:
                return NumberValue.of(a / b);
            case MOD:
                return NumberValue.of(a % b);
            default:
                throw new IllegalStateException("Not an arithmetic operator: " + op);
        }
    }
}
