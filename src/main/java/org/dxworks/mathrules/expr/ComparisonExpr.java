package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

/**
 * XPath 1.0 comparison: a node-set compares true when any of its nodes does.
 */
final class ComparisonExpr implements ExprNode {

    private final ExprTokenType op;
    private final ExprNode left;
    private final ExprNode right;

    ComparisonExpr(ExprTokenType op, ExprNode left, ExprNode right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    @Override
    public Value eval(EvalContext ctx) {
        return BooleanValue.of(compare(op, left.eval(ctx), right.eval(ctx)));
    }

    static boolean compare(ExprTokenType op, Value l, Value r) {
        if (l instanceof NodeSetValue && r instanceof NodeSetValue) {
            for (Node a : ((NodeSetValue) l).nodes()) {
                for (Node b : ((NodeSetValue) r).nodes()) {
                    if (compareAtoms(op, StringValue.of(a.stringValue()), StringValue.of(b.stringValue()))) {
                        return true;
                    }
                }
            }
            return false;
        }
        if (l instanceof NodeSetValue) {
            return compareNodeSet(op, (NodeSetValue) l, r, false);
        }
        if (r instanceof NodeSetValue) {
            return compareNodeSet(op, (NodeSetValue) r, l, true);
        }
        return compareAtoms(op, l, r);
    }

    private static boolean compareNodeSet(ExprTokenType op, NodeSetValue nodes, Value other, boolean swapped) {
        if (other instanceof BooleanValue) {
            Value b = BooleanValue.of(!nodes.isEmpty());
            return swapped ? compareAtoms(op, other, b) : compareAtoms(op, b, other);
        }
        for (Node n : nodes.nodes()) {
            Value v = other instanceof NumberValue
                    ? NumberValue.of(Coerce.parseNumber(n.stringValue()))
                    : StringValue.of(n.stringValue());
            if (swapped ? compareAtoms(op, other, v) : compareAtoms(op, v, other)) {
                return true;
            }
        }
        return false;
    }

    private static boolean compareAtoms(ExprTokenType op, Value l, Value r) {
        if (op == ExprTokenType.EQ || op == ExprTokenType.NE) {
            boolean eq;
            if (l instanceof BooleanValue || r instanceof BooleanValue) {
                eq = Coerce.toBoolean(l) == Coerce.toBoolean(r);
            } else if (l instanceof NumberValue || r instanceof NumberValue) {
                eq = Coerce.toNumber(l) == Coerce.toNumber(r);
            } else {
                eq = Coerce.toString(l).equals(Coerce.toString(r));
            }
            return op == ExprTokenType.EQ ? eq : !eq;
        }
        double a = Coerce.toNumber(l);
        double b = Coerce.toNumber(r);
        switch (op) {
            case LT:
                return a < b;
            case LE:
                return a <= b;
            case GT:
                return a > b;
            case GE:
                return a >= b;
            default:
                throw new IllegalStateException("Not a comparison operator: " + op);
        }
    }
}
