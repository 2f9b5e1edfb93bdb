package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

import java.util.ArrayList;
import java.util.List;

final class UnionExpr implements ExprNode {

    private final ExprNode left;
    private final ExprNode right;

    UnionExpr(ExprNode left, ExprNode right) {
        this.left = left;
        this.right = right;
    }

    @Override
    public Value eval(EvalContext ctx) {
        NodeSetValue l = Coerce.toNodeSet(left.eval(ctx), "'|'");
        NodeSetValue r = Coerce.toNodeSet(right.eval(ctx), "'|'");
        List<Node> all = new ArrayList<>(l.nodes());
        all.addAll(r.nodes());
        return NodeSetValue.of(all);
    }
}
