package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

import java.util.List;

final class LocationPath implements ExprNode {

    private final boolean absolute;
    private final List<Step> steps;

    LocationPath(boolean absolute, List<Step> steps) {
        this.absolute = absolute;
        this.steps = List.copyOf(steps);
    }

    @Override
    public Value eval(EvalContext ctx) {
        Node start = ctx.getNode();
        if (start == null) return NodeSetValue.EMPTY;
        if (!absolute) {
            return Step.applyAll(List.of(start), steps, ctx);
        }
        Node root = start.root();
        if (steps.isEmpty()) {
            return NodeSetValue.of(root);
        }
        // the first step starts at the (implicit) document node whose only child is the root
        List<Node> top = steps.get(0).applyFromDocument(root, ctx);
        return Step.applyAll(top, steps.subList(1, steps.size()), ctx);
    }
}
