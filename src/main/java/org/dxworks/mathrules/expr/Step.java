package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

import java.util.ArrayList;
import java.util.List;

final class Step {

    private final Axis axis;
    private final NodeTest test;
    private final List<ExprNode> predicates;

    Step(Axis axis, NodeTest test, List<ExprNode> predicates) {
        this.axis = axis;
        this.test = test;
        this.predicates = List.copyOf(predicates);
    }

    static Step descendantOrSelf() {
        return new Step(Axis.DESCENDANT_OR_SELF, NodeTest.ANY_NODE, List.of());
    }

    List<Node> apply(Node node, EvalContext ctx) {
        List<Node> matched = new ArrayList<>();
        for (Node candidate : axis.select(node)) {
            if (test.matches(candidate, axis)) matched.add(candidate);
        }
        return predicates.isEmpty() ? matched : Predicates.filter(matched, predicates, ctx);
    }

    /**
     * This step applied to the document node above {@code root}.
     */
    List<Node> applyFromDocument(Node root, EvalContext ctx) {
        List<Node> candidates;
        switch (axis) {
            case CHILD:
                candidates = List.of(root);
                break;
            case DESCENDANT:
            case DESCENDANT_OR_SELF:
                candidates = Axis.DESCENDANT_OR_SELF.select(root);
                break;
            default:
                candidates = List.of();
                break;
        }
        List<Node> matched = new ArrayList<>();
        for (Node candidate : candidates) {
            if (test.matches(candidate, axis)) matched.add(candidate);
        }
        return predicates.isEmpty() ? matched : Predicates.filter(matched, predicates, ctx);
    }

    static NodeSetValue applyAll(List<Node> start, List<Step> steps, EvalContext ctx) {
        List<Node> current = start;
        for (Step step : steps) {
            List<Node> next = new ArrayList<>();
            for (Node node : current) {
                next.addAll(step.apply(node, ctx));
            }
            current = NodeSetValue.of(next).nodes();
        }
        return NodeSetValue.of(current);
    }
}
