package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

import java.util.List;

/**
 * A primary expression with predicates, e.g. {@code $Prescripts[2]} or {@code BaseNode(.)[self::m:mi]},
 * optionally continued by location steps.
 */
final class FilterExpr implements ExprNode {

    private final ExprNode primary;
    private final List<ExprNode> predicates;
    private final List<Step> steps;

    FilterExpr(ExprNode primary, List<ExprNode> predicates, List<Step> steps) {
        this.primary = primary;
        this.predicates = List.copyOf(predicates);
        this.steps = List.copyOf(steps);
    }

    @Override
    public Value eval(EvalContext ctx) {
        Value value = primary.eval(ctx);
        if (predicates.isEmpty() && steps.isEmpty()) return value;
        NodeSetValue nodes = Coerce.toNodeSet(value, predicates.isEmpty() ? "a path" : "a predicate");
        List<Node> filtered = Predicates.filter(nodes.nodes(), predicates, ctx);
        return Step.applyAll(filtered, steps, ctx);
    }
}
