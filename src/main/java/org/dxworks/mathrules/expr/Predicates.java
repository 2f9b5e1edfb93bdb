package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

import java.util.ArrayList;
import java.util.List;

final class Predicates {

    private Predicates() {
        // utility class
    }

    /**
     * Applies each predicate in turn; positions count in the order of {@code nodes}.
     */
    static List<Node> filter(List<Node> nodes, List<ExprNode> predicates, EvalContext ctx) {
        List<Node> current = nodes;
        for (ExprNode predicate : predicates) {
            List<Node> kept = new ArrayList<>();
            int size = current.size();
            for (int i = 0; i < size; i++) {
                Node node = current.get(i);
                Value v = predicate.eval(ctx.at(node, i + 1, size));
                boolean keep = v instanceof NumberValue
                        ? ((NumberValue) v).get() == i + 1
                        : Coerce.toBoolean(v);
                if (keep) kept.add(node);
            }
            current = kept;
        }
        return current;
    }
}
