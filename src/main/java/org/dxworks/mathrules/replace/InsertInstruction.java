package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.expr.Coerce;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.expr.EvaluationTypeException;
import org.dxworks.mathrules.expr.NodeSetValue;
import org.dxworks.mathrules.expr.Value;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.tree.Node;

import java.util.List;

/**
 * {@code insert:} dispatches on each selected node and runs the separator between consecutive nodes.
 */
public class InsertInstruction implements Instruction {

    private final CompiledExpression nodes;
    private final List<Instruction> separator;

    public InsertInstruction(CompiledExpression nodes, List<Instruction> separator) {
        this.nodes = nodes;
        this.separator = List.copyOf(separator);
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        Value value = ctx.evaluate(nodes);
        NodeSetValue selected;
        try {
            selected = Coerce.toNodeSet(value, "insert: nodes");
        } catch (EvaluationTypeException e) {
            throw ctx.error(e.getMessage(), e);
        }
        List<Node> list = selected.nodes();
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                ctx.run(separator, out);
            }
            ctx.dispatch(list.get(i), out);
        }
    }
}
