package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.output.OutputSink;

/**
 * {@code x:} recurses into the selected nodes in document order, or emits a scalar result as text.
 */
public class NodeInstruction implements Instruction {

    private final CompiledExpression select;

    public NodeInstruction(CompiledExpression select) {
        this.select = select;
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        ctx.emit(ctx.evaluate(select), out);
    }
}
