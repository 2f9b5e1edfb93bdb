package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.engine.Scope;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.rules.VariableDef;

import java.util.List;

/**
 * {@code with:} binds its variables in a child scope for the nested instructions only.
 * Each variable is evaluated against the bindings declared before it, so
 * {@code concat($Context, '↑')} sees the enclosing value.
 */
public class WithInstruction implements Instruction {

    private final List<VariableDef> variables;
    private final List<Instruction> body;

    public WithInstruction(List<VariableDef> variables, List<Instruction> body) {
        this.variables = List.copyOf(variables);
        this.body = List.copyOf(body);
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        Scope inner = ctx.bindAll(variables);
        ctx.withScope(inner).run(body, out);
    }
}
