package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.output.OutputSink;

import java.util.List;

/**
 * {@code test:} runs the first branch whose condition holds, else the {@code else} list (if any).
 * {@code then_test}/{@code else_test} are compiled to a nested test as the branch body.
 */
public class TestInstruction implements Instruction {

    public static final class Branch {
        private final CompiledExpression condition;
        private final List<Instruction> then;

        public Branch(CompiledExpression condition, List<Instruction> then) {
            this.condition = condition;
            this.then = List.copyOf(then);
        }
    }

    private final List<Branch> branches;
    private final List<Instruction> otherwise;

    public TestInstruction(List<Branch> branches, List<Instruction> otherwise) {
        this.branches = List.copyOf(branches);
        this.otherwise = List.copyOf(otherwise);
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        for (Branch branch : branches) {
            if (ctx.evaluateBoolean(branch.condition)) {
                ctx.run(branch.then, out);
                return;
            }
        }
        ctx.run(otherwise, out);
    }
}
