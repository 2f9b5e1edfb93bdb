package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.output.TokenKind;

public class SpellInstruction implements Instruction {

    private final CompiledExpression text;

    public SpellInstruction(CompiledExpression text) {
        this.text = text;
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        out.control(TokenKind.SPELL, ctx.evaluateString(text));
    }
}
