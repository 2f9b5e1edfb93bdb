package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.output.TokenKind;

public class BookmarkInstruction implements Instruction {

    private final CompiledExpression id;

    public BookmarkInstruction(CompiledExpression id) {
        this.id = id;
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        out.control(TokenKind.BOOKMARK, ctx.evaluateString(id));
    }
}
