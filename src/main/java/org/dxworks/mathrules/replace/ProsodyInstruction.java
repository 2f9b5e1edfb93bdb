package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.output.TokenKind;

import java.util.List;

/**
 * {@code rate:} and {@code pitch:}; the previous value is restored when the nested list ends,
 * even when it fails.
 */
public class ProsodyInstruction implements Instruction {

    private final TokenKind kind;
    private final CompiledExpression value;
    private final List<Instruction> body;

    public ProsodyInstruction(TokenKind kind, CompiledExpression value, List<Instruction> body) {
        if (kind != TokenKind.RATE && kind != TokenKind.PITCH) {
            throw new IllegalArgumentException(kind + " is not a prosody kind");
        }
        this.kind = kind;
        this.value = value;
        this.body = List.copyOf(body);
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        out.beginProsody(kind, ctx.evaluateString(value));
        try {
            ctx.run(body, out);
        } finally {
            out.endProsody(kind);
        }
    }
}
