package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.output.TokenKind;

import java.util.List;

/**
 * {@code audio:} emits a sound cue and then runs its nested list. The cue is a file name or
 * keyword taken as written, or an expression.
 */
public class AudioInstruction implements Instruction {

    private final String literal;
    private final CompiledExpression expression;
    private final List<Instruction> body;

    private AudioInstruction(String literal, CompiledExpression expression, List<Instruction> body) {
        this.literal = literal;
        this.expression = expression;
        this.body = List.copyOf(body);
    }

    public static AudioInstruction literal(String value, List<Instruction> body) {
        return new AudioInstruction(value, null, body);
    }

    public static AudioInstruction computed(CompiledExpression expression, List<Instruction> body) {
        return new AudioInstruction(null, expression, body);
    }

    /**
     * Words and dotted file names such as {@code beep} or {@code beep.mp4}.
     */
    public static boolean isLiteral(String value) {
        return value.matches("[\\w-]+(\\.[\\w-]+)*");
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        out.control(TokenKind.AUDIO, literal != null ? literal : ctx.evaluateString(expression));
        ctx.run(body, out);
    }
}
