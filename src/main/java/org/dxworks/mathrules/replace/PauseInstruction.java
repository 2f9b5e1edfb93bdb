package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.output.TokenKind;

import java.util.Set;

/**
 * {@code pause:} with a keyword ({@code short}, {@code medium}, {@code long}, {@code auto}),
 * a number of milliseconds, or an expression.
 */
public class PauseInstruction implements Instruction {

    public static final Set<String> KEYWORDS = Set.of("short", "medium", "long", "auto");

    private final String literal;
    private final CompiledExpression expression;

    private PauseInstruction(String literal, CompiledExpression expression) {
        this.literal = literal;
        this.expression = expression;
    }

    public static PauseInstruction literal(String value) {
        return new PauseInstruction(value, null);
    }

    public static PauseInstruction computed(CompiledExpression expression) {
        return new PauseInstruction(null, expression);
    }

    public static boolean isLiteral(String value) {
        return KEYWORDS.contains(value) || value.matches("[0-9]+(\\.[0-9]+)?");
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        out.control(TokenKind.PAUSE, literal != null ? literal : ctx.evaluateString(expression));
    }
}
