package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.engine.Scope;
import org.dxworks.mathrules.expr.Coerce;
import org.dxworks.mathrules.output.OutputSink;

/**
 * Literal text: {@code t:} and {@code T:}, {@code ct:} glued to the previous text (plural endings),
 * and {@code ot:} which is left out when {@code $Verbosity} is {@code Terse}.
 */
public class TextInstruction implements Instruction {

    public enum Mode {
        PLAIN,
        JOINED,
        OPTIONAL
    }

    static final String VERBOSITY = "Verbosity";

    private final String text;
    private final Mode mode;

    public TextInstruction(String text) {
        this(text, Mode.PLAIN);
    }

    public TextInstruction(String text, Mode mode) {
        this.text = text;
        this.mode = mode;
    }

    public String getText() {
        return text;
    }

    public Mode getMode() {
        return mode;
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        switch (mode) {
            case JOINED:
                out.appendText(text);
                break;
            case OPTIONAL:
                if (!isTerse(ctx.getScope())) out.text(text);
                break;
            default:
                out.text(text);
                break;
        }
    }

    private static boolean isTerse(Scope scope) {
        return scope.isBound(VERBOSITY) && "Terse".equals(Coerce.toString(scope.resolve(VERBOSITY)));
    }
}
