package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.MathRulesException;

public class ExpressionSyntaxException extends MathRulesException {

    private final String expression;
    private final int offset;

    public ExpressionSyntaxException(String message, String expression, int offset) {
        super(message + " at offset " + offset + " in \"" + expression + "\"");
        this.expression = expression;
        this.offset = offset;
    }

    public String getExpression() {
        return expression;
    }

    public int getOffset() {
        return offset;
    }
}
