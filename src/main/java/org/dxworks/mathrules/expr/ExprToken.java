package org.dxworks.mathrules.expr;

public final class ExprToken {

    final ExprTokenType type;
    final String text;
    final int offset;

    ExprToken(ExprTokenType type, String text, int offset) {
        this.type = type;
        this.text = text;
        this.offset = offset;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return type + (text != null ? "(" + text + ")" : "");
    }
}
