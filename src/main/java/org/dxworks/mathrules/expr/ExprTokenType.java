package org.dxworks.mathrules.expr;

public enum ExprTokenType {
    NUMBER,
    LITERAL,
    NAME,
    VARIABLE,
    STAR,
    MULTIPLY,
    AND,
    OR,
    DIV,
    MOD,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    SLASH,
    DOUBLE_SLASH,
    PIPE,
    PLUS,
    MINUS,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    DOT,
    DOUBLE_DOT,
    AT,
    DOUBLE_COLON,
    EOF;

    boolean isOperator() {
        switch (this) {
            case AND:
            case OR:
            case MOD:
            case DIV:
            case MULTIPLY:
            case SLASH:
            case DOUBLE_SLASH:
            case PIPE:
            case PLUS:
            case MINUS:
            case EQ:
            case NE:
            case LT:
            case LE:
            case GT:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
