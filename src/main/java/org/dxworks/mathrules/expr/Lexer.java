package org.dxworks.mathrules.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an expression into tokens. {@code *} and the names {@code and}, {@code or},
 * {@code div}, {@code mod} are operators only where an operand has just ended, as in XPath.
 */
public final class Lexer {

    private final String s;
    private int i = 0;
    private final List<ExprToken> tokens = new ArrayList<>();

    public Lexer(String s) {
        this.s = s;
    }

    public List<ExprToken> tokenize() {
        while (true) {
            skipWs();
            if (i >= s.length()) {
                tokens.add(new ExprToken(ExprTokenType.EOF, null, i));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private ExprToken next() {
        int start = i;
        char c = s.charAt(i);

        if (c == '\'' || c == '"') {
            int end = s.indexOf(c, i + 1);
            if (end < 0) throw error("unterminated string literal", start);
            i = end + 1;
            return new ExprToken(ExprTokenType.LITERAL, s.substring(start + 1, end), start);
        }
        if (Character.isDigit(c) || (c == '.' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
            while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
            if (i < s.length() && s.charAt(i) == '.') {
                i++;
                while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
            }
            return new ExprToken(ExprTokenType.NUMBER, s.substring(start, i), start);
        }
        if (c == '$') {
            i++;
            if (i >= s.length() || !isNameStart(s.charAt(i))) throw error("expected variable name after '$'", start);
            String name = readName();
            return new ExprToken(ExprTokenType.VARIABLE, name, start);
        }
        if (isNameStart(c)) {
            String name = readName();
            // prefix:local, but not axis::
            if (i + 1 < s.length() && s.charAt(i) == ':' && s.charAt(i + 1) != ':') {
                char after = s.charAt(i + 1);
                if (isNameStart(after)) {
                    i++;
                    name = name + ":" + readName();
                } else if (after == '*') {
                    i += 2;
                    name = name + ":*";
                }
            }
            if (operatorExpected()) {
                switch (name) {
                    case "and":
                        return new ExprToken(ExprTokenType.AND, name, start);
                    case "or":
                        return new ExprToken(ExprTokenType.OR, name, start);
                    case "div":
                        return new ExprToken(ExprTokenType.DIV, name, start);
                    case "mod":
                        return new ExprToken(ExprTokenType.MOD, name, start);
                    default:
                        throw error("expected an operator but found '" + name + "'", start);
                }
            }
            return new ExprToken(ExprTokenType.NAME, name, start);
        }

        if (i + 1 < s.length()) {
            String two = s.substring(i, i + 2);
            switch (two) {
                case "//":
                    i += 2;
                    return new ExprToken(ExprTokenType.DOUBLE_SLASH, two, start);
                case "!=":
                    i += 2;
                    return new ExprToken(ExprTokenType.NE, two, start);
                case "<=":
                    i += 2;
                    return new ExprToken(ExprTokenType.LE, two, start);
                case ">=":
                    i += 2;
                    return new ExprToken(ExprTokenType.GE, two, start);
                case "..":
                    i += 2;
                    return new ExprToken(ExprTokenType.DOUBLE_DOT, two, start);
                case "::":
                    i += 2;
                    return new ExprToken(ExprTokenType.DOUBLE_COLON, two, start);
                default:
                    break;
            }
        }

        i++;
        switch (c) {
            case '(':
                return new ExprToken(ExprTokenType.LPAREN, "(", start);
            case ')':
                return new ExprToken(ExprTokenType.RPAREN, ")", start);
            case '[':
                return new ExprToken(ExprTokenType.LBRACKET, "[", start);
            case ']':
                return new ExprToken(ExprTokenType.RBRACKET, "]", start);
            case ',':
                return new ExprToken(ExprTokenType.COMMA, ",", start);
            case '/':
                return new ExprToken(ExprTokenType.SLASH, "/", start);
            case '|':
                return new ExprToken(ExprTokenType.PIPE, "|", start);
            case '+':
                return new ExprToken(ExprTokenType.PLUS, "+", start);
            case '-':
                return new ExprToken(ExprTokenType.MINUS, "-", start);
            case '=':
                return new ExprToken(ExprTokenType.EQ, "=", start);
            case '<':
                return new ExprToken(ExprTokenType.LT, "<", start);
            case '>':
                return new ExprToken(ExprTokenType.GT, ">", start);
            case '.':
                return new ExprToken(ExprTokenType.DOT, ".", start);
            case '@':
                return new ExprToken(ExprTokenType.AT, "@", start);
            case '*':
                return new ExprToken(operatorExpected() ? ExprTokenType.MULTIPLY : ExprTokenType.STAR, "*", start);
            default:
                throw error("unexpected character '" + c + "'", start);
        }
    }

    private boolean operatorExpected() {
        if (tokens.isEmpty()) return false;
        ExprTokenType prev = tokens.get(tokens.size() - 1).type;
        switch (prev) {
            case AT:
            case DOUBLE_COLON:
            case LPAREN:
            case LBRACKET:
            case COMMA:
                return false;
            default:
                return !prev.isOperator();
        }
    }

    private String readName() {
        int start = i;
        i++;
        while (i < s.length() && isNamePart(s.charAt(i))) i++;
        // a trailing '.' belongs to the next token ("x.")
        while (i - 1 > start && s.charAt(i - 1) == '.') i--;
        return s.substring(start, i);
    }

    private void skipWs() {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
    }

    private ExpressionSyntaxException error(String message, int at) {
        return new ExpressionSyntaxException(message, s, at);
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
    }
}
