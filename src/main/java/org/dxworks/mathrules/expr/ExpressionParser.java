package org.dxworks.mathrules.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the XPath 1.0 subset used by rule files.
 * Abbreviated steps {@code .} and {@code ..} may carry predicates ({@code .[contains(., 'x')]}).
 */
public final class ExpressionParser {

    private static final Set<String> NODE_TYPES = Set.of("text", "node", "comment", "processing-instruction");

    private final String source;
    private final FunctionRegistry functions;
    private final List<ExprToken> tokens;
    private int pos = 0;

    public ExpressionParser(String source, FunctionRegistry functions) {
        this.source = source;
        this.functions = functions;
        this.tokens = new Lexer(source).tokenize();
    }

    public ExprNode parse() {
        if (peek().type == ExprTokenType.EOF) throw error("empty expression");
        ExprNode n = parseOr();
        if (peek().type != ExprTokenType.EOF) throw error("unexpected " + describe(peek()));
        return n;
    }

    private ExprNode parseOr() {
        ExprNode left = parseAnd();
        while (accept(ExprTokenType.OR)) {
            left = new LogicalExpr(false, left, parseAnd());
        }
        return left;
    }

    private ExprNode parseAnd() {
        ExprNode left = parseEquality();
        while (accept(ExprTokenType.AND)) {
            left = new LogicalExpr(true, left, parseEquality());
        }
        return left;
    }

    private ExprNode parseEquality() {
        ExprNode left = parseRelational();
        while (look(ExprTokenType.EQ) || look(ExprTokenType.NE)) {
            ExprTokenType op = advance().type;
            left = new ComparisonExpr(op, left, parseRelational());
        }
        return left;
    }

    private ExprNode parseRelational() {
        ExprNode left = parseAdditive();
        while (look(ExprTokenType.LT) || look(ExprTokenType.LE) || look(ExprTokenType.GT) || look(ExprTokenType.GE)) {
            ExprTokenType op = advance().type;
            left = new ComparisonExpr(op, left, parseAdditive());
        }
        return left;
    }

    private ExprNode parseAdditive() {
        ExprNode left = parseMultiplicative();
        while (look(ExprTokenType.PLUS) || look(ExprTokenType.MINUS)) {
            ExprTokenType op = advance().type;
            left = new ArithmeticExpr(op, left, parseMultiplicative());
        }
        return left;
    }

    private ExprNode parseMultiplicative() {
        ExprNode left = parseUnary();
        while (look(ExprTokenType.MULTIPLY) || look(ExprTokenType.DIV) || look(ExprTokenType.MOD)) {
            ExprTokenType op = advance().type;
            left = new ArithmeticExpr(op, left, parseUnary());
        }
        return left;
    }

    private ExprNode parseUnary() {
        if (accept(ExprTokenType.MINUS)) {
            return new NegateExpr(parseUnary());
        }
        return parseUnion();
    }

    private ExprNode parseUnion() {
        ExprNode left = parsePath();
        while (accept(ExprTokenType.PIPE)) {
            left = new UnionExpr(left, parsePath());
        }
        return left;
    }

    private ExprNode parsePath() {
        if (!startsFilterExpr()) {
            return parseLocationPath();
        }
        ExprNode primary = parsePrimary();
        List<ExprNode> predicates = parsePredicates();
        List<Step> steps = new ArrayList<>();
        if (look(ExprTokenType.SLASH) || look(ExprTokenType.DOUBLE_SLASH)) {
            parseRelativeSteps(steps, true);
        }
        if (predicates.isEmpty() && steps.isEmpty()) return primary;
        return new FilterExpr(primary, predicates, steps);
    }

    private boolean startsFilterExpr() {
        switch (peek().type) {
            case VARIABLE:
            case LPAREN:
            case LITERAL:
            case NUMBER:
                return true;
            case NAME:
                return peek(1).type == ExprTokenType.LPAREN && !NODE_TYPES.contains(peek().text);
            default:
                return false;
        }
    }

    private ExprNode parsePrimary() {
        ExprToken t = advance();
        switch (t.type) {
            case VARIABLE:
                return new VariableReference(t.text);
            case LITERAL:
                return new Literal(StringValue.of(t.text));
            case NUMBER:
                return new Literal(NumberValue.of(Double.parseDouble(t.text)));
            case LPAREN: {
                ExprNode inner = parseOr();
                expect(ExprTokenType.RPAREN);
                return inner;
            }
            case NAME: {
                FunctionRegistry.FunctionDef function = functions.resolve(t.text);
                if (function == null) throw error("unknown function '" + t.text + "'", t);
                expect(ExprTokenType.LPAREN);
                List<ExprNode> args = new ArrayList<>();
                if (!look(ExprTokenType.RPAREN)) {
                    args.add(parseOr());
                    while (accept(ExprTokenType.COMMA)) {
                        args.add(parseOr());
                    }
                }
                expect(ExprTokenType.RPAREN);
                return new FunctionCall(function, args);
            }
            default:
                throw error("unexpected " + describe(t), t);
        }
    }

    private ExprNode parseLocationPath() {
        List<Step> steps = new ArrayList<>();
        if (look(ExprTokenType.SLASH)) {
            advance();
            if (startsStep()) {
                parseRelativeSteps(steps, false);
            }
            return new LocationPath(true, steps);
        }
        if (look(ExprTokenType.DOUBLE_SLASH)) {
            parseRelativeSteps(steps, true);
            return new LocationPath(true, steps);
        }
        if (!startsStep()) throw error("unexpected " + describe(peek()));
        parseRelativeSteps(steps, false);
        return new LocationPath(false, steps);
    }

    /**
     * Parses {@code step (('/' | '//') step)*}; when {@code leadingSeparator} is set the first
     * step is preceded by a separator that has not been consumed yet.
     */
    private void parseRelativeSteps(List<Step> steps, boolean leadingSeparator) {
        if (leadingSeparator) {
            consumeSeparator(steps);
        }
        steps.add(parseStep());
        while (look(ExprTokenType.SLASH) || look(ExprTokenType.DOUBLE_SLASH)) {
            consumeSeparator(steps);
            steps.add(parseStep());
        }
    }

    private void consumeSeparator(List<Step> steps) {
        if (advance().type == ExprTokenType.DOUBLE_SLASH) {
            steps.add(Step.descendantOrSelf());
        }
    }

    private boolean startsStep() {
        switch (peek().type) {
            case NAME:
            case STAR:
            case DOT:
            case DOUBLE_DOT:
            case AT:
                return true;
            default:
                return false;
        }
    }

    private Step parseStep() {
        if (accept(ExprTokenType.DOT)) {
            return new Step(Axis.SELF, NodeTest.ANY_NODE, parsePredicates());
        }
        if (accept(ExprTokenType.DOUBLE_DOT)) {
            return new Step(Axis.PARENT, NodeTest.ANY_NODE, parsePredicates());
        }
        Axis axis = Axis.CHILD;
        if (accept(ExprTokenType.AT)) {
            axis = Axis.ATTRIBUTE;
        } else if (look(ExprTokenType.NAME) && peek(1).type == ExprTokenType.DOUBLE_COLON) {
            ExprToken name = advance();
            axis = Axis.fromName(name.text);
            if (axis == null) throw error("unknown axis '" + name.text + "'", name);
            advance();
        }
        NodeTest test = parseNodeTest();
        return new Step(axis, test, parsePredicates());
    }

    private NodeTest parseNodeTest() {
        ExprToken t = advance();
        if (t.type == ExprTokenType.STAR) {
            return NodeTest.any();
        }
        if (t.type != ExprTokenType.NAME) {
            throw error("expected a node test but found " + describe(t), t);
        }
        if (NODE_TYPES.contains(t.text) && look(ExprTokenType.LPAREN)) {
            advance();
            expect(ExprTokenType.RPAREN);
            switch (t.text) {
                case "text":
                    return NodeTest.text();
                case "node":
                    return NodeTest.ANY_NODE;
                default:
                    throw error("node type " + t.text + "() is not supported", t);
            }
        }
        return NodeTest.named(t.text);
    }

    private List<ExprNode> parsePredicates() {
        List<ExprNode> predicates = new ArrayList<>();
        while (accept(ExprTokenType.LBRACKET)) {
            predicates.add(parseOr());
            expect(ExprTokenType.RBRACKET);
        }
        return predicates;
    }

    // ---- token helpers ----

    private ExprToken peek() {
        return tokens.get(pos);
    }

    private ExprToken peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private boolean look(ExprTokenType type) {
        return peek().type == type;
    }

    private ExprToken advance() {
        ExprToken t = tokens.get(pos);
        if (t.type != ExprTokenType.EOF) pos++;
        return t;
    }

    private boolean accept(ExprTokenType type) {
        if (look(type)) {
            advance();
            return true;
        }
        return false;
    }

    private ExprToken expect(ExprTokenType type) {
        if (!look(type)) throw error("expected " + type + " but found " + describe(peek()));
        return advance();
    }

    private static String describe(ExprToken t) {
        return t.type == ExprTokenType.EOF ? "end of expression" : "'" + t.text + "'";
    }

    private ExpressionSyntaxException error(String message) {
        return error(message, peek());
    }

    private ExpressionSyntaxException error(String message, ExprToken at) {
        return new ExpressionSyntaxException(message, source, at.offset);
    }
}
