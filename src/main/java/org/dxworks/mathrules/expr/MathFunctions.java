package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.TreeHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

import static org.dxworks.mathrules.expr.FunctionArgs.bool;
import static org.dxworks.mathrules.expr.FunctionArgs.codePoints;
import static org.dxworks.mathrules.expr.FunctionArgs.nodeSet;
import static org.dxworks.mathrules.expr.FunctionArgs.number;
import static org.dxworks.mathrules.expr.FunctionArgs.string;
import static org.dxworks.mathrules.expr.FunctionArgs.value;

/**
 * Math-aware predicates used by the rule files.
 */
public final class MathFunctions {

    private static final Logger LOGGER = LoggerFactory.getLogger(MathFunctions.class);

    public static final String LARGE_OPERATORS = "LargeOperators";
    public static final String TRIG_FUNCTION_NAMES = "TrigFunctionNames";

    static final Set<String> DEFAULT_LARGE_OPERATORS = Set.of(
            "∑", "∏", "∐", "∫", "∬", "∭", "∮", "∯", "∰", "∱", "∲", "∳",
            "⋀", "⋁", "⋂", "⋃", "⨀", "⨁", "⨂", "⨃", "⨄", "⨅", "⨆", "⨉", "⨊", "⨋", "⨌", "⨍", "⨎", "⨏");

    static final Set<String> DEFAULT_TRIG_FUNCTION_NAMES = Set.of(
            "sin", "cos", "tan", "sec", "csc", "cot",
            "sinh", "cosh", "tanh", "sech", "csch", "coth",
            "arcsin", "arccos", "arctan", "arcsec", "arccsc", "arccot");

    private static final Set<String> SCRIPT_WRAPPERS = Set.of("msub", "msup", "msubsup", "mmultiscripts");

    private MathFunctions() {
        // utility class
    }

    public static void registerAll(FunctionRegistry r) {
        r.register("IsBracketed", 3, 3, (ctx, args) -> {
            Node node = nodeSet(ctx, args, 0, "IsBracketed").first();
            return BooleanValue.of(isBracketed(node, string(ctx, args, 1), string(ctx, args, 2)));
        });
        r.register("IsLargeOp", 1, 1, (ctx, args) -> {
            Node node = nodeSet(ctx, args, 0, "IsLargeOp").first();
            return BooleanValue.of(isLargeOp(node, ctx));
        });
        r.register("IsNode", 2, 2, (ctx, args) -> {
            NodeSetValue nodes = nodeSet(ctx, args, 0, "IsNode");
            String category = string(ctx, args, 1);
            if (nodes.isEmpty()) return BooleanValue.FALSE;
            for (Node node : nodes.nodes()) {
                if (!isNode(node, category, ctx)) return BooleanValue.FALSE;
            }
            return BooleanValue.TRUE;
        });
        r.register("IsInDefinition", 2, 2, (ctx, args) -> {
            Value subject = value(ctx, args, 0);
            String definition = string(ctx, args, 1);
            if (!ctx.getDefinitions().has(definition)) {
                throw new EvaluationTypeException("IsInDefinition(): unknown definition '" + definition + "'");
            }
            if (subject instanceof NodeSetValue) {
                Node node = ((NodeSetValue) subject).first();
                if (node == null || (node.isElement() && !node.isLeaf())) return BooleanValue.FALSE;
                return BooleanValue.of(ctx.getDefinitions().contains(definition, node.stringValue()));
            }
            return BooleanValue.of(ctx.getDefinitions().contains(definition, Coerce.toString(subject)));
        });
        r.register("BaseNode", 1, 1, (ctx, args) -> NodeSetValue.of(baseNode(nodeSet(ctx, args, 0, "BaseNode").first())));
        r.register("IfThenElse", 3, 3, (ctx, args) -> bool(ctx, args, 0) ? value(ctx, args, 1) : value(ctx, args, 2));
        r.register("DEBUG", 1, 1, (ctx, args) -> {
            Value v = value(ctx, args, 0);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("DEBUG at {}: {} = {}", TreeHelper.path(ctx.getNode()), v.type(), v);
            }
            return v;
        });
        r.register("NestingChars", 2, 2, (ctx, args) -> {
            Node node = nodeSet(ctx, args, 0, "NestingChars").first();
            return StringValue.of(ctx.getBraille().nestingChars(node, string(ctx, args, 1)));
        });
        r.register("BrailleChars", 2, 4, MathFunctions::brailleChars);
    }

    /**
     * True when {@code node} has three children and the first and last are {@code mo} leaves holding
     * {@code open} and {@code close}; an empty bracket string accepts anything on that side.
     */
    public static boolean isBracketed(Node node, String open, String close) {
        if (node == null || !node.isElement() || node.childCount() != 3) return false;
        return bracketMatches(node.child(0), open) && bracketMatches(node.child(2), close);
    }

    private static boolean bracketMatches(Node child, String bracket) {
        if (bracket.isEmpty()) return true;
        return "mo".equals(child.getName()) && child.isLeaf() && bracket.equals(child.getText());
    }

    public static boolean isLargeOp(Node node, EvalContext ctx) {
        if (node == null || !node.isLeaf() || !TreeHelper.isNodeTypeOneOf(node, "mo", "mi")) return false;
        return inDefinitionOrDefault(ctx, LARGE_OPERATORS, DEFAULT_LARGE_OPERATORS, node.getText());
    }

    public static boolean isNode(Node node, String category, EvalContext ctx) {
        switch (category) {
            case "leaf":
                return node.isElement() && node.isLeaf();
            case "simple":
                return isSimple(node);
            case "common_fraction":
                return isCommonFraction(node);
            case "trig_name":
                return node.isLeaf() && TreeHelper.isNodeTypeOneOf(node, "mi")
                        && inDefinitionOrDefault(ctx, TRIG_FUNCTION_NAMES, DEFAULT_TRIG_FUNCTION_NAMES, node.getText());
            default:
                if (ctx.getDefinitions().has(category)) {
                    return node.isLeaf() && ctx.getDefinitions().contains(category, node.getText());
                }
                throw new EvaluationTypeException("IsNode(): unknown category '" + category + "'");
        }
    }

    /**
     * Numbers, identifiers, negative numbers, common fractions and subscripted identifiers.
     */
    static boolean isSimple(Node node) {
        if (!node.isElement()) return false;
        if (node.isLeaf()) return TreeHelper.isNodeTypeOneOf(node, "mn", "mi");
        if (isCommonFraction(node)) return true;
        if (TreeHelper.isNodeTypeOneOf(node, "mrow") && node.childCount() == 2) {
            Node sign = node.child(0);
            return TreeHelper.isNodeTypeOneOf(sign, "mo") && "-".equals(sign.getText())
                    && TreeHelper.isNodeTypeOneOf(node.child(1), "mn") && node.child(1).isLeaf();
        }
        if (TreeHelper.isNodeTypeOneOf(node, "negative") && node.childCount() == 1) {
            return TreeHelper.isNodeTypeOneOf(node.child(0), "mn") && node.child(0).isLeaf();
        }
        if (TreeHelper.isNodeTypeOneOf(node, "msub") && node.childCount() == 2) {
            return TreeHelper.isNodeTypeOneOf(node.child(0), "mi") && node.child(0).isLeaf()
                    && TreeHelper.isNodeTypeOneOf(node.child(1), "mi", "mn") && node.child(1).isLeaf();
        }
        return false;
    }

    static boolean isCommonFraction(Node node) {
        if (!TreeHelper.isNodeTypeOneOf(node, "mfrac") || node.childCount() != 2) return false;
        return isInteger(node.child(0)) && isInteger(node.child(1));
    }

    private static boolean isInteger(Node node) {
        return TreeHelper.isNodeTypeOneOf(node, "mn") && node.isLeaf() && node.getText().matches("[0-9]+");
    }

    public static Node baseNode(Node node) {
        Node current = node;
        while (current != null && current.isElement() && SCRIPT_WRAPPERS.contains(current.getName())
                && current.childCount() > 0) {
            current = current.child(0);
        }
        return current;
    }

    private static boolean inDefinitionOrDefault(EvalContext ctx, String definition, Set<String> fallback, String text) {
        if (ctx.getDefinitions().has(definition)) {
            return ctx.getDefinitions().contains(definition, text);
        }
        return fallback.contains(text);
    }

    /**
     * BrailleChars(node-or-string, code[, start[, end]]) with a 1-based start and an inclusive end.
     */
    private static Value brailleChars(EvalContext ctx, List<ExprNode> args) {
        Value subject = value(ctx, args, 0);
        Node node = subject instanceof NodeSetValue ? ((NodeSetValue) subject).first() : null;
        String text = Coerce.toString(subject);
        String code = string(ctx, args, 1);
        if (args.size() > 2) {
            int[] cps = codePoints(text);
            double start = CoreFunctions.round(number(ctx, args, 2));
            double end = args.size() > 3 ? CoreFunctions.round(number(ctx, args, 3)) : cps.length;
            text = CoreFunctions.substring(text, start, end + 1);
        }
        return StringValue.of(ctx.getBraille().brailleChars(text, code, node));
    }
}
