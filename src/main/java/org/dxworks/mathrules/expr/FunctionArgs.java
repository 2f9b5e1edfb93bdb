package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

import java.util.List;

/**
 * Argument helpers shared by the built-in functions.
 */
final class FunctionArgs {

    private FunctionArgs() {
        // utility class
    }

    static Value value(EvalContext ctx, List<ExprNode> args, int i) {
        return args.get(i).eval(ctx);
    }

    static String string(EvalContext ctx, List<ExprNode> args, int i) {
        return Coerce.toString(value(ctx, args, i));
    }

    static double number(EvalContext ctx, List<ExprNode> args, int i) {
        return Coerce.toNumber(value(ctx, args, i));
    }

    static boolean bool(EvalContext ctx, List<ExprNode> args, int i) {
        return Coerce.toBoolean(value(ctx, args, i));
    }

    static NodeSetValue nodeSet(EvalContext ctx, List<ExprNode> args, int i, String function) {
        return Coerce.toNodeSet(value(ctx, args, i), function + "() argument " + (i + 1));
    }

    /**
     * The string of argument {@code i}, or the string-value of the context node when it is absent.
     */
    static String stringOrContext(EvalContext ctx, List<ExprNode> args, int i) {
        if (args.size() > i) return string(ctx, args, i);
        Node node = ctx.getNode();
        return node == null ? "" : node.stringValue();
    }

    static Node firstNodeOrContext(EvalContext ctx, List<ExprNode> args, int i, String function) {
        if (args.size() > i) return nodeSet(ctx, args, i, function).first();
        return ctx.getNode();
    }

    static int[] codePoints(String s) {
        return s.codePoints().toArray();
    }
}
