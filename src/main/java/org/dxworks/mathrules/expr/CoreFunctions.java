package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.NodeKind;

import java.util.HashMap;
import java.util.Map;

import static org.dxworks.mathrules.expr.FunctionArgs.bool;
import static org.dxworks.mathrules.expr.FunctionArgs.codePoints;
import static org.dxworks.mathrules.expr.FunctionArgs.firstNodeOrContext;
import static org.dxworks.mathrules.expr.FunctionArgs.nodeSet;
import static org.dxworks.mathrules.expr.FunctionArgs.number;
import static org.dxworks.mathrules.expr.FunctionArgs.string;
import static org.dxworks.mathrules.expr.FunctionArgs.stringOrContext;
import static org.dxworks.mathrules.expr.FunctionArgs.value;
import static org.dxworks.mathrules.expr.FunctionRegistry.UNBOUNDED;

/**
 * XPath 1.0 core function library. Strings are measured in code points.
 */
public final class CoreFunctions {

    private CoreFunctions() {
        // utility class
    }

    public static void registerAll(FunctionRegistry r) {
        // node-set
        r.register("last", 0, 0, (ctx, args) -> NumberValue.of(ctx.getSize()));
        r.register("position", 0, 0, (ctx, args) -> NumberValue.of(ctx.getPosition()));
        r.register("count", 1, 1, (ctx, args) -> NumberValue.of(nodeSet(ctx, args, 0, "count").size()));
        r.register("name", 0, 1, (ctx, args) -> StringValue.of(nameOf(firstNodeOrContext(ctx, args, 0, "name"))));
        r.register("local-name", 0, 1, (ctx, args) -> StringValue.of(nameOf(firstNodeOrContext(ctx, args, 0, "local-name"))));

        // string
        r.register("string", 0, 1, (ctx, args) -> StringValue.of(stringOrContext(ctx, args, 0)));
        r.register("concat", 2, UNBOUNDED, (ctx, args) -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) sb.append(string(ctx, args, i));
            return StringValue.of(sb.toString());
        });
        r.register("contains", 2, 2, (ctx, args) -> BooleanValue.of(string(ctx, args, 0).contains(string(ctx, args, 1))));
        r.register("starts-with", 2, 2, (ctx, args) -> BooleanValue.of(string(ctx, args, 0).startsWith(string(ctx, args, 1))));
        r.register("ends-with", 2, 2, (ctx, args) -> BooleanValue.of(string(ctx, args, 0).endsWith(string(ctx, args, 1))));
        r.register("substring-before", 2, 2, (ctx, args) -> {
            String s = string(ctx, args, 0);
            int at = s.indexOf(string(ctx, args, 1));
            return StringValue.of(at < 0 ? "" : s.substring(0, at));
        });
        r.register("substring-after", 2, 2, (ctx, args) -> {
            String s = string(ctx, args, 0);
            String sep = string(ctx, args, 1);
            int at = s.indexOf(sep);
            return StringValue.of(at < 0 ? "" : s.substring(at + sep.length()));
        });
        r.register("substring", 2, 3, (ctx, args) -> {
            String s = string(ctx, args, 0);
            double start = round(number(ctx, args, 1));
            double end = args.size() > 2 ? start + round(number(ctx, args, 2)) : Double.POSITIVE_INFINITY;
            return StringValue.of(substring(s, start, end));
        });
        r.register("string-length", 0, 1, (ctx, args) -> {
            String s = stringOrContext(ctx, args, 0);
            return NumberValue.of(s.codePointCount(0, s.length()));
        });
        r.register("normalize-space", 0, 1, (ctx, args) ->
                StringValue.of(stringOrContext(ctx, args, 0).replaceAll("[ \\t\\r\\n]+", " ").trim()));
        r.register("translate", 3, 3, (ctx, args) ->
                StringValue.of(translate(string(ctx, args, 0), string(ctx, args, 1), string(ctx, args, 2))));

        // boolean
        r.register("not", 1, 1, (ctx, args) -> BooleanValue.of(!bool(ctx, args, 0)));
        r.register("true", 0, 0, (ctx, args) -> BooleanValue.TRUE);
        r.register("false", 0, 0, (ctx, args) -> BooleanValue.FALSE);
        r.register("boolean", 1, 1, (ctx, args) -> BooleanValue.of(bool(ctx, args, 0)));

        // number
        r.register("number", 0, 1, (ctx, args) -> NumberValue.of(args.isEmpty()
                ? Coerce.parseNumber(stringOrContext(ctx, args, 0))
                : Coerce.toNumber(value(ctx, args, 0))));
        r.register("sum", 1, 1, (ctx, args) -> {
            double total = 0;
            for (Node n : nodeSet(ctx, args, 0, "sum").nodes()) total += Coerce.parseNumber(n.stringValue());
            return NumberValue.of(total);
        });
        r.register("floor", 1, 1, (ctx, args) -> NumberValue.of(Math.floor(number(ctx, args, 0))));
        r.register("ceiling", 1, 1, (ctx, args) -> NumberValue.of(Math.ceil(number(ctx, args, 0))));
        r.register("round", 1, 1, (ctx, args) -> NumberValue.of(round(number(ctx, args, 0))));
    }

    static String nameOf(Node node) {
        if (node == null || node.getKind() == NodeKind.TEXT) return "";
        return node.getName();
    }

    static double round(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return d;
        return Math.floor(d + 0.5);
    }

    /**
     * Characters at 1-based positions p with {@code start <= p < end}.
     */
    static String substring(String s, double start, double end) {
        int[] cps = codePoints(s);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cps.length; i++) {
            int p = i + 1;
            if (p >= start && p < end) sb.appendCodePoint(cps[i]);
        }
        return sb.toString();
    }

    static String translate(String s, String from, String to) {
        int[] fromCps = codePoints(from);
        int[] toCps = codePoints(to);
        Map<Integer, Integer> map = new HashMap<>();
        for (int i = 0; i < fromCps.length; i++) {
            // first occurrence wins; -1 deletes
            map.putIfAbsent(fromCps[i], i < toCps.length ? toCps[i] : -1);
        }
        StringBuilder sb = new StringBuilder();
        s.codePoints().forEach(cp -> {
            Integer mapped = map.get(cp);
            if (mapped == null) sb.appendCodePoint(cp);
            else if (mapped >= 0) sb.appendCodePoint(mapped);
        });
        return sb.toString();
    }
}
