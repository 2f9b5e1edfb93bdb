package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

import java.math.BigDecimal;

/**
 * XPath 1.0 conversions between value types.
 */
public final class Coerce {

    private Coerce() {
        // utility class
    }

    public static boolean toBoolean(Value v) {
        if (v instanceof BooleanValue) return ((BooleanValue) v).get();
        if (v instanceof NumberValue) {
            double d = ((NumberValue) v).get();
            return d != 0 && !Double.isNaN(d);
        }
        if (v instanceof StringValue) return !((StringValue) v).get().isEmpty();
        if (v instanceof NodeSetValue) return !((NodeSetValue) v).isEmpty();
        return false;
    }

    public static double toNumber(Value v) {
        if (v instanceof NumberValue) return ((NumberValue) v).get();
        if (v instanceof BooleanValue) return ((BooleanValue) v).get() ? 1 : 0;
        return parseNumber(toString(v));
    }

    public static String toString(Value v) {
        if (v instanceof StringValue) return ((StringValue) v).get();
        if (v instanceof NumberValue) return formatNumber(((NumberValue) v).get());
        if (v instanceof BooleanValue) return Boolean.toString(((BooleanValue) v).get());
        if (v instanceof NodeSetValue) {
            Node first = ((NodeSetValue) v).first();
            return first == null ? "" : first.stringValue();
        }
        return String.valueOf(v);
    }

    public static NodeSetValue toNodeSet(Value v, String usage) {
        if (v instanceof NodeSetValue) return (NodeSetValue) v;
        throw new EvaluationTypeException(usage + " requires a node-set but got a " + v.type().name().toLowerCase());
    }

    /**
     * XPath number(): optional minus sign, digits with an optional fraction; anything else is NaN.
     */
    public static double parseNumber(String s) {
        if (s == null) return Double.NaN;
        String t = s.strip();
        if (t.isEmpty() || !t.matches("-?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)")) {
            return Double.NaN;
        }
        return Double.parseDouble(t);
    }

    public static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == 0) return "0";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
}
