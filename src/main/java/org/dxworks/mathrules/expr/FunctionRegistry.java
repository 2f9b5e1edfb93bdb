package org.dxworks.mathrules.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Functions known to the expression compiler. Names are case-sensitive, as in the rule files.
 */
public final class FunctionRegistry {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final class FunctionDef {
        private final String name;
        private final int minArgs;
        private final int maxArgs;
        private final XPathFunction impl;

        private FunctionDef(String name, int minArgs, int maxArgs, XPathFunction impl) {
            this.name = name;
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
            this.impl = impl;
        }

        public String getName() {
            return name;
        }

        Value invoke(EvalContext ctx, List<ExprNode> args) {
            if (args.size() < minArgs || args.size() > maxArgs) {
                throw new EvaluationTypeException(name + "() expects " + arity() + " but got " + args.size());
            }
            return impl.invoke(ctx, args);
        }

        private String arity() {
            if (minArgs == maxArgs) return minArgs + " argument" + (minArgs == 1 ? "" : "s");
            if (maxArgs == UNBOUNDED) return "at least " + minArgs + " arguments";
            return minArgs + " to " + maxArgs + " arguments";
        }
    }

    private final Map<String, FunctionDef> functions = new LinkedHashMap<>();

    /**
     * A registry holding the XPath core functions and the math predicates.
     */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        CoreFunctions.registerAll(registry);
        MathFunctions.registerAll(registry);
        return registry;
    }

    public FunctionRegistry register(String name, int minArgs, int maxArgs, XPathFunction impl) {
        functions.put(name, new FunctionDef(name, minArgs, maxArgs, impl));
        return this;
    }

    public FunctionDef resolve(String name) {
        return functions.get(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }
}
