package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

/**
 * An expression parsed once at load time and evaluated many times.
 */
public final class CompiledExpression {

    private final String source;
    private final ExprNode root;

    private CompiledExpression(String source, ExprNode root) {
        this.source = source;
        this.root = root;
    }

    /**
     * @throws ExpressionSyntaxException when {@code source} does not parse or names an unknown function
     */
    public static CompiledExpression compile(String source, FunctionRegistry functions) {
        return new CompiledExpression(source, new ExpressionParser(source, functions).parse());
    }

    public static CompiledExpression compile(String source) {
        return compile(source, FunctionRegistry.standard());
    }

    /**
     * Ands already compiled pieces together, keeping short-circuit evaluation.
     */
    public static CompiledExpression and(String source, Iterable<CompiledExpression> parts) {
        ExprNode combined = null;
        for (CompiledExpression part : parts) {
            combined = combined == null ? part.root : new LogicalExpr(true, combined, part.root);
        }
        if (combined == null) throw new IllegalArgumentException("Nothing to combine");
        return new CompiledExpression(source, combined);
    }

    public String getSource() {
        return source;
    }

    public Value evaluate(EvalContext ctx) {
        return root.eval(ctx);
    }

    public boolean evaluateBoolean(EvalContext ctx) {
        return Coerce.toBoolean(evaluate(ctx));
    }

    public String evaluateString(EvalContext ctx) {
        return Coerce.toString(evaluate(ctx));
    }

    public Value evaluate(Node node) {
        return evaluate(EvalContext.of(node));
    }

    @Override
    public String toString() {
        return source;
    }
}
