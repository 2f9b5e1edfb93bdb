package org.dxworks.mathrules.expr;

import java.util.List;

final class FunctionCall implements ExprNode {

    private final FunctionRegistry.FunctionDef function;
    private final List<ExprNode> args;

    FunctionCall(FunctionRegistry.FunctionDef function, List<ExprNode> args) {
        this.function = function;
        this.args = List.copyOf(args);
    }

    @Override
    public Value eval(EvalContext ctx) {
        return function.invoke(ctx, args);
    }
}
