package org.dxworks.mathrules.expr;

import java.util.List;

/**
 * A built-in function. Arguments arrive unevaluated so that functions like
 * {@code IfThenElse} only evaluate the branch they return.
 */
@FunctionalInterface
public interface XPathFunction {

    Value invoke(EvalContext ctx, List<ExprNode> args);
}
