package org.dxworks.mathrules.expr;

/**
 * A node of a compiled expression tree.
 */
public interface ExprNode {

    Value eval(EvalContext ctx);
}
