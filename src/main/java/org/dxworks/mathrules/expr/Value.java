package org.dxworks.mathrules.expr;

/**
 * Result of evaluating an expression: a boolean, a number, a string or an ordered node-set.
 */
public interface Value {

    ValueType type();
}
