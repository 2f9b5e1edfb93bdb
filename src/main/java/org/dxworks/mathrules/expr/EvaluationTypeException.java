package org.dxworks.mathrules.expr;

/**
 * A function was called with the wrong number or kind of arguments, or a value could not be
 * used where a node-set is required.
 */
public class EvaluationTypeException extends EvaluationException {

    public EvaluationTypeException(String message) {
        super(message);
    }
}
