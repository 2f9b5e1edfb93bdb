package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.MathRulesException;

/**
 * Raised while evaluating a compiled expression. Rule selection treats it as a failed match;
 * inside a replacement it aborts the conversion.
 */
public class EvaluationException extends MathRulesException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
