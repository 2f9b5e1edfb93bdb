package org.dxworks.mathrules;

/**
 * Root of every failure the rule engine reports.
 */
public class MathRulesException extends RuntimeException {

    public MathRulesException(String message) {
        super(message);
    }

    public MathRulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
