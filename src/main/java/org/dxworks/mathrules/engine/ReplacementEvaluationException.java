package org.dxworks.mathrules.engine;

public class ReplacementEvaluationException extends ConversionException {

    public ReplacementEvaluationException(String message, String nodePath, String ruleName, Throwable cause) {
        super(message, nodePath, ruleName, cause);
    }
}
