package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.MathRulesException;

/**
 * A conversion failed as a whole; no partial output is returned.
 */
public class ConversionException extends MathRulesException {

    private final String nodePath;
    private final String ruleName;

    public ConversionException(String message, String nodePath, String ruleName) {
        this(message, nodePath, ruleName, null);
    }

    public ConversionException(String message, String nodePath, String ruleName, Throwable cause) {
        super(format(message, nodePath, ruleName), cause);
        this.nodePath = nodePath;
        this.ruleName = ruleName;
    }

    private static String format(String message, String nodePath, String ruleName) {
        StringBuilder sb = new StringBuilder(message);
        if (nodePath != null) sb.append(" at ").append(nodePath);
        if (ruleName != null) sb.append(" (rule '").append(ruleName).append("')");
        return sb.toString();
    }

    public String getNodePath() {
        return nodePath;
    }

    public String getRuleName() {
        return ruleName;
    }
}
