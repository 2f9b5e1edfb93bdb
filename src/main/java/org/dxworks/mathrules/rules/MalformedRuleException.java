package org.dxworks.mathrules.rules;

import org.dxworks.mathrules.MathRulesException;

/**
 * A rule document does not have the expected shape. Loading of the whole rule set is aborted.
 */
public class MalformedRuleException extends MathRulesException {

    private final String document;
    private final String ruleName;

    public MalformedRuleException(String message) {
        this(null, null, message, null);
    }

    public MalformedRuleException(String message, Throwable cause) {
        this(null, null, message, cause);
    }

    public MalformedRuleException(String document, String ruleName, String message, Throwable cause) {
        super(format(document, ruleName, message), cause);
        this.document = document;
        this.ruleName = ruleName;
    }

    private static String format(String document, String ruleName, String message) {
        StringBuilder sb = new StringBuilder();
        if (document != null) sb.append(document).append(": ");
        if (ruleName != null) sb.append("rule '").append(ruleName).append("': ");
        return sb.append(message).toString();
    }

    public String getDocument() {
        return document;
    }

    public String getRuleName() {
        return ruleName;
    }
}
