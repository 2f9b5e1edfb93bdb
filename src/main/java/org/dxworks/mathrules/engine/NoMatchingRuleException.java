package org.dxworks.mathrules.engine;

public class NoMatchingRuleException extends ConversionException {

    private final String tag;

    public NoMatchingRuleException(String tag, String nodePath) {
        super("No rule matches <" + tag + ">", nodePath, null);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
