package org.dxworks.mathrules.rules;

import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.replace.Instruction;

import java.util.List;

/**
 * One compiled rule. Rules are shared read-only between conversions.
 */
public final class Rule {

    public static final String DEFAULT_NAME = "default";
    public static final String WILDCARD_TAG = "*";

    private final String name;
    private final List<String> tags;
    private final List<VariableDef> variables;
    private final CompiledExpression match;
    private final List<Instruction> replace;
    private final String document;

    public Rule(String name, List<String> tags, List<VariableDef> variables, CompiledExpression match,
                List<Instruction> replace, String document) {
        this.name = name;
        this.tags = List.copyOf(tags);
        this.variables = List.copyOf(variables);
        this.match = match;
        this.replace = List.copyOf(replace);
        this.document = document;
    }

    public String getName() {
        return name;
    }

    public boolean isDefault() {
        return DEFAULT_NAME.equals(name);
    }

    public List<String> getTags() {
        return tags;
    }

    public List<VariableDef> getVariables() {
        return variables;
    }

    public CompiledExpression getMatch() {
        return match;
    }

    public List<Instruction> getReplace() {
        return replace;
    }

    public String getDocument() {
        return document;
    }

    @Override
    public String toString() {
        return name + " " + tags;
    }
}
