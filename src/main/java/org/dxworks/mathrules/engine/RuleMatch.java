package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.rules.Rule;

/**
 * The rule chosen for a node, with the scope holding its variables.
 */
public final class RuleMatch {

    private final Rule rule;
    private final Scope scope;

    public RuleMatch(Rule rule, Scope scope) {
        this.rule = rule;
        this.scope = scope;
    }

    public Rule getRule() {
        return rule;
    }

    public Scope getScope() {
        return scope;
    }
}
