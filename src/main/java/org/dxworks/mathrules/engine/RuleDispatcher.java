package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.expr.EvaluationException;
import org.dxworks.mathrules.rules.Rule;
import org.dxworks.mathrules.rules.RuleSet;
import org.dxworks.mathrules.rules.VariableDef;
import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.TreeHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the first rule whose match expression holds for a node. The node's own tag is tried
 * first (defaults last), then the {@code *} rules.
 */
public class RuleDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleDispatcher.class);

    private final RuleSet rules;

    public RuleDispatcher(RuleSet rules) {
        this.rules = rules;
    }

    public List<Rule> candidates(String tag) {
        List<Rule> candidates = new ArrayList<>(rules.rulesFor(tag));
        if (!Rule.WILDCARD_TAG.equals(tag)) {
            candidates.addAll(rules.wildcardRules());
        }
        return candidates;
    }

    public Optional<RuleMatch> find(Node node, Scope scope, Conversion conversion) {
        for (Rule rule : candidates(node.getName())) {
            Scope ruleScope = scope;
            for (VariableDef variable : rule.getVariables()) {
                ruleScope = ruleScope.bindLazily(variable.getName(), variable.getExpression(),
                        conversion.evalContext(node, scope));
            }
            try {
                if (rule.getMatch().evaluateBoolean(conversion.evalContext(node, ruleScope))) {
                    return Optional.of(new RuleMatch(rule, ruleScope));
                }
            } catch (EvaluationException e) {
                // a rule that cannot be evaluated here does not match
                LOGGER.debug("Skipping rule '{}' ({}) at {}: {}", rule.getName(), rule.getDocument(),
                        TreeHelper.path(node), e.getMessage());
            }
        }
        return Optional.empty();
    }
}
