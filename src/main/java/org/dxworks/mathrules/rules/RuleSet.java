package org.dxworks.mathrules.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiled rules by tag. Within a tag, rules keep their load order except that rules named
 * {@code default} always come after all other rules.
 */
public final class RuleSet {

    public static final RuleSet EMPTY = new RuleSet(Collections.emptyList(), CharacterRules.EMPTY);

    private final Map<String, List<Rule>> rulesByTag;
    private final CharacterRules characters;
    private final int ruleCount;

    public RuleSet(List<Rule> rules, CharacterRules characters) {
        Map<String, List<Rule>> regular = new LinkedHashMap<>();
        Map<String, List<Rule>> defaults = new LinkedHashMap<>();
        for (Rule rule : rules) {
            for (String tag : rule.getTags()) {
                (rule.isDefault() ? defaults : regular).computeIfAbsent(tag, t -> new ArrayList<>()).add(rule);
            }
        }
        Map<String, List<Rule>> byTag = new LinkedHashMap<>();
        for (Map.Entry<String, List<Rule>> e : regular.entrySet()) {
            byTag.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        for (Map.Entry<String, List<Rule>> e : defaults.entrySet()) {
            byTag.computeIfAbsent(e.getKey(), t -> new ArrayList<>()).addAll(e.getValue());
        }
        byTag.replaceAll((tag, list) -> Collections.unmodifiableList(list));
        this.rulesByTag = Collections.unmodifiableMap(byTag);
        this.characters = characters == null ? CharacterRules.EMPTY : characters;
        this.ruleCount = rules.size();
    }

    public List<Rule> rulesFor(String tag) {
        return rulesByTag.getOrDefault(tag, Collections.emptyList());
    }

    public List<Rule> wildcardRules() {
        return rulesFor(Rule.WILDCARD_TAG);
    }

    public boolean hasRulesFor(String tag) {
        return rulesByTag.containsKey(tag);
    }

    public CharacterRules getCharacters() {
        return characters;
    }

    public int getRuleCount() {
        return ruleCount;
    }

    public Set<String> tags() {
        return rulesByTag.keySet();
    }
}
