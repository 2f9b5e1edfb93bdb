package org.dxworks.mathrules.rules;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.mathrules.TestUtils.ruleSet;
import static org.dxworks.mathrules.TestUtils.yaml;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RuleSetTest {

    private static List<String> names(List<Rule> rules) {
        return rules.stream().map(Rule::getName).collect(Collectors.toList());
    }

    @Test
    void defaultRulesComeLastWhateverTheirPosition() throws IOException {
        RuleSet rules = ruleSet(yaml(
                "- {name: default, tag: mi, match: \".\", replace: [t: \"d\"]}",
                "- {name: first, tag: mi, match: \".\", replace: [t: \"1\"]}",
                "- {name: shared, tag: [mi, mn], match: \".\", replace: [t: \"s\"]}",
                "- {name: any, tag: \"*\", match: \".\", replace: [t: \"*\"]}"));

        assertEquals(List.of("first", "shared", "default"), names(rules.rulesFor("mi")));
        assertEquals(List.of("shared"), names(rules.rulesFor("mn")));
        assertEquals(List.of("any"), names(rules.wildcardRules()));
        assertTrue(rules.hasRulesFor("mn"));
        assertFalse(rules.hasRulesFor("mo"));
        assertTrue(rules.rulesFor("mo").isEmpty());
        assertEquals(4, rules.getRuleCount());
    }

    @Test
    void laterDocumentsAppendToTheSameTag() throws IOException {
        RuleSet rules = new RuleLoader().loadRuleSet(List.of(
                RuleSource.ofString("base", yaml("- {name: base, tag: mo, match: \".\", replace: [t: \"b\"]}")),
                RuleSource.ofString("override", yaml("- {name: extra, tag: mo, match: \".\", replace: [t: \"e\"]}"))),
                List.of());

        assertEquals(List.of("base", "extra"), names(rules.rulesFor("mo")));
    }
}
