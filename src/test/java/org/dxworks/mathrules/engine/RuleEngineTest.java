package org.dxworks.mathrules.engine;

import org.approvaltests.Approvals;
import org.dxworks.mathrules.MathRulesConfig;
import org.dxworks.mathrules.expr.BrailleCodeService;
import org.dxworks.mathrules.output.BookmarkRange;
import org.dxworks.mathrules.output.Token;
import org.dxworks.mathrules.output.TokenKind;
import org.dxworks.mathrules.output.TokenStream;
import org.dxworks.mathrules.tree.Node;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.dxworks.mathrules.TestUtils.APPROVAL_MAPPER;
import static org.dxworks.mathrules.TestUtils.LEAF_AND_ROW_RULES;
import static org.dxworks.mathrules.TestUtils.mathml;
import static org.dxworks.mathrules.TestUtils.ruleSet;
import static org.dxworks.mathrules.TestUtils.speechEngine;
import static org.dxworks.mathrules.TestUtils.yaml;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RuleEngineTest {

    private static final String POWER_RULES = yaml(
            "- name: power",
            "  tag: msup",
            "  match: \"count(*) = 2\"",
            "  replace:",
            "  - x: \"*[1]\"",
            "  - t: \"power\"",
            "  - x: \"*[2]\"") + LEAF_AND_ROW_RULES;

    @Test
    void speaksPowerAsTokens() throws IOException {
        TokenStream speech = speechEngine(POWER_RULES)
                .speak(mathml("<math><msup><mi>x</mi><mn>2</mn></msup></math>"));

        Approvals.verify(APPROVAL_MAPPER.writeValueAsString(speech.tokens()));
    }

    @Test
    void ruleWithUnboundVariableIsSkipped() throws IOException {
        TokenStream speech = speechEngine(yaml(
                "- name: styled",
                "  tag: mi",
                "  match: \"$NotAPreference = 'yes'\"",
                "  replace: [t: \"styled\"]",
                "- name: broken-variable",
                "  tag: mi",
                "  variables: [Missing: \"$AlsoMissing\"]",
                "  match: \"$Missing\"",
                "  replace: [t: \"broken\"]") + LEAF_AND_ROW_RULES)
                .speak(mathml("<math><mi>y</mi></math>"));

        assertEquals(List.of(Token.text("y")), speech.tokens());
    }

    @Test
    void nestedRateChangesRestoreOuterRate() throws IOException {
        String rules = yaml(
                "- name: slow",
                "  tag: mfrac",
                "  match: \".\"",
                "  replace:",
                "  - rate:",
                "      value: \"50\"",
                "      replace:",
                "      - x: \"*[1]\"",
                "      - rate:",
                "          value: \"25\"",
                "          replace: [t: \"over\"]",
                "      - x: \"*[2]\"",
                "  - t: \"end\"") + LEAF_AND_ROW_RULES;
        Node fraction = mathml("<math><mfrac><mn>1</mn><mn>2</mn></mfrac></math>");

        TokenStream speech = speechEngine(rules).speak(fraction);

        assertEquals(List.of(
                new Token(TokenKind.RATE, "50"),
                Token.text("1"),
                new Token(TokenKind.RATE, "25"),
                Token.text("over"),
                new Token(TokenKind.RATE, "50"),
                Token.text("2"),
                new Token(TokenKind.RATE, "100"),
                Token.text("end")), speech.tokens());
        assertEquals("1 over 2 end", speech.toSpeechString());

        TokenStream atUserRate = RuleEngine.builder()
                .speechRules(ruleSet(rules))
                .preference(RuleEngine.RATE_PREFERENCE, 80)
                .build()
                .speak(fraction);
        assertEquals(new Token(TokenKind.RATE, "80"), atUserRate.tokens().get(6));
    }

    @Test
    void insertSeparatesSelectedNodes() throws IOException {
        RuleEngine engine = speechEngine(yaml(
                "- name: list",
                "  tag: mrow",
                "  match: \".\"",
                "  replace:",
                "  - t: \"[\"",
                "  - insert:",
                "      nodes: \"*\"",
                "      replace: [t: \"and\"]",
                "  - t: \"]\"") + LEAF_AND_ROW_RULES);

        assertEquals("[ ]", engine.speak(mathml("<math><mrow></mrow></math>")).toSpeechString());
        assertEquals("[ a ]", engine.speak(mathml("<math><mrow><mi>a</mi></mrow></math>")).toSpeechString());
        assertEquals("[ a and b and c ]",
                engine.speak(mathml("<math><mrow><mi>a</mi><mi>b</mi><mi>c</mi></mrow></math>")).toSpeechString());
    }

    @Test
    void insertNeedsANodeSet() throws IOException {
        RuleEngine engine = speechEngine(yaml(
                "- name: list",
                "  tag: mrow",
                "  match: \".\"",
                "  replace:",
                "  - insert:",
                "      nodes: \"count(*)\"",
                "      replace: [t: \"and\"]") + LEAF_AND_ROW_RULES);

        ReplacementEvaluationException e = assertThrows(ReplacementEvaluationException.class,
                () -> engine.speak(mathml("<math><mrow><mi>a</mi></mrow></math>")));
        assertEquals("list", e.getRuleName());
    }

    @Test
    void bookmarksOnlyFromTheTakenBranch() throws IOException {
        RuleEngine engine = speechEngine(yaml(
                "- name: fraction",
                "  tag: mfrac",
                "  match: \".\"",
                "  replace:",
                "  - test:",
                "      if: \"*[1][self::m:mn]\"",
                "      then: [bookmark: \"*[1]/@id\", x: \"*[1]\"]",
                "      else: [bookmark: \"'other'\", t: \"other\"]",
                "  - bookmark: \"*[2]/@id\"",
                "  - x: \"*[2]\"") + LEAF_AND_ROW_RULES);

        TokenStream speech = engine.speak(mathml(
                "<math><mfrac><mn id='n1'>1</mn><mi id='n2'>k</mi></mfrac></math>"));

        assertEquals(2, speech.count(TokenKind.BOOKMARK));
        assertEquals("1 k", speech.toSpeechString());
        List<BookmarkRange> ranges = speech.bookmarkRanges();
        assertEquals(2, ranges.size());
        assertEquals("n1", ranges.get(0).id);
        assertEquals("1", ranges.get(0).text);
        assertEquals(1, ranges.get(0).startToken);
        assertEquals(2, ranges.get(0).endToken);
        assertEquals("n2", ranges.get(1).id);
        assertEquals("k", ranges.get(1).text);
    }

    @Test
    void withShadowsOnlyInsideItsBlock() throws IOException {
        RuleEngine engine = speechEngine(yaml(
                "- name: fraction",
                "  tag: mfrac",
                "  variables: [Word: \"'outer'\"]",
                "  match: \".\"",
                "  replace:",
                "  - with:",
                "      variables: [Word: \"'inner'\", Both: \"concat($Word, '-', *[1])\"]",
                "      replace: [x: \"$Word\", x: \"$Both\"]",
                "  - x: \"$Word\"") + LEAF_AND_ROW_RULES);

        TokenStream speech = engine.speak(mathml("<math><mfrac><mn>1</mn><mn>2</mn></mfrac></math>"));

        assertEquals("inner inner-1 outer", speech.toSpeechString());
    }

    @Test
    void ruleVariablesAreVisibleToNestedRules() throws IOException {
        RuleEngine engine = speechEngine(yaml(
                "- name: fraction",
                "  tag: mfrac",
                "  variables: [InFraction: \"true()\"]",
                "  match: \".\"",
                "  replace: [x: \"*\"]",
                "- name: in-fraction",
                "  tag: mn",
                "  match: \"$InFraction\"",
                "  replace: [t: \"digit\"]") + LEAF_AND_ROW_RULES);

        assertEquals("digit digit",
                engine.speak(mathml("<math><mfrac><mn>1</mn><mn>2</mn></mfrac></math>")).toSpeechString());
        assertEquals("3", engine.speak(mathml("<math><mn>3</mn></math>")).toSpeechString());
    }

    @Test
    void preferencesAreVariables() throws IOException {
        String rules = yaml(
                "- name: verbose",
                "  tag: mi",
                "  match: \".\"",
                "  replace:",
                "  - test:",
                "      if: \"$Verbosity = 'Verbose'\"",
                "      then: [t: \"the variable\"]",
                "  - x: \"text()\"") + LEAF_AND_ROW_RULES;
        Node x = mathml("<math><mi>x</mi></math>");

        RuleEngine verbose = RuleEngine.builder().speechRules(ruleSet(rules)).preference("Verbosity", "Verbose").build();
        RuleEngine terse = RuleEngine.builder().speechRules(ruleSet(rules)).preference("Verbosity", "Terse").build();

        assertEquals("the variable x", verbose.speak(x).toSpeechString());
        assertEquals("x", terse.speak(x).toSpeechString());
    }

    @Test
    void controlTokens() throws IOException {
        TokenStream speech = speechEngine(yaml(
                "- name: controls",
                "  tag: mrow",
                "  match: \".\"",
                "  replace:",
                "  - pause: medium",
                "  - spell: \"*[1]\"",
                "  - pause: \"count(*) * 100\"",
                "  - audio:",
                "      value: \"beep.mp4\"",
                "      replace: [t: \"done\"]",
                "  - pitch:",
                "      value: \"0.5\"",
                "      replace: [x: \"*[2]\"]") + LEAF_AND_ROW_RULES)
                .speak(mathml("<math><mrow><mi>ab</mi><mi>c</mi></mrow></math>"));

        assertEquals(List.of(
                new Token(TokenKind.PAUSE, "medium"),
                new Token(TokenKind.SPELL, "ab"),
                new Token(TokenKind.PAUSE, "200"),
                new Token(TokenKind.AUDIO, "beep.mp4"),
                Token.text("done"),
                new Token(TokenKind.PITCH, "0.5"),
                Token.text("c"),
                new Token(TokenKind.PITCH, "0")), speech.tokens());
        assertEquals("ab done c", speech.toSpeechString());
    }

    @Test
    void blankSpeechTextIsDropped() throws IOException {
        TokenStream speech = speechEngine(yaml(
                "- name: spaced",
                "  tag: mi",
                "  match: \".\"",
                "  replace: [t: \" \", x: \"text()\", t: \"  \"]") + LEAF_AND_ROW_RULES)
                .speak(mathml("<math><mi>x</mi></math>"));

        assertEquals(List.of(Token.text("x")), speech.tokens());
    }

    @Test
    void tagRulesAreTriedBeforeWildcardRules() throws IOException {
        TokenStream speech = speechEngine(yaml(
                "- name: anything",
                "  tag: \"*\"",
                "  match: \"self::m:mi\"",
                "  replace: [t: \"wildcard\"]",
                "- name: identifier",
                "  tag: mi",
                "  match: \".\"",
                "  replace: [t: \"identifier\"]") + LEAF_AND_ROW_RULES)
                .speak(mathml("<math><mi>x</mi></math>"));

        assertEquals("identifier", speech.toSpeechString());
    }

    @Test
    void noMatchingRuleFailsTheConversion() throws IOException {
        RuleEngine engine = speechEngine(yaml(
                "- name: identifier",
                "  tag: mi",
                "  match: \".\"",
                "  replace: [t: \"x\"]"));

        NoMatchingRuleException e = assertThrows(NoMatchingRuleException.class,
                () -> engine.speak(mathml("<math><mi>x</mi></math>")));
        assertEquals("math", e.getTag());
        assertEquals("/math[1]", e.getNodePath());
    }

    @Test
    void replaceErrorIsFatalAndNamesTheRule() throws IOException {
        RuleEngine engine = speechEngine(yaml(
                "- name: broken",
                "  tag: mi",
                "  match: \".\"",
                "  replace: [x: \"$Missing\"]") + LEAF_AND_ROW_RULES);

        ReplacementEvaluationException e = assertThrows(ReplacementEvaluationException.class,
                () -> engine.speak(mathml("<math><mi>x</mi></math>")));
        assertEquals("broken", e.getRuleName());
        assertEquals("/math[1]/mi[1]", e.getNodePath());
        assertTrue(e.getMessage().contains("$Missing"));
    }

    @Test
    void recursionIsBounded() throws IOException {
        RuleEngine engine = RuleEngine.builder()
                .speechRules(ruleSet(yaml(
                        "- name: loop",
                        "  tag: mi",
                        "  match: \".\"",
                        "  replace: [x: \".\"]") + LEAF_AND_ROW_RULES))
                .recursionSlack(3)
                .build();

        ReplacementEvaluationException e = assertThrows(ReplacementEvaluationException.class,
                () -> engine.speak(mathml("<math><mi>x</mi></math>")));
        assertTrue(e.getMessage().contains("depth 5"));
    }

    @Test
    void characterTableUsesLongestMatch() throws IOException {
        RuleEngine engine = RuleEngine.builder()
                .speechRules(ruleSet(LEAF_AND_ROW_RULES, yaml(
                        "- \"a-c\": [spell: \"'.'\"]",
                        "- \"-\": [t: \"minus\"]",
                        "- \"->\": [t: \"arrow\"]",
                        "- \"+\": [t: \"plus\"]")))
                .build();

        TokenStream speech = engine.speak(mathml("<math><mtext>a->b-xy+?</mtext></math>"));

        assertEquals(List.of(
                new Token(TokenKind.SPELL, "a"),
                Token.text("arrow"),
                new Token(TokenKind.SPELL, "b"),
                Token.text("minus"),
                Token.text("xy"),
                Token.text("plus"),
                Token.text("?")), speech.tokens());
    }

    @Test
    void characterTableOnlyAppliesToLeafText() throws IOException {
        RuleEngine engine = RuleEngine.builder()
                .speechRules(ruleSet(yaml(
                        "- name: fraction",
                        "  tag: mfrac",
                        "  match: \".\"",
                        "  replace: [x: \"'+'\", t: \"+\", x: \"*[1]\"]") + LEAF_AND_ROW_RULES,
                        yaml("- \"+\": [t: \"plus\"]")))
                .build();

        TokenStream speech = engine.speak(mathml("<math><mfrac><mo>+</mo><mn>1</mn></mfrac></math>"));

        assertEquals("+ + plus", speech.toSpeechString());
    }

    @Test
    void brailleKeepsCellsTogether() throws IOException {
        RuleEngine engine = RuleEngine.builder()
                .brailleRules(ruleSet(yaml(
                        "- name: default",
                        "  tag: mn",
                        "  match: \".\"",
                        "  replace: [t: \"⠼\", x: \"text()\"]",
                        "- name: default",
                        "  tag: \"*\"",
                        "  match: \".\"",
                        "  replace: [x: \"*\"]"),
                        yaml("- \"1\": [t: \"⠁\"]", "- \"2\": [t: \"⠃\"]")))
                .build();

        assertEquals("⠼⠁⠃", engine.braille(mathml("<math><mn>12</mn></math>")).toBrailleString());
    }

    @Test
    void brailleCharsUsesTheConfiguredCodeService() throws IOException {
        RuleEngine engine = RuleEngine.builder()
                .brailleRules(ruleSet(yaml(
                        "- name: default",
                        "  tag: mi",
                        "  match: \".\"",
                        "  replace: [x: \"BrailleChars(., 'UEB')\", x: \"NestingChars(., '⠹')\"]",
                        "- name: default",
                        "  tag: \"*\"",
                        "  match: \".\"",
                        "  replace: [x: \"*\"]")))
                .brailleCodeService(new BrailleCodeService() {
                    @Override
                    public String nestingChars(Node node, String indicator) {
                        return indicator + indicator;
                    }

                    @Override
                    public String brailleChars(String text, String code, Node node) {
                        return code + ":" + text;
                    }
                })
                .build();

        assertEquals("UEB:x⠹⠹", engine.braille(mathml("<math><mi>x</mi></math>")).toBrailleString());
    }

    @Test
    void bundledRulesGiveTheSameStreamsOnEveryRun() throws IOException {
        String xml = "<math><mrow><msup><mi>x</mi><mn>2</mn></msup><mo>+</mo>"
                + "<mfrac><mn>1</mn><mi>y</mi></mfrac><mo>=</mo>"
                + "<mrow><mo>(</mo><mfrac linethickness='0'><mi>n</mi><mi>k</mi></mfrac><mo>)</mo></mrow></mrow></math>";
        RuleEngine first = MathRulesConfig.loadBundled().createEngine();
        RuleEngine second = MathRulesConfig.loadBundled().createEngine();

        TokenStream speech = first.speak(mathml(xml));

        assertEquals(speech.tokens(), first.speak(mathml(xml)).tokens());
        assertEquals(speech.tokens(), second.speak(mathml(xml)).tokens());
        assertEquals(first.braille(mathml(xml)).tokens(), second.braille(mathml(xml)).tokens());
        assertTrue(speech.count(TokenKind.TEXT) > 5);
    }

    @Test
    void intentWithoutRulesIsTheInput() throws IOException {
        Node math = mathml("<math><mi>x</mi></math>");

        assertSame(math, speechEngine(LEAF_AND_ROW_RULES).toIntent(math));
    }

    @Test
    void intentRulesFeedSpeech() throws IOException {
        RuleEngine engine = RuleEngine.builder()
                .intentRules(ruleSet(yaml(
                        "- name: squared",
                        "  tag: msup",
                        "  match: \"*[2][self::m:mn and text() = '2']\"",
                        "  replace:",
                        "  - intent:",
                        "      name: \"square\"",
                        "      children: [x: \"*[1]\"]")))
                .speechRules(ruleSet(yaml(
                        "- name: square",
                        "  tag: square",
                        "  match: \".\"",
                        "  replace: [x: \"*\", t: \"squared\"]") + LEAF_AND_ROW_RULES))
                .build();

        TokenStream speech = engine.speak(mathml("<math><msup><mi>x</mi><mn>2</mn></msup></math>"));

        assertEquals("x squared", speech.toSpeechString());
    }
}
