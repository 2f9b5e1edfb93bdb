package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.expr.BrailleCodeService;
import org.dxworks.mathrules.expr.Coerce;
import org.dxworks.mathrules.expr.DefaultBrailleCodeService;
import org.dxworks.mathrules.output.TokenStream;
import org.dxworks.mathrules.output.TokenStreamBuilder;
import org.dxworks.mathrules.rules.Definitions;
import org.dxworks.mathrules.rules.RuleSet;
import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.TreeHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for conversions. Holds the loaded rule sets and can be shared between threads;
 * every call creates its own {@link Conversion}.
 */
public class RuleEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleEngine.class);

    public static final int DEFAULT_RECURSION_SLACK = 16;
    public static final String RATE_PREFERENCE = "MathRate";

    private final RuleSet intentRules;
    private final RuleSet speechRules;
    private final RuleSet brailleRules;
    private final Definitions definitions;
    private final Map<String, Object> preferences;
    private final BrailleCodeService braille;
    private final int recursionSlack;
    private final boolean brailleFromIntent;

    private RuleEngine(Builder builder) {
        this.intentRules = builder.intentRules;
        this.speechRules = builder.speechRules;
        this.brailleRules = builder.brailleRules;
        this.definitions = builder.definitions;
        this.preferences = Collections.unmodifiableMap(new LinkedHashMap<>(builder.preferences));
        this.braille = builder.braille;
        this.recursionSlack = builder.recursionSlack;
        this.brailleFromIntent = builder.brailleFromIntent;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> getPreferences() {
        return preferences;
    }

    /**
     * Runs the intent rules; without intent rules the tree is returned as is.
     */
    public Node toIntent(Node root) {
        if (intentRules.getRuleCount() == 0) {
            return root;
        }
        LOGGER.debug("Intent pass over <{}>", root.getName());
        return new IntentConversion(intentRules, definitions, braille, maxDepth(root))
                .convert(root, rootScope());
    }

    public TokenStream speak(Node root) {
        Node intent = toIntent(root);
        Scope scope = rootScope();
        String rate = scope.isBound(RATE_PREFERENCE)
                ? Coerce.toString(scope.resolve(RATE_PREFERENCE))
                : TokenStreamBuilder.DEFAULT_RATE;
        LOGGER.debug("Speech pass over <{}>", intent.getName());
        return new SpeechConversion(speechRules, definitions, braille, maxDepth(intent))
                .convert(intent, scope, TokenStreamBuilder.forSpeech(rate));
    }

    /**
     * Runs the braille rules over the intent tree, or over {@code root} itself when the engine was
     * built with {@code brailleFromIntent(false)}.
     */
    public TokenStream braille(Node root) {
        Node source = brailleFromIntent ? toIntent(root) : root;
        LOGGER.debug("Braille pass over <{}>", source.getName());
        return new SpeechConversion(brailleRules, definitions, braille, maxDepth(source))
                .convert(source, rootScope(), TokenStreamBuilder.forBraille());
    }

    private Scope rootScope() {
        return Scope.root(preferences);
    }

    private int maxDepth(Node root) {
        return TreeHelper.height(root) + recursionSlack;
    }

    public static final class Builder {
        private RuleSet intentRules = RuleSet.EMPTY;
        private RuleSet speechRules = RuleSet.EMPTY;
        private RuleSet brailleRules = RuleSet.EMPTY;
        private Definitions definitions = Definitions.EMPTY;
        private final Map<String, Object> preferences = new LinkedHashMap<>();
        private BrailleCodeService braille = DefaultBrailleCodeService.INSTANCE;
        private int recursionSlack = DEFAULT_RECURSION_SLACK;
        private boolean brailleFromIntent = true;

        private Builder() {
        }

        public Builder intentRules(RuleSet rules) {
            this.intentRules = rules;
            return this;
        }

        public Builder speechRules(RuleSet rules) {
            this.speechRules = rules;
            return this;
        }

        public Builder brailleRules(RuleSet rules) {
            this.brailleRules = rules;
            return this;
        }

        public Builder definitions(Definitions value) {
            this.definitions = value;
            return this;
        }

        public Builder preference(String name, Object value) {
            this.preferences.put(name, value);
            return this;
        }

        public Builder preferences(Map<String, ?> values) {
            this.preferences.putAll(values);
            return this;
        }

        public Builder brailleCodeService(BrailleCodeService value) {
            this.braille = value;
            return this;
        }

        public Builder recursionSlack(int value) {
            if (value < 0) throw new IllegalArgumentException("recursionSlack must not be negative");
            this.recursionSlack = value;
            return this;
        }

        public Builder brailleFromIntent(boolean value) {
            this.brailleFromIntent = value;
            return this;
        }

        public RuleEngine build() {
            return new RuleEngine(this);
        }
    }
}
