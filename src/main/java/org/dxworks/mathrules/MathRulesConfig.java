package org.dxworks.mathrules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.mathrules.engine.RuleEngine;
import org.dxworks.mathrules.rules.Definitions;
import org.dxworks.mathrules.rules.RuleLoader;
import org.dxworks.mathrules.rules.RuleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Which rule documents to load and which preferences to start from. Entries prefixed with
 * {@code classpath:} are loaded from the classpath; other paths are resolved against the
 * directory of the configuration file.
 */
public class MathRulesConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(MathRulesConfig.class);

    public static final String CONFIG_FILE_NAME = "mathrules-config.yml";
    public static final String CLASSPATH_PREFIX = "classpath:";
    private static final int DEFAULT_RECURSION_SLACK = RuleEngine.DEFAULT_RECURSION_SLACK;

    private final List<RuleSource> intentRules;
    private final List<RuleSource> speechRules;
    private final List<RuleSource> brailleRules;
    private final List<RuleSource> definitions;
    private final List<RuleSource> unicode;
    private final List<RuleSource> brailleUnicode;
    private final Map<String, Object> preferences;
    private final int recursionSlack;
    private final boolean brailleFromIntent;

    private MathRulesConfig(YamlConfig yaml, Path baseDir) {
        this.intentRules = sources(yaml.intentRules, baseDir);
        this.speechRules = sources(yaml.speechRules, baseDir);
        this.brailleRules = sources(yaml.brailleRules, baseDir);
        this.definitions = sources(yaml.definitions, baseDir);
        this.unicode = sources(yaml.unicode, baseDir);
        this.brailleUnicode = sources(yaml.brailleUnicode, baseDir);
        this.preferences = yaml.preferences == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(yaml.preferences));
        this.recursionSlack = (yaml.recursionSlack != null && yaml.recursionSlack >= 0)
                ? yaml.recursionSlack
                : DEFAULT_RECURSION_SLACK;
        this.brailleFromIntent = yaml.brailleFromIntent == null || yaml.brailleFromIntent;
    }

    public List<RuleSource> getIntentRules() {
        return intentRules;
    }

    public List<RuleSource> getSpeechRules() {
        return speechRules;
    }

    public List<RuleSource> getBrailleRules() {
        return brailleRules;
    }

    public List<RuleSource> getDefinitions() {
        return definitions;
    }

    public List<RuleSource> getUnicode() {
        return unicode;
    }

    public List<RuleSource> getBrailleUnicode() {
        return brailleUnicode;
    }

    public Map<String, Object> getPreferences() {
        return preferences;
    }

    public int getRecursionSlack() {
        return recursionSlack;
    }

    public boolean isBrailleFromIntent() {
        return brailleFromIntent;
    }

    public boolean hasBrailleRules() {
        return !brailleRules.isEmpty();
    }

    /**
     * {@code mathrules-config.yml} from the working directory if present, else the bundled one.
     */
    public static MathRulesConfig load() {
        Path configPath = Paths.get(CONFIG_FILE_NAME);
        if (Files.exists(configPath)) {
            return load(configPath);
        }
        return loadBundled();
    }

    /**
     * Reads {@code configPath}; an unreadable file falls back to the bundled configuration.
     */
    public static MathRulesConfig load(Path configPath) {
        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Path baseDir = configPath.toAbsolutePath().getParent();
                return new MathRulesConfig(yamlConfig, baseDir);
            }
        } catch (IOException e) {
            LOGGER.warn("Cannot read {}, using the bundled configuration: {}", configPath, e.getMessage());
        }
        return loadBundled();
    }

    public static MathRulesConfig loadBundled() {
        try (InputStream in = MathRulesConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE_NAME)) {
            if (in != null) {
                YamlConfig yamlConfig = new ObjectMapper(new YAMLFactory()).readValue(in, YamlConfig.class);
                if (yamlConfig != null) {
                    return new MathRulesConfig(yamlConfig, Paths.get(""));
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Cannot read the bundled {}: {}", CONFIG_FILE_NAME, e.getMessage());
        }
        return new MathRulesConfig(new YamlConfig(), Paths.get(""));
    }

    public static MathRulesConfig fromYaml(String yaml, Path baseDir) throws IOException {
        YamlConfig yamlConfig = new ObjectMapper(new YAMLFactory()).readValue(yaml, YamlConfig.class);
        return new MathRulesConfig(yamlConfig == null ? new YamlConfig() : yamlConfig, baseDir);
    }

    /**
     * Loads every configured document and builds the engine.
     *
     * @throws org.dxworks.mathrules.rules.MalformedRuleException when a document is malformed
     */
    public RuleEngine createEngine() throws IOException {
        RuleLoader loader = new RuleLoader();
        Definitions loadedDefinitions = loader.loadDefinitions(definitions);
        return RuleEngine.builder()
                .intentRules(loader.loadRuleSet(intentRules, List.of()))
                .speechRules(loader.loadRuleSet(speechRules, unicode))
                .brailleRules(loader.loadRuleSet(brailleRules, brailleUnicode))
                .definitions(loadedDefinitions)
                .preferences(preferences)
                .recursionSlack(recursionSlack)
                .brailleFromIntent(brailleFromIntent)
                .build();
    }

    private static List<RuleSource> sources(List<String> entries, Path baseDir) {
        List<RuleSource> result = new ArrayList<>();
        if (entries == null) return result;
        for (String entry : entries) {
            if (entry.startsWith(CLASSPATH_PREFIX)) {
                result.add(RuleSource.ofResource(entry.substring(CLASSPATH_PREFIX.length())));
            } else {
                Path path = Paths.get(entry);
                result.add(RuleSource.of(path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path)));
            }
        }
        return result;
    }

    private static class YamlConfig {
        public List<String> intentRules;
        public List<String> speechRules;
        public List<String> brailleRules;
        public List<String> definitions;
        public List<String> unicode;
        public List<String> brailleUnicode;
        public Map<String, Object> preferences;
        public Integer recursionSlack;
        public Boolean brailleFromIntent;
    }
}
