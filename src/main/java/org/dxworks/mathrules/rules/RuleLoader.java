package org.dxworks.mathrules.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.expr.FunctionRegistry;
import org.dxworks.mathrules.replace.Instruction;
import org.dxworks.mathrules.replace.InstructionParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads rule documents, definition documents and character tables from YAML.
 * Loading is strict: any shape problem aborts with a {@link MalformedRuleException}.
 */
public class RuleLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleLoader.class);

    private static final Set<String> RULE_KEYS = Set.of("name", "tag", "variables", "match", "replace");

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final InstructionParser parser;

    public RuleLoader() {
        this(FunctionRegistry.standard());
    }

    public RuleLoader(FunctionRegistry functions) {
        this.parser = new InstructionParser(functions);
    }

    /**
     * Loads the rule documents in order, then the character tables (later tables override
     * earlier entries).
     */
    public RuleSet loadRuleSet(List<RuleSource> ruleSources, List<RuleSource> characterSources) throws IOException {
        List<Rule> rules = new ArrayList<>();
        for (RuleSource source : ruleSources) {
            rules.addAll(loadRules(source));
        }
        CharacterRules characters = CharacterRules.EMPTY;
        for (RuleSource source : characterSources) {
            characters = characters.merge(loadCharacters(source));
        }
        LOGGER.debug("Loaded {} rules and {} character entries", rules.size(), characters.size());
        return new RuleSet(rules, characters);
    }

    public List<Rule> loadRules(RuleSource source) throws IOException {
        JsonNode root = readYaml(source);
        List<Rule> rules = new ArrayList<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return rules;
        }
        if (!root.isArray()) {
            throw fail(source, null, "a rule document must be a list of rules", null);
        }
        int index = 0;
        for (JsonNode entry : root) {
            index++;
            String name = entry.isObject() && entry.hasNonNull("name") ? entry.get("name").asText() : "#" + index;
            try {
                rules.add(parseRule(entry, name, source.getLabel()));
            } catch (MalformedRuleException e) {
                throw fail(source, name, e.getMessage(), e);
            }
        }
        return rules;
    }

    private Rule parseRule(JsonNode entry, String name, String document) {
        if (!entry.isObject()) {
            throw new MalformedRuleException("a rule must be a mapping, got: " + entry);
        }
        Iterator<String> keys = entry.fieldNames();
        while (keys.hasNext()) {
            String key = keys.next();
            if (!RULE_KEYS.contains(key)) {
                throw new MalformedRuleException("unknown key '" + key + "'");
            }
        }
        List<String> tags = parseTags(entry.get("tag"));
        if (!entry.has("match")) {
            throw new MalformedRuleException("missing 'match'");
        }
        if (!entry.has("replace")) {
            throw new MalformedRuleException("missing 'replace'");
        }
        List<VariableDef> variables = parser.parseVariables(entry.get("variables"));
        CompiledExpression match = parser.compileCondition(entry.get("match"));
        List<Instruction> replace = parser.parseList(entry.get("replace"));
        return new Rule(name, tags, variables, match, replace, document);
    }

    private static List<String> parseTags(JsonNode tag) {
        List<String> tags = new ArrayList<>();
        if (tag == null || tag.isNull()) {
            throw new MalformedRuleException("missing 'tag'");
        }
        if (tag.isTextual()) {
            tags.add(tag.asText());
        } else if (tag.isArray() && tag.size() > 0) {
            for (JsonNode t : tag) {
                if (!t.isTextual()) {
                    throw new MalformedRuleException("tag must be a string, got: " + t);
                }
                tags.add(t.asText());
            }
        } else {
            throw new MalformedRuleException("tag must be a string or a list of strings, got: " + tag);
        }
        return tags;
    }

    /**
     * Named sets, later documents replacing same-named sets of earlier ones.
     */
    public Definitions loadDefinitions(List<RuleSource> sources) throws IOException {
        Definitions definitions = Definitions.EMPTY;
        for (RuleSource source : sources) {
            definitions = definitions.merge(loadDefinitions(source));
        }
        return definitions;
    }

    public Definitions loadDefinitions(RuleSource source) throws IOException {
        JsonNode root = readYaml(source);
        Map<String, Set<String>> sets = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : pairs(source, root)) {
            JsonNode value = entry.getValue();
            Set<String> values = new LinkedHashSet<>();
            if (value.isArray()) {
                for (JsonNode item : value) {
                    if (!item.isValueNode()) {
                        throw fail(source, entry.getKey(), "definition values must be strings", null);
                    }
                    values.add(item.asText());
                }
            } else if (value.isObject()) {
                value.fieldNames().forEachRemaining(values::add);
            } else if (!value.isNull()) {
                throw fail(source, entry.getKey(), "a definition must be a list or a mapping", null);
            }
            sets.put(entry.getKey(), values);
        }
        return new Definitions(sets);
    }

    /**
     * A character table. Range keys such as {@code a-z} are expanded to one entry per character.
     */
    public CharacterRules loadCharacters(RuleSource source) throws IOException {
        JsonNode root = readYaml(source);
        Map<String, List<Instruction>> entries = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> entry : pairs(source, root)) {
            String key = entry.getKey();
            try {
                int[] range = range(key);
                if (range == null) {
                    entries.put(key, parser.parseList(entry.getValue()));
                    continue;
                }
                for (int cp = range[0]; cp <= range[1]; cp++) {
                    String ch = new String(Character.toChars(cp));
                    entries.put(ch, parser.parseList(substitute(entry.getValue(), ch, null)));
                }
            } catch (MalformedRuleException e) {
                throw fail(source, key, e.getMessage(), e);
            }
        }
        return new CharacterRules(entries);
    }

    static int[] range(String key) {
        int[] cps = key.codePoints().toArray();
        if (cps.length != 3 || cps[1] != '-' || cps[0] >= cps[2]) {
            return null;
        }
        return new int[]{cps[0], cps[2]};
    }

    /**
     * Copy of {@code node} where {@code t: "."} becomes the character and a quoted {@code '.'}
     * inside expressions becomes the quoted character.
     */
    static JsonNode substitute(JsonNode node, String ch, String fieldName) {
        if (node.isObject()) {
            ObjectNode copy = ((ObjectNode) node).objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), substitute(field.getValue(), ch, field.getKey()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = ((ArrayNode) node).arrayNode();
            for (JsonNode item : node) {
                copy.add(substitute(item, ch, fieldName));
            }
            return copy;
        }
        if (node.isTextual()) {
            String text = node.asText();
            if (("t".equals(fieldName) || "T".equals(fieldName)) && text.equals(".")) {
                return TextNode.valueOf(ch);
            }
            String quoted = ch.equals("'") ? "\"'\"" : "'" + ch + "'";
            return TextNode.valueOf(text.replace("'.'", quoted).replace("\".\"", quoted));
        }
        return node;
    }

    /**
     * Entries of a mapping, or of a sequence of single-pair mappings, in document order.
     */
    private List<Map.Entry<String, JsonNode>> pairs(RuleSource source, JsonNode root) {
        List<Map.Entry<String, JsonNode>> result = new ArrayList<>();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return result;
        }
        if (root.isObject()) {
            root.fields().forEachRemaining(result::add);
        } else if (root.isArray()) {
            for (JsonNode item : root) {
                if (!item.isObject()) {
                    throw fail(source, null, "expected 'key: value' entries, got: " + item, null);
                }
                item.fields().forEachRemaining(result::add);
            }
        } else {
            throw fail(source, null, "expected a list or a mapping", null);
        }
        return result;
    }

    private JsonNode readYaml(RuleSource source) throws IOException {
        String content = source.read();
        try {
            return mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw fail(source, null, "invalid YAML: " + e.getOriginalMessage(), e);
        }
    }

    private static MalformedRuleException fail(RuleSource source, String ruleName, String message, Throwable cause) {
        LOGGER.warn("{}: {}{}", source.getLabel(), ruleName == null ? "" : "'" + ruleName + "': ", message);
        return new MalformedRuleException(source.getLabel(), ruleName, message, cause);
    }
}
