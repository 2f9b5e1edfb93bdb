package org.dxworks.mathrules.replace;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.mathrules.expr.CompiledExpression;
import org.dxworks.mathrules.expr.ExpressionSyntaxException;
import org.dxworks.mathrules.expr.FunctionRegistry;
import org.dxworks.mathrules.output.TokenKind;
import org.dxworks.mathrules.rules.MalformedRuleException;
import org.dxworks.mathrules.rules.VariableDef;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Compiles the YAML form of replacement lists into {@link Instruction}s. Every expression is
 * compiled here, so syntax errors surface when the rules are loaded.
 */
public class InstructionParser {

    private final FunctionRegistry functions;

    public InstructionParser(FunctionRegistry functions) {
        this.functions = functions;
    }

    /**
     * A list of instructions, or a single mapping whose keys are instructions in order.
     */
    public List<Instruction> parseList(JsonNode node) {
        List<Instruction> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isValueNode() && !item.isNull()) {
                    // a bare string in a list is literal text
                    result.add(new TextInstruction(item.asText()));
                } else if (item.isObject()) {
                    parseMapping(item, result);
                } else {
                    throw new MalformedRuleException("Instruction must be a mapping or text, got: " + item);
                }
            }
        } else if (node.isObject()) {
            parseMapping(node, result);
        } else {
            throw new MalformedRuleException("Expected an instruction list, got: " + node);
        }
        return result;
    }

    private void parseMapping(JsonNode mapping, List<Instruction> into) {
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            into.add(parseInstruction(field.getKey(), field.getValue()));
        }
    }

    private Instruction parseInstruction(String key, JsonNode value) {
        switch (key) {
            case "t":
            case "T":
                return new TextInstruction(scalar(key, value));
            case "ct":
                return new TextInstruction(scalar(key, value), TextInstruction.Mode.JOINED);
            case "ot":
                return new TextInstruction(scalar(key, value), TextInstruction.Mode.OPTIONAL);
            case "x":
                return new NodeInstruction(compileExpression(scalar(key, value)));
            case "test":
                return parseTest(value);
            case "with":
                return new WithInstruction(parseVariables(required(value, "variables", key)),
                        parseList(required(value, "replace", key)));
            case "insert":
                return new InsertInstruction(compileExpression(scalar("nodes", required(value, "nodes", key))),
                        parseList(required(value, "replace", key)));
            case "bookmark":
                return new BookmarkInstruction(compileExpression(scalar(key, value)));
            case "pause": {
                String pause = scalar(key, value);
                return PauseInstruction.isLiteral(pause)
                        ? PauseInstruction.literal(pause)
                        : PauseInstruction.computed(compileExpression(pause));
            }
            case "spell":
                return new SpellInstruction(compileExpression(scalar(key, value)));
            case "rate":
                return parseProsody(TokenKind.RATE, key, value);
            case "pitch":
                return parseProsody(TokenKind.PITCH, key, value);
            case "audio": {
                String audio = scalar("value", required(value, "value", key));
                List<Instruction> body = parseList(value.get("replace"));
                return AudioInstruction.isLiteral(audio)
                        ? AudioInstruction.literal(audio, body)
                        : AudioInstruction.computed(compileExpression(audio), body);
            }
            case "intent":
                return new IntentInstruction(scalar("name", required(value, "name", key)),
                        parseList(value.get("children")));
            default:
                throw new MalformedRuleException("Unknown instruction '" + key + "'");
        }
    }

    private Instruction parseProsody(TokenKind kind, String key, JsonNode value) {
        return new ProsodyInstruction(kind, compileExpression(scalar("value", required(value, "value", key))),
                parseList(value.get("replace")));
    }

    /**
     * {@code test:} as one mapping, or as a list starting with {@code if} followed by
     * {@code else_if} entries; {@code else} may sit on the last entry or on an entry of its own.
     */
    private Instruction parseTest(JsonNode value) {
        List<TestInstruction.Branch> branches = new ArrayList<>();
        List<Instruction> otherwise = new ArrayList<>();
        if (value != null && value.isObject()) {
            branches.add(parseBranch(value, "if"));
            otherwise = parseElse(value);
        } else if (value != null && value.isArray() && value.size() > 0) {
            for (int i = 0; i < value.size(); i++) {
                JsonNode entry = value.get(i);
                if (!entry.isObject()) {
                    throw new MalformedRuleException("test: entries must be mappings, got: " + entry);
                }
                boolean last = i == value.size() - 1;
                if (i > 0 && last && !entry.has("else_if") && !entry.has("if")) {
                    otherwise = parseElse(entry);
                    break;
                }
                branches.add(parseBranch(entry, i == 0 ? "if" : "else_if"));
                if (entry.has("else") || entry.has("else_test")) {
                    if (!last) {
                        throw new MalformedRuleException("test: 'else' must be on the last entry");
                    }
                    otherwise = parseElse(entry);
                }
            }
        } else {
            throw new MalformedRuleException("test: must be a mapping or a non-empty list");
        }
        return new TestInstruction(branches, otherwise);
    }

    private TestInstruction.Branch parseBranch(JsonNode entry, String conditionKey) {
        JsonNode condition = entry.get(conditionKey);
        if (condition == null) {
            throw new MalformedRuleException("test: expected '" + conditionKey + "' in " + entry);
        }
        List<Instruction> then;
        if (entry.has("then_test")) {
            then = List.of(parseTest(entry.get("then_test")));
        } else {
            then = parseList(entry.get("then"));
        }
        return new TestInstruction.Branch(compileCondition(condition), then);
    }

    private List<Instruction> parseElse(JsonNode entry) {
        if (entry.has("else_test")) {
            return List.of(parseTest(entry.get("else_test")));
        }
        if (entry.has("else")) {
            return parseList(entry.get("else"));
        }
        if (!entry.has("if") && !entry.has("else_if")) {
            throw new MalformedRuleException("test: unexpected entry " + entry);
        }
        return new ArrayList<>();
    }

    /**
     * Variables as a list of single-pair mappings (or one mapping), kept in declaration order.
     */
    public List<VariableDef> parseVariables(JsonNode node) {
        List<VariableDef> result = new ArrayList<>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (!item.isObject()) {
                    throw new MalformedRuleException("variables: entries must be 'name: expression', got: " + item);
                }
                addVariables(item, result);
            }
        } else if (node.isObject()) {
            addVariables(node, result);
        } else {
            throw new MalformedRuleException("variables: must be a list, got: " + node);
        }
        return result;
    }

    private void addVariables(JsonNode mapping, List<VariableDef> into) {
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            into.add(new VariableDef(field.getKey(), compileExpression(scalar(field.getKey(), field.getValue()))));
        }
    }

    public CompiledExpression compileExpression(String source) {
        try {
            return CompiledExpression.compile(source, functions);
        } catch (ExpressionSyntaxException e) {
            throw new MalformedRuleException("Invalid expression '" + source + "': " + e.getMessage(), e);
        }
    }

    /**
     * A condition written as a string or as a list of pieces. Pieces are one expression split
     * over several lines; when the joined text does not compile but every piece does, the pieces
     * are and-ed.
     */
    public CompiledExpression compileCondition(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new MalformedRuleException("Missing condition");
        }
        if (!node.isArray()) {
            return compileExpression(scalar("condition", node));
        }
        List<String> pieces = new ArrayList<>();
        for (JsonNode piece : node) {
            pieces.add(scalar("condition", piece));
        }
        if (pieces.isEmpty()) {
            throw new MalformedRuleException("Empty condition list");
        }
        String joined = String.join(" ", pieces);
        try {
            return CompiledExpression.compile(joined, functions);
        } catch (ExpressionSyntaxException joinError) {
            List<CompiledExpression> parts = new ArrayList<>();
            for (String piece : pieces) {
                try {
                    parts.add(CompiledExpression.compile(piece, functions));
                } catch (ExpressionSyntaxException e) {
                    throw new MalformedRuleException("Invalid expression '" + joined + "': " + joinError.getMessage(), joinError);
                }
            }
            return CompiledExpression.and(joined, parts);
        }
    }

    private static JsonNode required(JsonNode mapping, String field, String instruction) {
        if (mapping == null || !mapping.isObject()) {
            throw new MalformedRuleException(instruction + ": expected a mapping");
        }
        JsonNode value = mapping.get(field);
        if (value == null) {
            throw new MalformedRuleException(instruction + ": missing '" + field + "'");
        }
        return value;
    }

    private static String scalar(String key, JsonNode value) {
        if (value == null || value.isNull()) {
            return "";
        }
        if (!value.isValueNode()) {
            throw new MalformedRuleException(key + ": expected a string, got: " + value);
        }
        return value.asText();
    }
}
