package org.dxworks.mathrules.tree;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes trees as JSON objects of the shape {@code {name, attributes, text, children}}.
 */
public final class JsonTreeCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonTreeCodec() {
        // utility class
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static class JsonNode {
        public String name;
        public Map<String, String> attributes;
        public String text;
        public List<JsonNode> children;
    }

    public static Node read(Path path) throws IOException {
        return fromJson(MAPPER.readValue(path.toFile(), JsonNode.class));
    }

    public static Node parse(String json) throws IOException {
        return fromJson(MAPPER.readValue(json, JsonNode.class));
    }

    public static JsonNode toJson(Node node) {
        JsonNode json = new JsonNode();
        json.name = node.getName();
        if (!node.getAttributes().isEmpty()) {
            json.attributes = new LinkedHashMap<>(node.getAttributes());
        }
        if (node.isLeaf()) {
            json.text = node.getText();
        } else {
            json.children = new ArrayList<>();
            for (Node child : node.children()) {
                json.children.add(toJson(child));
            }
        }
        return json;
    }

    public static Node fromJson(JsonNode json) {
        if (json == null || json.name == null || json.name.isBlank()) {
            throw new IllegalArgumentException("Tree node without a name");
        }
        boolean hasChildren = json.children != null && !json.children.isEmpty();
        if (hasChildren && json.text != null && !json.text.isEmpty()) {
            throw new IllegalArgumentException("<" + json.name + "> cannot have both text and children");
        }
        if (!hasChildren) {
            return Node.leaf(json.name, json.attributes, json.text);
        }
        List<Node> children = new ArrayList<>();
        for (JsonNode child : json.children) {
            children.add(fromJson(child));
        }
        return Node.element(json.name, json.attributes, children);
    }
}
