package org.dxworks.mathrules.rules;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Where a rule, definition or character-table document comes from.
 */
public abstract class RuleSource {

    private final String label;

    protected RuleSource(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public abstract String read() throws IOException;

    public static RuleSource of(Path path) {
        return new RuleSource(path.toString()) {
            @Override
            public String read() throws IOException {
                return Files.readString(path, StandardCharsets.UTF_8);
            }
        };
    }

    public static RuleSource ofResource(String resource) {
        return new RuleSource("classpath:" + resource) {
            @Override
            public String read() throws IOException {
                try (InputStream in = RuleSource.class.getClassLoader().getResourceAsStream(resource)) {
                    if (in == null) throw new IOException("Resource not found: " + resource);
                    return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        };
    }

    public static RuleSource ofString(String label, String content) {
        return new RuleSource(label) {
            @Override
            public String read() {
                return content;
            }
        };
    }

    @Override
    public String toString() {
        return label;
    }
}
