package org.dxworks.mathrules.output;

import org.dxworks.mathrules.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the elements and text produced by intent rules. Control tokens have no place in an
 * intent tree and are dropped.
 */
public class IntentNodeBuilder implements OutputSink {

    private final List<Object> items = new ArrayList<>();

    @Override
    public void text(String text) {
        if (text == null || text.isBlank()) return;
        int last = items.size() - 1;
        if (last >= 0 && items.get(last) instanceof StringBuilder) {
            ((StringBuilder) items.get(last)).append(text);
        } else {
            items.add(new StringBuilder(text));
        }
    }

    @Override
    public void appendText(String text) {
        int last = items.size() - 1;
        if (text != null && last >= 0 && items.get(last) instanceof StringBuilder) {
            ((StringBuilder) items.get(last)).append(text);
        } else {
            text(text);
        }
    }

    @Override
    public void control(TokenKind kind, String value) {
        // not part of the intent tree
    }

    @Override
    public void beginProsody(TokenKind kind, String value) {
        // not part of the intent tree
    }

    @Override
    public void endProsody(TokenKind kind) {
        // not part of the intent tree
    }

    @Override
    public boolean acceptsElements() {
        return true;
    }

    @Override
    public void element(Node node) {
        items.add(node);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean hasElements() {
        return items.stream().anyMatch(i -> i instanceof Node);
    }

    /**
     * All text output concatenated; meaningful when {@link #hasElements()} is false.
     */
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (Object item : items) {
            if (item instanceof StringBuilder) sb.append(item);
        }
        return sb.toString().strip();
    }

    /**
     * The output as elements, with text between elements wrapped in {@code mtext} leaves.
     */
    public List<Node> elements() {
        List<Node> nodes = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Node) {
                nodes.add((Node) item);
            } else {
                nodes.add(Node.leaf("mtext", item.toString().strip()));
            }
        }
        return nodes;
    }
}
