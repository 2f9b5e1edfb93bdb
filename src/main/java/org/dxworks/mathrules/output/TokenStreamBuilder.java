package org.dxworks.mathrules.output;

import org.dxworks.mathrules.tree.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects tokens for one conversion. Rate and pitch changes are stacked: each change emits the
 * new value and its end emits the value that was in effect before it.
 */
public class TokenStreamBuilder implements OutputSink {

    public static final String DEFAULT_RATE = "100";
    public static final String DEFAULT_PITCH = "0";

    private final List<Token> tokens = new ArrayList<>();
    private final Map<TokenKind, Deque<String>> prosody = new EnumMap<>(TokenKind.class);
    private final boolean keepBlankText;

    public TokenStreamBuilder(String initialRate, String initialPitch, boolean keepBlankText) {
        this.keepBlankText = keepBlankText;
        prosody.put(TokenKind.RATE, new ArrayDeque<>());
        prosody.put(TokenKind.PITCH, new ArrayDeque<>());
        prosody.get(TokenKind.RATE).push(initialRate == null ? DEFAULT_RATE : initialRate);
        prosody.get(TokenKind.PITCH).push(initialPitch == null ? DEFAULT_PITCH : initialPitch);
    }

    public static TokenStreamBuilder forSpeech(String initialRate) {
        return new TokenStreamBuilder(initialRate, DEFAULT_PITCH, false);
    }

    public static TokenStreamBuilder forBraille() {
        return new TokenStreamBuilder(DEFAULT_RATE, DEFAULT_PITCH, true);
    }

    @Override
    public void text(String text) {
        if (text == null || text.isEmpty()) return;
        if (!keepBlankText && text.isBlank()) return;
        tokens.add(Token.text(keepBlankText ? text : text.strip()));
    }

    @Override
    public void appendText(String text) {
        if (text == null || text.isEmpty()) return;
        int last = tokens.size() - 1;
        if (last < 0 || tokens.get(last).kind != TokenKind.TEXT) {
            text(text);
            return;
        }
        String joined = tokens.get(last).value + text;
        tokens.set(last, Token.text(keepBlankText ? joined : joined.strip()));
    }

    @Override
    public void control(TokenKind kind, String value) {
        if (kind == TokenKind.TEXT || kind == TokenKind.RATE || kind == TokenKind.PITCH) {
            throw new IllegalArgumentException(kind + " is not a control token");
        }
        tokens.add(new Token(kind, value == null ? "" : value));
    }

    @Override
    public void beginProsody(TokenKind kind, String value) {
        Deque<String> stack = stackFor(kind);
        stack.push(value);
        tokens.add(new Token(kind, value));
    }

    @Override
    public void endProsody(TokenKind kind) {
        Deque<String> stack = stackFor(kind);
        if (stack.size() < 2) {
            throw new IllegalStateException("Unbalanced end of " + kind);
        }
        stack.pop();
        tokens.add(new Token(kind, stack.peek()));
    }

    public String current(TokenKind kind) {
        return stackFor(kind).peek();
    }

    @Override
    public boolean acceptsElements() {
        return false;
    }

    @Override
    public void element(Node node) {
        throw new UnsupportedOperationException("Token output cannot hold tree nodes");
    }

    public TokenStream build() {
        return new TokenStream(tokens);
    }

    private Deque<String> stackFor(TokenKind kind) {
        Deque<String> stack = prosody.get(kind);
        if (stack == null) throw new IllegalArgumentException(kind + " is not a prosody token");
        return stack;
    }
}
