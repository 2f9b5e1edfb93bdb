package org.dxworks.mathrules.output;

import org.dxworks.mathrules.tree.Node;

/**
 * Receives the output of replacement instructions, either as tokens or as intent-tree nodes.
 */
public interface OutputSink {

    void text(String text);

    /**
     * Text glued to the end of the previous text output without a separator. When the previous
     * output was not text it behaves like {@link #text(String)}.
     */
    void appendText(String text);

    void control(TokenKind kind, String value);

    /**
     * Starts a prosody change ({@link TokenKind#RATE} or {@link TokenKind#PITCH}) that lasts until
     * the matching {@link #endProsody(TokenKind)}.
     */
    void beginProsody(TokenKind kind, String value);

    void endProsody(TokenKind kind);

    boolean acceptsElements();

    void element(Node node);
}
