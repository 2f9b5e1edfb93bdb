package org.dxworks.mathrules.output;

import org.dxworks.mathrules.tree.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenStreamTest {

    @Test
    void speechJoinsSpokenTokensWithSpaces() {
        TokenStreamBuilder out = TokenStreamBuilder.forSpeech(null);
        out.control(TokenKind.BOOKMARK, "a");
        out.text(" x ");
        out.control(TokenKind.PAUSE, "short");
        out.control(TokenKind.SPELL, "y");
        out.text("   ");
        out.text("");

        TokenStream stream = out.build();

        assertEquals(4, stream.size());
        assertEquals("x y", stream.toSpeechString());
    }

    @Test
    void appendedTextJoinsThePreviousTextToken() {
        TokenStreamBuilder out = TokenStreamBuilder.forSpeech(null);
        out.appendText("s");
        out.text("case");
        out.appendText("s");
        out.appendText(" ");
        out.control(TokenKind.PAUSE, "short");
        out.appendText("!");

        assertEquals(List.of(Token.text("s"), Token.text("cases"), new Token(TokenKind.PAUSE, "short"), Token.text("!")),
                out.build().tokens());

        IntentNodeBuilder intent = new IntentNodeBuilder();
        intent.text("case");
        intent.appendText("s");
        assertEquals("cases", intent.text());
    }

    @Test
    void brailleKeepsBlankCells() {
        TokenStreamBuilder out = TokenStreamBuilder.forBraille();
        out.text("⠁");
        out.text(" ");
        out.text("⠃");

        assertEquals("⠁ ⠃", out.build().toBrailleString());
    }

    @Test
    void prosodyRestoresThePreviousValue() {
        TokenStreamBuilder out = TokenStreamBuilder.forSpeech("90");
        out.beginProsody(TokenKind.PITCH, "1.5");
        out.beginProsody(TokenKind.RATE, "60");
        assertEquals("60", out.current(TokenKind.RATE));
        out.endProsody(TokenKind.RATE);
        out.endProsody(TokenKind.PITCH);

        assertEquals(List.of(
                new Token(TokenKind.PITCH, "1.5"),
                new Token(TokenKind.RATE, "60"),
                new Token(TokenKind.RATE, "90"),
                new Token(TokenKind.PITCH, "0")), out.build().tokens());
        assertThrows(IllegalStateException.class, () -> out.endProsody(TokenKind.RATE));
        assertThrows(IllegalArgumentException.class, () -> out.control(TokenKind.RATE, "50"));
        assertThrows(IllegalArgumentException.class, () -> out.beginProsody(TokenKind.PAUSE, "long"));
    }

    @Test
    void bookmarkRangesCoverTokensUpToTheNextBookmark() {
        TokenStream stream = new TokenStream(List.of(
                Token.text("start"),
                new Token(TokenKind.BOOKMARK, "m1"),
                Token.text("a"),
                new Token(TokenKind.PAUSE, "auto"),
                Token.text("plus"),
                new Token(TokenKind.BOOKMARK, "m2"),
                new Token(TokenKind.BOOKMARK, "m3"),
                Token.text("b")));

        List<BookmarkRange> ranges = stream.bookmarkRanges();

        assertEquals(3, ranges.size());
        assertEquals("m1", ranges.get(0).id);
        assertEquals(2, ranges.get(0).startToken);
        assertEquals(5, ranges.get(0).endToken);
        assertEquals("a plus", ranges.get(0).text);
        assertEquals("", ranges.get(1).text);
        assertEquals(6, ranges.get(1).startToken);
        assertEquals(6, ranges.get(1).endToken);
        assertEquals("b", ranges.get(2).text);
        assertEquals(3, stream.count(TokenKind.BOOKMARK));
    }

    @Test
    void intentBuilderWrapsTextBetweenElements() {
        IntentNodeBuilder out = new IntentNodeBuilder();
        out.text("f");
        out.text("  ");
        out.control(TokenKind.PAUSE, "short");
        out.element(Node.leaf("mi", "x"));

        assertTrue(out.hasElements());
        assertEquals(List.of("mtext", "mi"), out.elements().stream().map(Node::getName).toList());
        assertEquals("f", out.text());
    }
}
