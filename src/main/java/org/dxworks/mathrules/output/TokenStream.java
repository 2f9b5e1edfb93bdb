package org.dxworks.mathrules.output;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The complete, ordered result of one speech or braille conversion.
 */
public final class TokenStream {

    private final List<Token> tokens;

    public TokenStream(List<Token> tokens) {
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public long count(TokenKind kind) {
        return tokens.stream().filter(t -> t.kind == kind).count();
    }

    /**
     * Spoken text and spelled text joined by single spaces; control tokens are left out.
     */
    public String toSpeechString() {
        return joinSpoken(0, tokens.size(), " ");
    }

    /**
     * Text and spelled cells concatenated without separators.
     */
    public String toBrailleString() {
        return joinSpoken(0, tokens.size(), "");
    }

    public List<BookmarkRange> bookmarkRanges() {
        List<BookmarkRange> ranges = new ArrayList<>();
        int open = -1;
        for (int i = 0; i <= tokens.size(); i++) {
            boolean atBookmark = i < tokens.size() && tokens.get(i).kind == TokenKind.BOOKMARK;
            if (open >= 0 && (atBookmark || i == tokens.size())) {
                ranges.add(new BookmarkRange(tokens.get(open).value, open + 1, i, joinSpoken(open + 1, i, " ")));
            }
            if (atBookmark) open = i;
        }
        return ranges;
    }

    private String joinSpoken(int from, int to, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (!token.isSpoken() || token.value == null || token.value.isEmpty()) continue;
            if (sb.length() > 0) sb.append(separator);
            sb.append(token.value);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
