package org.dxworks.mathrules.output;

/**
 * Output tokens {@code [startToken, endToken)} that were produced after the bookmark for {@code id}
 * and before the next bookmark.
 */
public class BookmarkRange {
    public String id;
    public int startToken;
    public int endToken;
    public String text;

    public BookmarkRange(String id, int startToken, int endToken, String text) {
        this.id = id;
        this.startToken = startToken;
        this.endToken = endToken;
        this.text = text;
    }
}
