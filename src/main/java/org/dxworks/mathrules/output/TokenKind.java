package org.dxworks.mathrules.output;

public enum TokenKind {
    TEXT,
    PAUSE,
    PITCH,
    RATE,
    SPELL,
    AUDIO,
    BOOKMARK
}
