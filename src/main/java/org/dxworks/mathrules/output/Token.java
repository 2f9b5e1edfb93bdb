package org.dxworks.mathrules.output;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

public class Token {
    public TokenKind kind;
    public String value;

    public Token() {
    }

    public Token(TokenKind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public static Token text(String value) {
        return new Token(TokenKind.TEXT, value);
    }

    @JsonIgnore
    public boolean isSpoken() {
        return kind == TokenKind.TEXT || kind == TokenKind.SPELL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token other = (Token) o;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == TokenKind.TEXT ? value : kind + "(" + value + ")";
    }
}
