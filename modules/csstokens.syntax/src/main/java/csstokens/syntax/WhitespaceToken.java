package csstokens.syntax;

import java.util.Objects;

public record WhitespaceToken(String value) implements CssToken {

    public static final WhitespaceToken SPACE = new WhitespaceToken(" ");

    public WhitespaceToken {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public TokenType type() {
        return TokenType.WHITESPACE;
    }

    @Override
    public String toString() {
        return "<whitespace>";
    }
}
