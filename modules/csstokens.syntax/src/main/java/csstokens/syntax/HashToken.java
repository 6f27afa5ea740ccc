package csstokens.syntax;

import java.util.Objects;

public record HashToken(String value, HashExtra extra) implements CssToken {

    public HashToken {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(extra, "extra cannot be null");
    }

    public static HashToken id(String value) {
        return new HashToken(value, HashExtra.ID);
    }

    public static HashToken unrestricted(String value) {
        return new HashToken(value, HashExtra.UNRESTRICTED);
    }

    @Override
    public TokenType type() {
        return TokenType.HASH;
    }

    @Override
    public String toString() {
        return "<hash>" + value;
    }
}
