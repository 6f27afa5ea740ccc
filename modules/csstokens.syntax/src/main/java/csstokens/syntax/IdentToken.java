package csstokens.syntax;

import java.util.Objects;

public record IdentToken(String value) implements CssToken {

    public IdentToken {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public TokenType type() {
        return TokenType.IDENT;
    }

    @Override
    public String toString() {
        return "<ident>" + value;
    }
}
