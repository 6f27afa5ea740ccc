package csstokens.syntax;

import java.util.Objects;

public record StringToken(String value) implements CssToken {

    public StringToken {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public TokenType type() {
        return TokenType.STRING;
    }

    @Override
    public String toString() {
        return "<string>" + value;
    }
}
