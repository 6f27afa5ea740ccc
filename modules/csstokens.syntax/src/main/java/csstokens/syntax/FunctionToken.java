package csstokens.syntax;

import java.util.Objects;

public record FunctionToken(String value) implements CssToken {

    public FunctionToken {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public TokenType type() {
        return TokenType.FUNCTION;
    }

    @Override
    public String toString() {
        return "<function>" + value;
    }
}
