package csstokens.syntax;

import java.util.Objects;

/**
 * A {@code <url-token>}; the value is the URL without the surrounding {@code url(} and {@code )}.
 */
public record UrlToken(String value) implements CssToken {

    public UrlToken {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public TokenType type() {
        return TokenType.URI;
    }

    @Override
    public String toString() {
        return "<url>" + value;
    }
}
