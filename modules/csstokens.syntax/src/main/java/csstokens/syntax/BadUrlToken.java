package csstokens.syntax;

import java.util.Objects;

public record BadUrlToken(String value, ErrorExtra extra) implements CssToken {

    public BadUrlToken {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(extra, "extra cannot be null");
    }

    public BadUrlToken(String value) {
        this(value, ErrorExtra.of(CssParserError.badUrl(-1)));
    }

    @Override
    public TokenType type() {
        return TokenType.BAD_URI;
    }

    @Override
    public String toString() {
        return "<bad-url>" + value;
    }
}
