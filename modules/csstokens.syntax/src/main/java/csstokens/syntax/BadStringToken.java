package csstokens.syntax;

import java.util.Objects;

/**
 * A string that was terminated by an unescaped newline. The value holds the string contents
 * that were consumed before the newline.
 */
public record BadStringToken(String value, ErrorExtra extra) implements CssToken {

    public BadStringToken {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(extra, "extra cannot be null");
    }

    public BadStringToken(String value) {
        this(value, ErrorExtra.of(CssParserError.badString(-1)));
    }

    @Override
    public TokenType type() {
        return TokenType.BAD_STRING;
    }

    @Override
    public String toString() {
        return "<bad-string>" + value;
    }
}
