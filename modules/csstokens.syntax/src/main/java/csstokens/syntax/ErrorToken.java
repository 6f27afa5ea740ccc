package csstokens.syntax;

import java.util.Objects;

/**
 * Signals that the scanner failed. Error tokens have no source representation.
 */
public record ErrorToken(ErrorExtra extra) implements CssToken {

    public ErrorToken {
        Objects.requireNonNull(extra, "extra cannot be null");
    }

    public ErrorToken(CssParserError error) {
        this(ErrorExtra.of(error));
    }

    @Override
    public TokenType type() {
        return TokenType.ERROR;
    }

    @Override
    public String value() {
        return "";
    }

    @Override
    public String toString() {
        return "<error>" + extra;
    }
}
