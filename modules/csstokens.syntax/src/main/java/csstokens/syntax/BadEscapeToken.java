package csstokens.syntax;

import java.util.Objects;

/**
 * A {@code \} immediately followed by a newline.
 */
public record BadEscapeToken(ErrorExtra extra) implements CssToken {

    public BadEscapeToken {
        Objects.requireNonNull(extra, "extra cannot be null");
    }

    public BadEscapeToken() {
        this(ErrorExtra.of(CssParserError.invalidEscape(-1)));
    }

    @Override
    public TokenType type() {
        return TokenType.BAD_ESCAPE;
    }

    @Override
    public String value() {
        return "\\";
    }

    @Override
    public String toString() {
        return "<bad-escape>";
    }
}
