package csstokens.syntax;

import java.util.Objects;

/**
 * Attached to {@link ErrorToken}, {@link BadEscapeToken}, {@link BadStringToken} and {@link BadUrlToken}.
 * Holds the failure that the scanner reported for the token.
 */
public record ErrorExtra(Throwable error) implements TokenExtra {

    public ErrorExtra {
        Objects.requireNonNull(error, "error cannot be null");
    }

    public static ErrorExtra of(CssParserError error) {
        return new ErrorExtra(new CssParseException(error));
    }

    public Throwable cause() {
        return error;
    }

    /**
     * Returns the structured parse error, if the underlying failure carries one.
     *
     * @return the {@code CssParserError}, or {@code null}
     */
    public CssParserError parseError() {
        return error instanceof CssParseException ex ? ex.getError() : null;
    }

    @Override
    public String toString() {
        return String.valueOf(error.getMessage());
    }
}
