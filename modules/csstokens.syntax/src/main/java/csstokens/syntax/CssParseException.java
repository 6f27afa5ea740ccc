package csstokens.syntax;

import java.util.Objects;

/**
 * Signals a CSS syntax error that is described by a {@link CssParserError}.
 */
public class CssParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient CssParserError error;

    public CssParseException(CssParserError error) {
        super(Objects.requireNonNull(error, "error cannot be null").message());
        this.error = error;
    }

    public CssParserError getError() {
        return error;
    }
}
