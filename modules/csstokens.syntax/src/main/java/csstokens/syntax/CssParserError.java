package csstokens.syntax;

import java.util.Objects;

/**
 * A CSS syntax error recorded by the scanner.
 *
 * @param kind the type of the token that was being scanned when the error occurred
 * @param message a human-readable description
 * @param offset the source offset of the error, or {@code -1} if unknown
 */
public record CssParserError(TokenType kind, String message, int offset) {

    public CssParserError {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    public static CssParserError unexpectedEndOfFile(TokenType kind) {
        return new CssParserError(kind, "Unexpected end of file", -1);
    }

    public static CssParserError invalidEscape(int offset) {
        return new CssParserError(TokenType.BAD_ESCAPE, "Invalid escape sequence", offset);
    }

    public static CssParserError badString(int offset) {
        return new CssParserError(TokenType.BAD_STRING, "Unexpected newline in string", offset);
    }

    public static CssParserError badUrl(int offset) {
        return new CssParserError(TokenType.BAD_URI, "Bad URL", offset);
    }

    @Override
    public String toString() {
        return offset < 0
            ? String.format("%s [%s]", message, kind)
            : String.format("%s [%s at %d]", message, kind, offset);
    }
}
