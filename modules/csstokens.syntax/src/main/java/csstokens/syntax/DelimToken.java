package csstokens.syntax;

/**
 * A {@code <delim-token>}, holding a single code point.
 */
public record DelimToken(int codePoint) implements CssToken {

    public DelimToken {
        if (!Character.isValidCodePoint(codePoint) || Character.getType(codePoint) == Character.SURROGATE) {
            throw new IllegalArgumentException("invalid code point: " + codePoint);
        }
    }

    public static DelimToken of(char c) {
        return new DelimToken(c);
    }

    @Override
    public TokenType type() {
        return TokenType.DELIM;
    }

    @Override
    public String value() {
        return Character.toString(codePoint);
    }

    @Override
    public String toString() {
        return "<delim>" + Character.toString(codePoint);
    }
}
