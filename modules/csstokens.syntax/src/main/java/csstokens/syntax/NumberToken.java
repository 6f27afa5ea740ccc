package csstokens.syntax;

import java.util.Objects;

public record NumberToken(String value, NumericExtra extra) implements NumericToken {

    public NumberToken {
        checkNumericText(value);
        Objects.requireNonNull(extra, "extra cannot be null");

        if (!extra.dimension().isEmpty()) {
            throw new IllegalArgumentException("number cannot have a dimension");
        }
    }

    public NumberToken(String value) {
        this(value, new NumericExtra(isNonInteger(value), ""));
    }

    @Override
    public TokenType type() {
        return TokenType.NUMBER;
    }

    @Override
    public String toString() {
        return "<number>" + value;
    }

    static void checkNumericText(String numericText) {
        Objects.requireNonNull(numericText, "value cannot be null");

        if (numericText.isEmpty()) {
            throw new IllegalArgumentException("value cannot be empty");
        }
    }

    /*
     * A number is a non-integer if it has a fractional part or an exponent.
     */
    static boolean isNonInteger(String numericText) {
        for (int i = 0; i < numericText.length(); ++i) {
            char c = numericText.charAt(i);
            if (c == '.' || c == 'e' || c == 'E') {
                return true;
            }
        }

        return false;
    }
}
