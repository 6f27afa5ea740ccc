package csstokens.syntax;

import java.util.Objects;

public record PercentageToken(String value, NumericExtra extra) implements NumericToken {

    public PercentageToken {
        NumberToken.checkNumericText(value);
        Objects.requireNonNull(extra, "extra cannot be null");

        if (!extra.dimension().isEmpty()) {
            throw new IllegalArgumentException("percentage cannot have a dimension");
        }
    }

    public PercentageToken(String value) {
        this(value, new NumericExtra(NumberToken.isNonInteger(value), ""));
    }

    @Override
    public TokenType type() {
        return TokenType.PERCENTAGE;
    }

    @Override
    public String toString() {
        return "<percentage>" + value;
    }
}
