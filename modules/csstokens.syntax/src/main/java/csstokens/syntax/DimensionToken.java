package csstokens.syntax;

import java.util.Objects;

public record DimensionToken(String value, NumericExtra extra) implements NumericToken {

    public DimensionToken {
        NumberToken.checkNumericText(value);
        Objects.requireNonNull(extra, "extra cannot be null");

        if (extra.dimension().isEmpty()) {
            throw new IllegalArgumentException("dimension cannot be empty");
        }
    }

    public DimensionToken(String value, String unit) {
        this(value, new NumericExtra(NumberToken.isNonInteger(value), unit));
    }

    public String unit() {
        return extra.dimension();
    }

    @Override
    public TokenType type() {
        return TokenType.DIMENSION;
    }

    @Override
    public String toString() {
        return "<dimension>" + value + extra.dimension();
    }
}
