package csstokens.syntax;

import java.util.Objects;

/**
 * Attached to {@link NumberToken}, {@link PercentageToken} and {@link DimensionToken}.
 * The numeric value itself is not interpreted; tokens keep the literal numeric text.
 *
 * @param nonInteger {@code true} if the number was written with a fraction or an exponent
 * @param dimension the unit of a dimension, empty for numbers and percentages
 */
public record NumericExtra(boolean nonInteger, String dimension) implements TokenExtra {

    public NumericExtra {
        Objects.requireNonNull(dimension, "dimension cannot be null");
    }

    public static NumericExtra integer() {
        return new NumericExtra(false, "");
    }

    public static NumericExtra fractional() {
        return new NumericExtra(true, "");
    }

    @Override
    public String toString() {
        return dimension;
    }
}
