package csstokens.syntax;

/**
 * A {@code <number-token>}, {@code <percentage-token>} or {@code <dimension-token>}.
 * The value is the literal numeric text as it appeared in the source.
 */
public sealed interface NumericToken extends CssToken
        permits NumberToken, PercentageToken, DimensionToken {

    @Override
    NumericExtra extra();
}
