package csstokens.syntax;

/**
 * Extra data attached to a token beyond its string value.
 * <p>
 * Each variant is only legal for specific token types, see {@link TokenType#extraType()}.
 * The {@code toString()} of every variant returns a descriptive string.
 */
public sealed interface TokenExtra permits HashExtra, NumericExtra, RangeExtra, ErrorExtra {}
