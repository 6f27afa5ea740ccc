package csstokens.syntax;

import java.util.Objects;

public record UnicodeRangeToken(RangeExtra extra) implements CssToken {

    public UnicodeRangeToken {
        Objects.requireNonNull(extra, "extra cannot be null");
    }

    public UnicodeRangeToken(int start, int end) {
        this(new RangeExtra(start, end));
    }

    @Override
    public TokenType type() {
        return TokenType.UNICODE_RANGE;
    }

    @Override
    public String value() {
        return extra.toString();
    }

    @Override
    public String toString() {
        return "<unicode-range>" + extra;
    }
}
