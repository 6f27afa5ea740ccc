package csstokens.syntax;

/**
 * Attached to a {@link UnicodeRangeToken}.
 *
 * @param start the first code point of the range
 * @param end the last code point of the range, equal to {@code start} for a single code point
 */
public record RangeExtra(int start, int end) implements TokenExtra {

    public RangeExtra {
        if (start < 0 || end > Character.MAX_CODE_POINT || start > end) {
            throw new IllegalArgumentException(
                String.format("invalid unicode range: %X-%X", start, end));
        }
    }

    public static RangeExtra of(int codePoint) {
        return new RangeExtra(codePoint, codePoint);
    }

    /**
     * Returns a valid CSS representation of the range.
     */
    @Override
    public String toString() {
        if (start == end) {
            return String.format("U+%04X", start);
        }

        return String.format("U+%04X-%04X", start, end);
    }
}
