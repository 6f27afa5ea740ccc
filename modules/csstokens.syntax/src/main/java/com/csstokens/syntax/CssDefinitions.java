package com.csstokens.syntax;

/*
 * https://www.w3.org/TR/css-syntax-3/#tokenizer-definitions
 */
public final class CssDefinitions {

    public static final char QUOTATION_MARK = '"';
    public static final char NUMBER_SIGN = '#';
    public static final char LEFT_PARENTHESIS = '(';
    public static final char RIGHT_PARENTHESIS = ')';
    public static final char FORM_FEED = '\u000C';
    public static final char CARRIAGE_RETURN = '\r';
    public static final char LINE_FEED = '\n';
    public static final char HYPHEN_MINUS = '-';
    public static final char LOW_LINE = '_';
    public static final char SOLIDUS = '/';
    public static final char REVERSE_SOLIDUS = '\\';
    public static final char ASTERISK = '*';
    public static final char PERCENTAGE_SIGN = '%';
    public static final char COMMERCIAL_AT = '@';
    public static final char LATIN_CAPITAL_LETTER_E = 'E';
    public static final char LATIN_SMALL_LETTER_E = 'e';
    public static final char SPACE = ' ';

    /*
     * The first code point that is not part of ASCII.
     */
    public static final char NON_ASCII_START = '\u0080';

    private CssDefinitions() {}

    /*
     * ident code point :=
     *     An ident-start code point, a digit, or U+002D HYPHEN-MINUS (-).
     */
    public static boolean isIdentCodePoint(int codePoint) {
        return codePoint == HYPHEN_MINUS || isDigit(codePoint) || isIdentStartCodePoint(codePoint);
    }

    /*
     * non-ASCII code point :=
     *     A code point with a value equal to or greater than U+0080 <control>.
     *
     * ident-start code point :=
     *     A letter, a non-ASCII code point, or U+005F LOW LINE (_).
     */
    public static boolean isIdentStartCodePoint(int codePoint) {
        return codePoint == LOW_LINE || codePoint >= NON_ASCII_START || isLetter(codePoint);
    }

    /*
     * An uppercase letter or a lowercase letter.
     */
    public static boolean isLetter(int codePoint) {
        return codePoint >= 'A' && codePoint <= 'Z'
            || codePoint >= 'a' && codePoint <= 'z';
    }

    /*
     * A code point between U+0000 NULL and U+0008 BACKSPACE inclusive, or U+000B LINE TABULATION,
     * or a code point between U+000E SHIFT OUT and U+001F INFORMATION SEPARATOR ONE inclusive,
     * or U+007F DELETE.
     */
    public static boolean isNonPrintableCodePoint(int codePoint) {
        return codePoint >= '\u0000' && codePoint <= '\u0008'
            || codePoint >= '\u000E' && codePoint <= '\u001F'
            || codePoint == '\u000B'
            || codePoint == '\u007F';
    }

    /*
     * A code point between U+0030 DIGIT ZERO (0) and U+0039 DIGIT NINE (9) inclusive.
     */
    public static boolean isDigit(int codePoint) {
        return codePoint >= '0' && codePoint <= '9';
    }
}
