package com.csstokens.syntax;

import java.util.Locale;

import static com.csstokens.syntax.CssDefinitions.*;

/**
 * Escapes names and strings so that they can be written as CSS source text and read back
 * as the same value.
 * <p>
 * Characters outside of ASCII are never escaped.
 *
 * @see <a href="https://www.w3.org/TR/cssom-1/#serializing-idents">Serializing identifiers</a>
 */
public final class CssEscaper {

    /**
     * Passed to {@link #escapeString(String, char)} to write a string without delimiters.
     */
    public static final char NO_DELIMITER = '\0';

    /**
     * Specifies the context in which a name is escaped.
     */
    public enum Mode {
        /**
         * The name must start like an identifier.
         */
        IDENTIFIER,

        /**
         * The name follows a {@code #} and is not required to be a valid identifier.
         */
        HASH_NAME,

        /**
         * The name follows a number, so a leading {@code e} or {@code E} would be read as an exponent.
         */
        DIMENSION_UNIT
    }

    private CssEscaper() {}

    public static String escapeIdentifier(String s) {
        return escapeIdent(s, Mode.IDENTIFIER);
    }

    public static String escapeHashName(String s) {
        return escapeIdent(s, Mode.HASH_NAME);
    }

    public static String escapeDimension(String s) {
        return escapeIdent(s, Mode.DIMENSION_UNIT);
    }

    /**
     * Escapes a name for the specified context.
     *
     * @param s the name
     * @param mode the escaping context
     * @return the escaped name, or {@code s} itself if nothing needs to be escaped
     */
    public static String escapeIdent(String s, Mode mode) {
        if (s.isEmpty()) {
            return s;
        }

        var builder = new StringBuilder(s.length() + 8);
        boolean changed = false;
        int index = 0;

        if (mode != Mode.HASH_NAME) {
            char first = s.charAt(0);

            if (first == HYPHEN_MINUS) {
                if (s.length() == 1) {
                    return "\\-";
                }

                // A hyphen can only start an identifier if an ident-start code point follows.
                if (isIdentStartCodePoint(s.charAt(1))) {
                    builder.append(HYPHEN_MINUS);
                } else {
                    builder.append(REVERSE_SOLIDUS).append(HYPHEN_MINUS);
                    changed = true;
                }
            } else if (first == LATIN_SMALL_LETTER_E || first == LATIN_CAPITAL_LETTER_E) {
                if (mode == Mode.DIMENSION_UNIT) {
                    appendHexEscape(builder, first);
                    changed = true;
                } else {
                    builder.append(first);
                }
            } else if (!isIdentStartCodePoint(first)) {
                // Digits are escaped as hex too: "\1" would be read back as U+0001.
                appendHexEscape(builder, first);
                changed = true;
            } else {
                builder.append(first);
            }

            index = 1;
        }

        for (; index < s.length(); ++index) {
            char c = s.charAt(index);

            if (isIdentCodePoint(c)) {
                builder.append(c);
            } else {
                appendHexEscape(builder, c);
                changed = true;
            }
        }

        return changed ? builder.toString() : s;
    }

    /**
     * Escapes the contents of a string.
     *
     * @param s the string contents
     * @param delimiter the quote character that surrounds the result, or {@link #NO_DELIMITER}
     * @return the escaped string
     */
    public static String escapeString(String s, char delimiter) {
        var builder = new StringBuilder(s.length() + 2);

        if (delimiter != NO_DELIMITER) {
            builder.append(delimiter);
        }

        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);

            if (c == QUOTATION_MARK) {
                builder.append(REVERSE_SOLIDUS).append(QUOTATION_MARK);
            } else if (c == delimiter && delimiter != NO_DELIMITER) {
                builder.append(REVERSE_SOLIDUS).append(delimiter);
            } else if (c == LINE_FEED) {
                builder.append("\\0A ");
            } else if (c == CARRIAGE_RETURN) {
                builder.append("\\0D ");
            } else if (c == FORM_FEED) {
                // Preprocessing turns a raw form feed into a newline.
                builder.append("\\C ");
            } else if (c == REVERSE_SOLIDUS) {
                builder.append(REVERSE_SOLIDUS).append(REVERSE_SOLIDUS);
            } else if (c < NON_ASCII_START && isNonPrintableCodePoint(c)) {
                appendHexEscape(builder, c);
            } else {
                builder.append(c);
            }
        }

        if (delimiter != NO_DELIMITER) {
            builder.append(delimiter);
        }

        return builder.toString();
    }

    /*
     * The trailing space terminates the escape, so that a following hex digit is not consumed.
     */
    private static void appendHexEscape(StringBuilder builder, char c) {
        builder.append(REVERSE_SOLIDUS)
               .append(Integer.toHexString(c).toUpperCase(Locale.ROOT))
               .append(SPACE);
    }
}
