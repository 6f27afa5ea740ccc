package com.csstokens.syntax;

import com.csstokens.util.Logging;
import csstokens.syntax.CssToken;
import csstokens.syntax.DelimToken;
import csstokens.syntax.DimensionToken;
import csstokens.syntax.HashToken;
import csstokens.syntax.UnicodeRangeToken;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;

import static com.csstokens.syntax.CssDefinitions.*;
import static com.csstokens.syntax.CssEscaper.*;

/**
 * Renders single tokens as CSS source text.
 * <p>
 * The output of consecutive tokens may be read back as different tokens; for example, two
 * identifiers written without a separator form a single identifier. Sequences of tokens should
 * be written with {@link csstokens.syntax.CssTokenWriter}.
 */
public final class CssTokenRenderer {

    private CssTokenRenderer() {}

    /**
     * Returns the CSS source representation of the token.
     * Tokens of type {@code ERROR} and {@code EOF} are rendered as an empty string.
     *
     * @param token the token
     * @return the source text
     */
    public static String render(CssToken token) {
        var builder = new StringBuilder();
        appendTo(token, builder);
        return builder.toString();
    }

    public static void writeTo(CssToken token, Appendable out) throws IOException {
        out.append(render(token));
    }

    private static void appendTo(CssToken token, StringBuilder builder) {
        switch (token.type()) {
            case ERROR, EOF -> {}

            case IDENT -> builder.append(escapeIdentifier(token.value()));

            case AT_KEYWORD -> builder.append(COMMERCIAL_AT).append(escapeIdentifier(token.value()));

            case DELIM -> appendDelim((DelimToken)token, builder);

            case HASH -> {
                var hash = (HashToken)token;
                builder.append(NUMBER_SIGN).append(
                    hash.extra().identifier() ? escapeIdentifier(hash.value()) : escapeHashName(hash.value()));
            }

            case PERCENTAGE -> builder.append(token.value()).append(PERCENTAGE_SIGN);

            case DIMENSION -> builder.append(token.value()).append(escapeDimension(((DimensionToken)token).unit()));

            case STRING -> builder.append(escapeString(token.value(), QUOTATION_MARK));

            case URI -> builder.append("url(")
                               .append(escapeString(token.value(), QUOTATION_MARK))
                               .append(RIGHT_PARENTHESIS);

            case UNICODE_RANGE -> builder.append(((UnicodeRangeToken)token).extra());

            case COMMENT -> builder.append(SOLIDUS).append(ASTERISK)
                                   .append(token.value())
                                   .append(ASTERISK).append(SOLIDUS);

            case FUNCTION -> builder.append(escapeIdentifier(token.value())).append(LEFT_PARENTHESIS);

            case BAD_ESCAPE -> builder.append(REVERSE_SOLIDUS).append(LINE_FEED);

            // An unterminated string: the newline ends it, there is no closing quote.
            case BAD_STRING -> builder.append(QUOTATION_MARK)
                                      .append(escapeString(token.value(), NO_DELIMITER))
                                      .append(LINE_FEED);

            case BAD_URI -> {
                String contents = escapeString(token.value(), NO_DELIMITER);
                if (contents.endsWith("\"")) {
                    contents = contents.substring(0, contents.length() - 1);
                }

                builder.append("url(").append(QUOTATION_MARK)
                       .append(contents)
                       .append(LINE_FEED).append(RIGHT_PARENTHESIS);
            }

            // NUMBER, WHITESPACE, CDO, CDC and the fixed-string tokens
            default -> builder.append(token.value());
        }
    }

    /*
     * A lone backslash is scanned as BAD_ESCAPE, so a DELIM token holding one should not exist.
     * It is rendered the same way as BAD_ESCAPE.
     */
    private static void appendDelim(DelimToken token, StringBuilder builder) {
        if (token.codePoint() == REVERSE_SOLIDUS) {
            Logger logger = Logging.getSyntaxLogger();
            if (logger.isLoggable(Level.WARNING)) {
                logger.log(Level.WARNING, "DELIM token holds a backslash, rendering it as a bad escape");
            }

            builder.append(REVERSE_SOLIDUS).append(LINE_FEED);
        } else {
            builder.appendCodePoint(token.codePoint());
        }
    }
}
