package csstokens.syntax;

import com.csstokens.syntax.CssTokenRenderer;
import java.io.IOException;

/**
 * A token in the CSS syntax.
 * <p>
 * Every implementation carries exactly the extra data that is legal for its {@link TokenType}.
 * Tokens are immutable values; to render a sequence of tokens with round-trip safety,
 * use a {@link CssTokenWriter}.
 */
public sealed interface CssToken
        permits ErrorToken, EofToken, IdentToken, FunctionToken, UrlToken, DelimToken, AtKeywordToken,
                StringToken, WhitespaceToken, CommentToken, HashToken, NumericToken, UnicodeRangeToken,
                BadStringToken, BadUrlToken, BadEscapeToken, FixedToken {

    TokenType type();

    /**
     * Returns the string value of the token. Its meaning depends on the type: for a {@link UrlToken}
     * it is the URL itself, for a {@link PercentageToken} it is the number without the percent sign.
     */
    String value();

    /**
     * Returns the extra data of the token, or {@code null} if tokens of this type carry none.
     */
    default TokenExtra extra() {
        return null;
    }

    /**
     * Returns the CSS source representation of this token.
     */
    default String render() {
        return CssTokenRenderer.render(this);
    }

    /**
     * Writes the CSS source representation of this token to the specified output.
     * Tokens of type {@link TokenType#ERROR} and {@link TokenType#EOF} write nothing.
     *
     * @param out the output
     * @throws IOException if the output cannot be written
     */
    default void writeTo(Appendable out) throws IOException {
        CssTokenRenderer.writeTo(this, out);
    }
}
