package csstokens.syntax;

import com.csstokens.syntax.AdjacencyKey;
import com.csstokens.syntax.CommentInsertionRules;
import com.csstokens.util.Logging;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Writes a sequence of tokens as CSS source text, such that tokenizing the output yields
 * the same sequence of tokens.
 * <p>
 * When two adjacent tokens would otherwise be read back as a different token, an empty comment
 * ({@code /**}{@code /}) is written between them.
 * <p>
 * Instances of this class are not thread-safe.
 *
 * @see <a href="https://www.w3.org/TR/css-syntax-3/#serialization">Serialization</a>
 */
public final class CssTokenWriter implements Flushable, AutoCloseable {

    static final String EMPTY_COMMENT = "/**/";

    private final Appendable out;
    private CssToken lastToken;
    private long charactersWritten;

    public CssTokenWriter(Appendable out) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
    }

    public CssTokenWriter(OutputStream out, Charset charset) {
        this(new OutputStreamWriter(out, charset));
    }

    /**
     * Renders a sequence of tokens into a string.
     *
     * @param tokens the tokens
     * @return the CSS source text
     */
    public static String render(Iterable<? extends CssToken> tokens) {
        var builder = new StringBuilder();

        try (var writer = new CssTokenWriter(builder)) {
            writer.writeAll(tokens);
        } catch (IOException ex) {
            throw new AssertionError("StringBuilder cannot throw IOException", ex);
        }

        return builder.toString();
    }

    /**
     * Writes a token, preceded by an empty comment if the previously written token
     * and this token would not be read back as two tokens.
     *
     * @param token the token
     * @throws IOException if the output cannot be written
     */
    public void write(CssToken token) throws IOException {
        Objects.requireNonNull(token, "token cannot be null");

        if (lastToken != null) {
            AdjacencyKey previous = AdjacencyKey.of(lastToken);
            AdjacencyKey current = AdjacencyKey.of(token);

            if (CommentInsertionRules.requiresSeparator(previous, current)) {
                Logger logger = Logging.getSyntaxLogger();
                if (logger.isLoggable(Level.TRACE)) {
                    logger.log(Level.TRACE, "Separating " + previous + " and " + current);
                }

                out.append(EMPTY_COMMENT);
                charactersWritten += EMPTY_COMMENT.length();
            }
        }

        String text = token.render();
        out.append(text);
        charactersWritten += text.length();
        lastToken = token;
    }

    public void writeAll(Iterable<? extends CssToken> tokens) throws IOException {
        for (CssToken token : tokens) {
            write(token);
        }
    }

    /**
     * Returns the token that was written last, or {@code null} if no token was written yet.
     */
    public CssToken lastToken() {
        return lastToken;
    }

    /**
     * Returns the number of characters written so far, including separators.
     */
    public long charactersWritten() {
        return charactersWritten;
    }

    @Override
    public void flush() throws IOException {
        if (out instanceof Flushable flushable) {
            flushable.flush();
        }
    }

    @Override
    public void close() throws IOException {
        if (out instanceof Closeable closeable) {
            closeable.close();
        } else {
            flush();
        }
    }
}
