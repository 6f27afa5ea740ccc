package csstokens.syntax;

/**
 * The complete list of token types in CSS Syntax Level 3.
 * <p>
 * Unlike CSS Syntax Level 3, comments are preserved in the token stream.
 *
 * @see <a href="https://www.w3.org/TR/css-syntax-3/#tokenization">Tokenization</a>
 */
public enum TokenType {

    // Scanner flags
    ERROR("error", ErrorExtra.class),
    EOF("EOF", null),

    IDENT("IDENT", null),
    FUNCTION("FUNCTION", null),
    URI("URI", null),
    DELIM("DELIM", null),
    AT_KEYWORD("ATKEYWORD", null),
    STRING("STRING", null),
    WHITESPACE("S", null),
    COMMENT("COMMENT", null),
    HASH("HASH", HashExtra.class),
    NUMBER("NUMBER", NumericExtra.class),
    PERCENTAGE("PERCENTAGE", NumericExtra.class),
    DIMENSION("DIMENSION", NumericExtra.class),
    UNICODE_RANGE("UNICODE-RANGE", RangeExtra.class),
    CDO("CDO", null),
    CDC("CDC", null),

    // Error tokens
    BAD_STRING("BAD-STRING", ErrorExtra.class),
    BAD_URI("BAD-URI", ErrorExtra.class),
    BAD_ESCAPE("BAD-ESCAPE", ErrorExtra.class),

    // Fixed-string tokens
    INCLUDES("INCLUDES", null),
    DASH_MATCH("DASHMATCH", null),
    PREFIX_MATCH("PREFIXMATCH", null),
    SUFFIX_MATCH("SUFFIXMATCH", null),
    SUBSTRING_MATCH("SUBSTRINGMATCH", null),
    COLUMN("COLUMN", null),
    COLON("COLON", null),
    SEMICOLON("SEMICOLON", null),
    COMMA("COMMA", null),
    OPEN_BRACKET("LEFT-BRACKET", null),
    CLOSE_BRACKET("RIGHT-BRACKET", null),
    OPEN_PAREN("LEFT-PAREN", null),
    CLOSE_PAREN("RIGHT-PAREN", null),
    OPEN_BRACE("LEFT-BRACE", null),
    CLOSE_BRACE("RIGHT-BRACE", null);

    private final String grammarName;
    private final Class<? extends TokenExtra> extraType;

    TokenType(String grammarName, Class<? extends TokenExtra> extraType) {
        this.grammarName = grammarName;
        this.extraType = extraType;
    }

    /**
     * Stop tokens are {@link #ERROR}, {@link #EOF}, {@link #BAD_ESCAPE}, {@link #BAD_STRING}
     * and {@link #BAD_URI}. A consumer that does not want to tolerate parsing errors should
     * stop when this returns {@code true}.
     */
    public boolean isStopToken() {
        return this == ERROR || this == EOF || this == BAD_ESCAPE || this == BAD_STRING || this == BAD_URI;
    }

    /**
     * Returns the kind of {@link TokenExtra} that tokens of this type carry.
     *
     * @return the extra data class, or {@code null} if tokens of this type carry no extra data
     */
    public Class<? extends TokenExtra> extraType() {
        return extraType;
    }

    @Override
    public String toString() {
        return grammarName;
    }
}
