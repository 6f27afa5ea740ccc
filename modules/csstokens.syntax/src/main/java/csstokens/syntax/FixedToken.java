package csstokens.syntax;

/**
 * Tokens whose source representation is always the same text.
 */
public enum FixedToken implements CssToken {
    INCLUDES(TokenType.INCLUDES, "~="),
    DASH_MATCH(TokenType.DASH_MATCH, "|="),
    PREFIX_MATCH(TokenType.PREFIX_MATCH, "^="),
    SUFFIX_MATCH(TokenType.SUFFIX_MATCH, "$="),
    SUBSTRING_MATCH(TokenType.SUBSTRING_MATCH, "*="),
    COLUMN(TokenType.COLUMN, "||"),
    COLON(TokenType.COLON, ":"),
    SEMICOLON(TokenType.SEMICOLON, ";"),
    COMMA(TokenType.COMMA, ","),
    OPEN_BRACKET(TokenType.OPEN_BRACKET, "["),
    CLOSE_BRACKET(TokenType.CLOSE_BRACKET, "]"),
    OPEN_PAREN(TokenType.OPEN_PAREN, "("),
    CLOSE_PAREN(TokenType.CLOSE_PAREN, ")"),
    OPEN_BRACE(TokenType.OPEN_BRACE, "{"),
    CLOSE_BRACE(TokenType.CLOSE_BRACE, "}"),
    CDO(TokenType.CDO, "<!--"),
    CDC(TokenType.CDC, "-->");

    private final TokenType type;
    private final String value;

    FixedToken(TokenType type, String value) {
        this.type = type;
        this.value = value;
    }

    @Override
    public TokenType type() {
        return type;
    }

    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return "<" + value + ">";
    }
}
