package csstokens.syntax;

public record EofToken() implements CssToken {

    public static final EofToken INSTANCE = new EofToken();

    @Override
    public TokenType type() {
        return TokenType.EOF;
    }

    @Override
    public String value() {
        return "";
    }

    @Override
    public String toString() {
        return "<EOF>";
    }
}
