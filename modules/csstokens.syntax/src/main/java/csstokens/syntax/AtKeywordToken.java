package csstokens.syntax;

import java.util.Objects;

public record AtKeywordToken(String value) implements CssToken {

    public AtKeywordToken {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public TokenType type() {
        return TokenType.AT_KEYWORD;
    }

    @Override
    public String toString() {
        return "<at-keyword>" + value;
    }
}
