package csstokens.syntax;

import java.util.Objects;

public record CommentToken(String value) implements CssToken {

    public CommentToken {
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public TokenType type() {
        return TokenType.COMMENT;
    }

    @Override
    public String toString() {
        return "<comment>" + value;
    }
}
