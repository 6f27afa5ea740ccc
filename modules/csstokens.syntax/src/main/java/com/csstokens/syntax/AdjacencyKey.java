package com.csstokens.syntax;

import csstokens.syntax.CssToken;
import csstokens.syntax.DelimToken;
import csstokens.syntax.FixedToken;
import csstokens.syntax.TokenType;

/**
 * Identifies a token when deciding whether two adjacent tokens need to be separated.
 * Tokens that are written as a single character are identified by that character,
 * all other tokens by their type.
 */
public sealed interface AdjacencyKey {

    record Kind(TokenType type) implements AdjacencyKey {
        @Override
        public String toString() {
            return type.toString();
        }
    }

    record Char(int codePoint) implements AdjacencyKey {
        @Override
        public String toString() {
            return "'" + Character.toString(codePoint) + "'";
        }
    }

    static AdjacencyKey of(CssToken token) {
        if (token instanceof DelimToken delim) {
            return new Char(delim.codePoint());
        }

        if (token instanceof FixedToken fixed && fixed.value().length() == 1) {
            return new Char(fixed.value().charAt(0));
        }

        return new Kind(token.type());
    }

    static AdjacencyKey of(TokenType type) {
        return new Kind(type);
    }

    static AdjacencyKey of(char c) {
        return new Char(c);
    }
}
