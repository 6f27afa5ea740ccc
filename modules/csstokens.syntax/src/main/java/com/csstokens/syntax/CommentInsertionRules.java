package com.csstokens.syntax;

import java.util.Map;
import java.util.Set;

import static csstokens.syntax.TokenType.*;
import static com.csstokens.syntax.AdjacencyKey.of;

/**
 * Pairs of adjacent tokens that must be separated by an empty comment, because their
 * concatenated source text would be read back as different tokens.
 *
 * @see <a href="https://www.w3.org/TR/css-syntax-3/#serialization">Serialization</a>
 */
public final class CommentInsertionRules {

    private static final Set<AdjacencyKey> THROUGH_CDC = Set.of(
        of(IDENT), of(FUNCTION), of(URI), of(BAD_URI), of(NUMBER), of(PERCENTAGE),
        of(DIMENSION), of(UNICODE_RANGE), of(CDC), of('-'));

    private static final Set<AdjacencyKey> NUMERIC = Set.of(
        of(NUMBER), of(PERCENTAGE), of(DIMENSION));

    private static final Set<AdjacencyKey> EQUALS_SIGN = Set.of(of('='));

    private static final Map<AdjacencyKey, Set<AdjacencyKey>> RULES = Map.ofEntries(
        Map.entry(of(IDENT), Set.of(
            of(IDENT), of(FUNCTION), of(URI), of(BAD_URI), of('-'), of(NUMBER), of(PERCENTAGE),
            of(DIMENSION), of(UNICODE_RANGE), of(CDC), of('('))),
        Map.entry(of(AT_KEYWORD), THROUGH_CDC),
        Map.entry(of(HASH), THROUGH_CDC),
        Map.entry(of(DIMENSION), THROUGH_CDC),
        Map.entry(of('#'), Set.of(
            of(IDENT), of(FUNCTION), of(URI), of(BAD_URI), of(NUMBER), of(PERCENTAGE),
            of(DIMENSION), of(UNICODE_RANGE), of('-'))),
        Map.entry(of('-'), Set.of(
            of(IDENT), of(FUNCTION), of(URI), of(BAD_URI), of(NUMBER), of(PERCENTAGE),
            of(DIMENSION), of(UNICODE_RANGE))),
        Map.entry(of(NUMBER), Set.of(
            of(IDENT), of(FUNCTION), of(URI), of(BAD_URI), of(NUMBER), of(PERCENTAGE),
            of(DIMENSION), of(UNICODE_RANGE))),
        Map.entry(of('@'), Set.of(
            of(IDENT), of(FUNCTION), of(URI), of(BAD_URI), of(UNICODE_RANGE), of('-'))),
        Map.entry(of(UNICODE_RANGE), Set.of(
            of(IDENT), of(FUNCTION), of(NUMBER), of(PERCENTAGE), of(DIMENSION), of('?'))),
        Map.entry(of('.'), NUMERIC),
        Map.entry(of('+'), NUMERIC),
        Map.entry(of('$'), EQUALS_SIGN),
        Map.entry(of('*'), EQUALS_SIGN),
        Map.entry(of('^'), EQUALS_SIGN),
        Map.entry(of('~'), EQUALS_SIGN),
        Map.entry(of('|'), Set.of(of('='), of('|'))),
        Map.entry(of('/'), Set.of(of('*'))));

    private CommentInsertionRules() {}

    /**
     * Determines whether an empty comment must be written between two adjacent tokens.
     *
     * @param previous the key of the token that was written last
     * @param current the key of the token that is about to be written
     * @return {@code true} if the tokens must be separated
     */
    public static boolean requiresSeparator(AdjacencyKey previous, AdjacencyKey current) {
        Set<AdjacencyKey> following = RULES.get(previous);
        return following != null && following.contains(current);
    }
}
