package test.csstokens.syntax;

import csstokens.syntax.AtKeywordToken;
import csstokens.syntax.BadEscapeToken;
import csstokens.syntax.BadStringToken;
import csstokens.syntax.BadUrlToken;
import csstokens.syntax.CommentToken;
import csstokens.syntax.CssParseException;
import csstokens.syntax.CssParserError;
import csstokens.syntax.CssToken;
import csstokens.syntax.DelimToken;
import csstokens.syntax.DimensionToken;
import csstokens.syntax.EofToken;
import csstokens.syntax.ErrorExtra;
import csstokens.syntax.ErrorToken;
import csstokens.syntax.FixedToken;
import csstokens.syntax.FunctionToken;
import csstokens.syntax.HashExtra;
import csstokens.syntax.HashToken;
import csstokens.syntax.IdentToken;
import csstokens.syntax.NumberToken;
import csstokens.syntax.NumericExtra;
import csstokens.syntax.PercentageToken;
import csstokens.syntax.RangeExtra;
import csstokens.syntax.StringToken;
import csstokens.syntax.TokenType;
import csstokens.syntax.UnicodeRangeToken;
import csstokens.syntax.UrlToken;
import csstokens.syntax.WhitespaceToken;
import org.junit.jupiter.api.Test;
import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class CssTokenTest {

    private static List<CssToken> sampleTokens() {
        var tokens = new ArrayList<CssToken>(List.of(
            new ErrorToken(CssParserError.unexpectedEndOfFile(TokenType.COMMENT)),
            EofToken.INSTANCE,
            new IdentToken("a"),
            new FunctionToken("f"),
            new UrlToken("u"),
            DelimToken.of('!'),
            new AtKeywordToken("k"),
            new StringToken("s"),
            WhitespaceToken.SPACE,
            new CommentToken("c"),
            HashToken.id("h"),
            new NumberToken("1"),
            new PercentageToken("2"),
            new DimensionToken("3", "px"),
            new UnicodeRangeToken(0x20, 0x7F),
            new BadStringToken("b"),
            new BadUrlToken("b"),
            new BadEscapeToken()));
        tokens.addAll(List.of(FixedToken.values()));
        return tokens;
    }

    @Test
    void testStopTokens() {
        var stopTokens = EnumSet.of(
            TokenType.ERROR, TokenType.EOF, TokenType.BAD_ESCAPE, TokenType.BAD_STRING, TokenType.BAD_URI);

        for (TokenType type : TokenType.values()) {
            assertEquals(stopTokens.contains(type), type.isStopToken(), type.name());
        }
    }

    @Test
    void testGrammarNames() {
        assertEquals("error", TokenType.ERROR.toString());
        assertEquals("S", TokenType.WHITESPACE.toString());
        assertEquals("ATKEYWORD", TokenType.AT_KEYWORD.toString());
        assertEquals("UNICODE-RANGE", TokenType.UNICODE_RANGE.toString());
        assertEquals("BAD-URI", TokenType.BAD_URI.toString());
        assertEquals("LEFT-PAREN", TokenType.OPEN_PAREN.toString());
        assertEquals("RIGHT-BRACE", TokenType.CLOSE_BRACE.toString());
    }

    @Test
    void testExtraMatchesTokenType() {
        var coveredTypes = EnumSet.noneOf(TokenType.class);

        for (CssToken token : sampleTokens()) {
            Class<?> extraType = token.type().extraType();
            coveredTypes.add(token.type());

            if (extraType == null) {
                assertNull(token.extra(), token.toString());
            } else {
                assertTrue(extraType.isInstance(token.extra()), token.toString());
            }
        }

        assertEquals(EnumSet.allOf(TokenType.class), coveredTypes);
    }

    @Test
    void testStopTokensCarryErrorExtra() {
        for (CssToken token : sampleTokens()) {
            if (token.type().isStopToken() && token.type() != TokenType.EOF) {
                assertInstanceOf(ErrorExtra.class, token.extra());
            }
        }
    }

    @Test
    void testTokensAreValues() {
        assertEquals(new IdentToken("a"), new IdentToken("a"));
        assertNotEquals(new IdentToken("a"), new FunctionToken("a"));
        assertEquals(HashToken.id("x"), new HashToken("x", new HashExtra(true)));
        assertNotEquals(HashToken.id("x"), HashToken.unrestricted("x"));
        assertEquals(new UnicodeRangeToken(1, 2), new UnicodeRangeToken(1, 2));
    }

    @Test
    void testNullValueIsRejected() {
        assertThrows(NullPointerException.class, () -> new IdentToken(null));
        assertThrows(NullPointerException.class, () -> new HashToken("x", null));
    }

    @Test
    void testDelimValue() {
        assertEquals("+", DelimToken.of('+').value());
        assertEquals(TokenType.DELIM, DelimToken.of('+').type());
        assertThrows(IllegalArgumentException.class, () -> new DelimToken(-1));
        assertThrows(IllegalArgumentException.class, () -> new DelimToken(0x110000));
        assertThrows(IllegalArgumentException.class, () -> new DelimToken(0xD800));
        assertThrows(IllegalArgumentException.class, () -> DelimToken.of('\uDFFF'));
        assertEquals("\uD83D\uDE00", new DelimToken(0x1F600).value());
    }

    @Test
    void testFixedTokenTypes() {
        Set<TokenType> types = EnumSet.noneOf(TokenType.class);
        for (FixedToken token : FixedToken.values()) {
            types.add(token.type());
        }

        assertEquals(FixedToken.values().length, types.size());
        assertEquals(TokenType.CDC, FixedToken.CDC.type());
    }

    @Test
    void testNumericTokens() {
        assertFalse(new NumberToken("10").extra().nonInteger());
        assertTrue(new NumberToken("1.5").extra().nonInteger());
        assertTrue(new NumberToken("1e3").extra().nonInteger());
        assertEquals("px", new DimensionToken("10", "px").unit());
        assertEquals("", new PercentageToken("10").extra().dimension());
    }

    @Test
    void testInvalidNumericTokens() {
        assertThrows(IllegalArgumentException.class, () -> new NumberToken(""));
        assertThrows(IllegalArgumentException.class, () -> new NumberToken("1", new NumericExtra(false, "px")));
        assertThrows(IllegalArgumentException.class, () -> new PercentageToken("1", new NumericExtra(false, "px")));
        assertThrows(IllegalArgumentException.class, () -> new DimensionToken("1", ""));
    }

    @Test
    void testExtraDescriptions() {
        assertEquals("id", HashExtra.ID.toString());
        assertEquals("unrestricted", HashExtra.UNRESTRICTED.toString());
        assertEquals("px", new NumericExtra(false, "px").toString());
        assertEquals("", NumericExtra.integer().toString());
        assertFalse(NumericExtra.integer().nonInteger());
        assertTrue(NumericExtra.fractional().nonInteger());
        assertEquals("U+0041", RangeExtra.of(0x41).toString());
        assertEquals("U+0030-0039", new RangeExtra(0x30, 0x39).toString());
        assertEquals("Bad URL", ErrorExtra.of(CssParserError.badUrl(3)).toString());
    }

    @Test
    void testInvalidRange() {
        assertThrows(IllegalArgumentException.class, () -> new RangeExtra(0x39, 0x30));
        assertThrows(IllegalArgumentException.class, () -> new RangeExtra(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new RangeExtra(0, 0x110000));
    }

    @Test
    void testErrorExtraExposesParseError() {
        var error = CssParserError.badString(12);
        var extra = ErrorExtra.of(error);
        assertEquals(error, extra.parseError());
        assertInstanceOf(CssParseException.class, extra.cause());
        assertEquals(TokenType.BAD_STRING, extra.parseError().kind());
        assertEquals(12, extra.parseError().offset());
    }

    @Test
    void testErrorExtraWithoutParseError() {
        var cause = new IOException("read failed");
        var extra = new ErrorExtra(cause);
        assertNull(extra.parseError());
        assertSame(cause, extra.cause());
        assertEquals("read failed", extra.toString());
    }

    @Test
    void testParserErrorToString() {
        assertEquals("Bad URL [BAD-URI at 5]", CssParserError.badUrl(5).toString());
        assertEquals("Unexpected end of file [STRING]",
                     CssParserError.unexpectedEndOfFile(TokenType.STRING).toString());
    }
}
