package contractus.parse;

import contractus.ast.Span;
import org.junit.jupiter.api.Test;

import java.util.List;

import static contractus.parse.TokenKind.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LexerTest {
	private static List<TokenKind> kinds(String source) {
		return new Lexer().lex(source).stream().map(Token::kind).toList();
	}

	@Test
	void lexesLetStatement() {
		assertEquals(List.of(LET, MUT, IDENT, COLON, IDENT, ASSIGN, INT_LITERAL, PLUS, INT_LITERAL, SEMICOLON, EOF),
				kinds("let mut x: i32 = 1 + 2;"));
	}

	@Test
	void prefersLongestOperator() {
		assertEquals(List.of(IDENT, DOT_DOT_EQ, IDENT, DOT_DOT, IDENT, ARROW, PLUS_ASSIGN, EQ, LE, AND_AND, OR_OR, EOF),
				kinds("a..=b ..c -> += == <= && ||"));
	}

	@Test
	void lexesBitwiseOperatorsAndConst() {
		assertEquals(List.of(CONST, IDENT, SHL, INT_LITERAL, SHR, LT, GE, PIPE, OR_OR, CARET, AMP, AND_AND, EOF),
				kinds("const a << 1 >> < >= | || ^ & &&"));
	}

	@Test
	void rangeBetweenIntegersIsNotAFraction() {
		assertEquals(List.of(INT_LITERAL, DOT_DOT, INT_LITERAL, EOF), kinds("0..5"));
	}

	@Test
	void skipsCommentsAndTracksLines() {
		List<Token> tokens = new Lexer().lex("// header\nfn /* spans\n two */ main");
		assertEquals(FN, tokens.get(0).kind());
		assertEquals(2, tokens.get(0).span().line());
		assertEquals(1, tokens.get(0).span().column());

		Token main = tokens.get(1);
		assertEquals("main", main.lexeme());
		assertEquals(3, main.span().line());
		assertEquals(9, main.span().column());
	}

	@Test
	void unknownCharacterBecomesErrorToken() {
		List<Token> tokens = new Lexer().lex("let @ x");
		assertEquals(List.of(LET, ERROR, IDENT, EOF), tokens.stream().map(Token::kind).toList());
		assertEquals("@", tokens.get(1).lexeme());
	}

	@Test
	void spansAreByteOffsets() {
		Token bar = new Lexer().lex("foo  bar").get(1);
		assertEquals(new Span(5, 8, 1, 6), bar.span());
	}

	@Test
	void alwaysEndsWithEof() {
		assertEquals(List.of(EOF), kinds(""));
		assertEquals(List.of(EOF), kinds("   // only a comment"));
	}
}
