package contractus.parse;

import contractus.ast.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Byte scanner producing the token stream consumed by {@link Parser}.
 *
 * Notes:
 * - Skips whitespace, // line comments and /* block comments *\/.
 * - Never throws: characters outside the language become {@link TokenKind#ERROR}
 * tokens and are reported by the parser.
 * - The returned list always ends with an {@link TokenKind#EOF} token.
 */
public final class Lexer {
	private String input;
	private int i;
	private int line;
	private int lineStart;

	public List<Token> lex(String source) {
		this.input = source;
		this.i = 0;
		this.line = 1;
		this.lineStart = 0;

		List<Token> tokens = new ArrayList<>();
		while (i < input.length()) {
			char c = input.charAt(i);

			// whitespace
			if (Character.isWhitespace(c)) {
				advance();
				continue;
			}

			// comments (must be checked before operators)
			if (c == '/' && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (n == '/') {
					consumeLineComment();
					continue;
				}
				if (n == '*') {
					consumeBlockComment();
					continue;
				}
			}

			int start = i;
			int startLine = line;
			int startColumn = i - lineStart + 1;

			if (Character.isLetter(c) || c == '_') {
				while (i < input.length() && isIdentifierPart(input.charAt(i))) {
					i++;
				}
				String text = input.substring(start, i);
				TokenKind kind = TokenKind.KEYWORDS.getOrDefault(text, TokenKind.IDENT);
				tokens.add(new Token(kind, text, new Span(start, i, startLine, startColumn)));
				continue;
			}

			if (Character.isDigit(c)) {
				while (i < input.length() && Character.isDigit(input.charAt(i))) {
					i++;
				}
				tokens.add(new Token(TokenKind.INT_LITERAL, input.substring(start, i),
						new Span(start, i, startLine, startColumn)));
				continue;
			}

			TokenKind kind = operator();
			if (kind == null) {
				i++;
				kind = TokenKind.ERROR;
			}
			tokens.add(new Token(kind, input.substring(start, i), new Span(start, i, startLine, startColumn)));
		}

		int end = input.length();
		tokens.add(new Token(TokenKind.EOF, "", new Span(end, end, line, end - lineStart + 1)));
		return tokens;
	}

	/**
	 * Consumes the longest operator or delimiter at the cursor, or returns null
	 * without consuming anything.
	 */
	private TokenKind operator() {
		if (input.startsWith("..=", i)) {
			i += 3;
			return TokenKind.DOT_DOT_EQ;
		}
		String two = i + 1 < input.length() ? input.substring(i, i + 2) : "";
		TokenKind twoKind = switch (two) {
			case ".." -> TokenKind.DOT_DOT;
			case "->" -> TokenKind.ARROW;
			case "==" -> TokenKind.EQ;
			case "!=" -> TokenKind.NE;
			case "<=" -> TokenKind.LE;
			case ">=" -> TokenKind.GE;
			case "&&" -> TokenKind.AND_AND;
			case "||" -> TokenKind.OR_OR;
			case "<<" -> TokenKind.SHL;
			case ">>" -> TokenKind.SHR;
			case "+=" -> TokenKind.PLUS_ASSIGN;
			case "-=" -> TokenKind.MINUS_ASSIGN;
			case "*=" -> TokenKind.STAR_ASSIGN;
			case "/=" -> TokenKind.SLASH_ASSIGN;
			case "%=" -> TokenKind.PERCENT_ASSIGN;
			default -> null;
		};
		if (twoKind != null) {
			i += 2;
			return twoKind;
		}
		TokenKind oneKind = switch (input.charAt(i)) {
			case '+' -> TokenKind.PLUS;
			case '-' -> TokenKind.MINUS;
			case '*' -> TokenKind.STAR;
			case '/' -> TokenKind.SLASH;
			case '%' -> TokenKind.PERCENT;
			case '=' -> TokenKind.ASSIGN;
			case '<' -> TokenKind.LT;
			case '>' -> TokenKind.GT;
			case '!' -> TokenKind.BANG;
			case '&' -> TokenKind.AMP;
			case '|' -> TokenKind.PIPE;
			case '^' -> TokenKind.CARET;
			case '(' -> TokenKind.LPAREN;
			case ')' -> TokenKind.RPAREN;
			case '{' -> TokenKind.LBRACE;
			case '}' -> TokenKind.RBRACE;
			case '[' -> TokenKind.LBRACKET;
			case ']' -> TokenKind.RBRACKET;
			case ';' -> TokenKind.SEMICOLON;
			case ':' -> TokenKind.COLON;
			case ',' -> TokenKind.COMMA;
			case '.' -> TokenKind.DOT;
			default -> null;
		};
		if (oneKind != null) {
			i++;
		}
		return oneKind;
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private void advance() {
		if (input.charAt(i) == '\n') {
			line++;
			lineStart = i + 1;
		}
		i++;
	}

	private void consumeLineComment() {
		while (i < input.length() && input.charAt(i) != '\n') {
			i++;
		}
	}

	private void consumeBlockComment() {
		i += 2;
		while (i < input.length()) {
			if (input.charAt(i) == '*' && i + 1 < input.length() && input.charAt(i + 1) == '/') {
				i += 2;
				return;
			}
			advance();
		}
	}
}
