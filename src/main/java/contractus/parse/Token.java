package contractus.parse;

import contractus.ast.Span;

public record Token(TokenKind kind, String lexeme, Span span) {
	public String describe() {
		return switch (kind) {
			case EOF -> "end of input";
			case IDENT, INT_LITERAL, ERROR -> kind.description() + " '" + lexeme + "'";
			default -> kind.description();
		};
	}
}
