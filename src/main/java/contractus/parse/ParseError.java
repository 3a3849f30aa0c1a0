package contractus.parse;

import contractus.ast.Span;
import contractus.diag.Diagnostic;
import contractus.diag.ErrorKind;

/**
 * An unexpected or missing token.
 */
public record ParseError(Span span, String expected, String found) implements Diagnostic {
	@Override
	public String message() {
		return "expected " + expected + ", found " + found;
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.PARSE_ERROR;
	}
}
