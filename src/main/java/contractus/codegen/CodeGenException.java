package contractus.codegen;

import contractus.ast.Span;
import contractus.diag.Diagnostic;
import contractus.diag.ErrorKind;

/**
 * Malformed MIR reached the C generator. This is a bug in an earlier stage,
 * never a user error.
 */
public class CodeGenException extends RuntimeException implements Diagnostic {
	public CodeGenException(String message) {
		super(message);
	}

	@Override
	public Span span() {
		return Span.NONE;
	}

	@Override
	public String message() {
		return getMessage();
	}

	@Override
	public ErrorKind kind() {
		return ErrorKind.CODEGEN_ERROR;
	}
}
