package contractus.diag;

import contractus.ast.Span;

/**
 * A structured error reported by one of the pipeline stages. Rendering is left
 * to the caller.
 */
public interface Diagnostic {
	Span span();

	String message();

	ErrorKind kind();

	default String render(String fileName) {
		return fileName + ":" + span().line() + ":" + span().column() + ": " + kind().displayName() + ": "
				+ message();
	}
}
