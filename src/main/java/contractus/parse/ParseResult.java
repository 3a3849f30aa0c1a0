package contractus.parse;

import contractus.ast.Program;

import java.util.List;

/**
 * Parser output. A program that comes with errors has had the broken
 * statements dropped and must not be analyzed.
 */
public record ParseResult(Program program, List<ParseError> errors) {
	public ParseResult {
		errors = List.copyOf(errors);
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
