package contractus.semantic;

import java.util.List;

/**
 * Analyzer output. A typed program that comes with errors must not be lowered.
 */
public record AnalysisResult(TypedProgram program, List<SemanticError> errors) {
	public AnalysisResult {
		errors = List.copyOf(errors);
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
