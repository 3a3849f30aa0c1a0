package contractus;

import contractus.diag.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The source was rejected. Carries every diagnostic of the stage that failed.
 */
public class CompileException extends Exception {
	private final List<Diagnostic> diagnostics;

	public CompileException(List<? extends Diagnostic> diagnostics) {
		super(diagnostics.stream()
				.map(d -> d.span() + ": " + d.kind().displayName() + ": " + d.message())
				.collect(Collectors.joining("\n")));
		this.diagnostics = List.copyOf(diagnostics);
	}

	public List<Diagnostic> diagnostics() {
		return diagnostics;
	}
}
