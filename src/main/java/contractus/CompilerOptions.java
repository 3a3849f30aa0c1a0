package contractus;

import com.google.common.base.Preconditions;

/**
 * Knobs for one compilation.
 *
 * @param layoutAssertions emit {@code _Static_assert}s checking that the C
 *                         compiler lays structs out as computed
 * @param entryPoint       function that receives the C {@code main} wrapper
 */
public record CompilerOptions(boolean layoutAssertions, String entryPoint) {
	public CompilerOptions {
		Preconditions.checkNotNull(entryPoint, "entryPoint");
		Preconditions.checkArgument(!entryPoint.isBlank(), "entry point name must not be blank");
	}

	public static CompilerOptions defaults() {
		return new CompilerOptions(true, "main");
	}

	public CompilerOptions withLayoutAssertions(boolean enabled) {
		return new CompilerOptions(enabled, entryPoint);
	}
}
