package contractus.semantic;

import contractus.types.ScalarType;

/**
 * Functions provided by the runtime preamble rather than by the program.
 */
public final class Builtins {
	public static final String PRINT = "print";

	private Builtins() {
		// utility class
	}

	public static boolean isBuiltin(String name) {
		return PRINT.equals(name);
	}

	/**
	 * Runtime entry point printing one value of the given scalar type.
	 */
	public static String printFunction(ScalarType type) {
		return "print_" + type.keyword();
	}
}
