package contractus.diag;

/**
 * Closed taxonomy of compiler diagnostics.
 */
public enum ErrorKind {
	PARSE_ERROR("ParseError"),
	SEMANTIC_ERROR("SemanticError"),
	TYPE_ERROR("TypeError"),
	UNDEFINED_VARIABLE("UndefinedVariable"),
	UNDEFINED_STRUCT("UndefinedStruct"),
	UNDEFINED_FIELD("UndefinedField"),
	INVALID_ITERABLE("InvalidIterable"),
	CODEGEN_ERROR("CodeGenError");

	private final String displayName;

	ErrorKind(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}
}
