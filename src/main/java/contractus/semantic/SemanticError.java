package contractus.semantic;

import contractus.ast.Span;
import contractus.diag.Diagnostic;
import contractus.diag.ErrorKind;
import contractus.types.Type;

/**
 * A rejected construct found during semantic analysis. The factories name the
 * error kinds of the taxonomy.
 */
public record SemanticError(ErrorKind kind, String message, Span span) implements Diagnostic {
	public static SemanticError semantic(String message, Span span) {
		return new SemanticError(ErrorKind.SEMANTIC_ERROR, message, span);
	}

	public static SemanticError typeMismatch(Type expected, Type found, Span span) {
		return new SemanticError(ErrorKind.TYPE_ERROR, "expected `" + expected + "`, found `" + found + "`", span);
	}

	public static SemanticError typeError(String message, Span span) {
		return new SemanticError(ErrorKind.TYPE_ERROR, message, span);
	}

	public static SemanticError undefinedVariable(String name, Span span) {
		return new SemanticError(ErrorKind.UNDEFINED_VARIABLE, "cannot find value `" + name + "` in this scope", span);
	}

	public static SemanticError undefinedFunction(String name, Span span) {
		return new SemanticError(ErrorKind.UNDEFINED_VARIABLE, "cannot find function `" + name + "` in this scope",
				span);
	}

	public static SemanticError undefinedStruct(String name, Span span) {
		return new SemanticError(ErrorKind.UNDEFINED_STRUCT, "cannot find struct `" + name + "`", span);
	}

	public static SemanticError undefinedField(Type owner, String field, Span span) {
		return new SemanticError(ErrorKind.UNDEFINED_FIELD, "no field `" + field + "` on type `" + owner + "`", span);
	}

	public static SemanticError invalidIterable(Type found, Span span) {
		return new SemanticError(ErrorKind.INVALID_ITERABLE, "`" + found + "` is not iterable", span);
	}
}
