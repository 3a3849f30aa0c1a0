package contractus.ast;

import java.util.List;

/**
 * A function definition. {@code returnType} is null when the source omits
 * {@code -> T}, which means unit.
 */
public record FunctionDef(String name, List<Param> params, TypeRef returnType, Block body, Span span)
		implements Item {
}
