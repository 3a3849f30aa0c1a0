package contractus.ast;

import java.util.List;

/**
 * Ordered struct, function and constant definitions of one compilation unit.
 */
public record Program(List<Item> items, Span span) implements Node {
	public List<StructDef> structs() {
		return items.stream()
				.filter(StructDef.class::isInstance)
				.map(StructDef.class::cast)
				.toList();
	}

	public List<ConstDef> constants() {
		return items.stream()
				.filter(ConstDef.class::isInstance)
				.map(ConstDef.class::cast)
				.toList();
	}

	public List<FunctionDef> functions() {
		return items.stream()
				.filter(FunctionDef.class::isInstance)
				.map(FunctionDef.class::cast)
				.toList();
	}
}
