package contractus.semantic;

import contractus.ast.Span;
import contractus.types.Type;

record ResolvedField(String name, Type type, Span span) {
}
