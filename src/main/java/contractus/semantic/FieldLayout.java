package contractus.semantic;

import contractus.types.Type;

public record FieldLayout(String name, Type type, int offset) {
}
