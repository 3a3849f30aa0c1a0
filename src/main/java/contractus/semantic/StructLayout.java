package contractus.semantic;

import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Byte layout of one struct: fields in declaration order with their offsets,
 * plus total size and alignment.
 */
public record StructLayout(String name, ImmutableList<FieldLayout> fields, int size, int alignment) {
	public Optional<FieldLayout> field(String fieldName) {
		return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
	}
}
