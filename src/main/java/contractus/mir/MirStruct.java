package contractus.mir;

import com.google.common.collect.ImmutableList;
import contractus.semantic.FieldLayout;
import contractus.semantic.StructLayout;

/**
 * Struct as seen by the back end: a copy of the computed layout.
 */
public record MirStruct(String name, ImmutableList<FieldLayout> fields, int size, int alignment) {
	public static MirStruct of(StructLayout layout) {
		return new MirStruct(layout.name(), layout.fields(), layout.size(), layout.alignment());
	}
}
