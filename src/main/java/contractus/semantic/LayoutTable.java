package contractus.semantic;

import com.google.common.collect.ImmutableMap;
import contractus.types.ArrayType;
import contractus.types.FunctionType;
import contractus.types.PointerType;
import contractus.types.ScalarType;
import contractus.types.SliceType;
import contractus.types.StructType;
import contractus.types.Type;

/**
 * Immutable struct layouts, shared by semantic analysis, MIR lowering and C
 * generation. Sizes assume a 64-bit target whose C {@code int} is 4 bytes.
 */
public final class LayoutTable {
	public static final int WORD_SIZE = 8;

	private final ImmutableMap<String, StructLayout> layouts;

	public LayoutTable(ImmutableMap<String, StructLayout> layouts) {
		this.layouts = layouts;
	}

	public ImmutableMap<String, StructLayout> layouts() {
		return layouts;
	}

	public StructLayout get(String structName) {
		StructLayout layout = layouts.get(structName);
		if (layout == null) {
			throw new IllegalArgumentException("no layout for struct " + structName);
		}
		return layout;
	}

	public boolean contains(String structName) {
		return layouts.containsKey(structName);
	}

	public int sizeOf(Type type) {
		if (type instanceof ScalarType scalar) {
			return scalarSize(scalar);
		}
		if (type instanceof PointerType || type instanceof FunctionType) {
			return WORD_SIZE;
		}
		if (type instanceof SliceType) {
			return 2 * WORD_SIZE;
		}
		if (type instanceof ArrayType array) {
			return Math.multiplyExact(array.length(), sizeOf(array.element()));
		}
		if (type instanceof StructType struct) {
			return get(struct.name()).size();
		}
		throw new IllegalArgumentException("type has no size: " + type);
	}

	/**
	 * Whether the size of {@code type} is representable. Only arrays can
	 * overflow here: struct sizes are checked when the struct is laid out, and
	 * a struct without a layout has already been reported.
	 */
	public boolean fits(Type type) {
		if (!(type instanceof ArrayType array) || !hasLayout(array.element())) {
			return true;
		}
		try {
			sizeOf(array);
			return true;
		} catch (ArithmeticException e) {
			return false;
		}
	}

	private boolean hasLayout(Type type) {
		if (type instanceof ArrayType array) {
			return hasLayout(array.element());
		}
		return !(type instanceof StructType struct) || contains(struct.name());
	}

	public int alignOf(Type type) {
		if (type instanceof ScalarType scalar) {
			return naturalAlignment(scalarSize(scalar));
		}
		if (type instanceof PointerType || type instanceof FunctionType || type instanceof SliceType) {
			return WORD_SIZE;
		}
		if (type instanceof ArrayType array) {
			return alignOf(array.element());
		}
		if (type instanceof StructType struct) {
			return get(struct.name()).alignment();
		}
		throw new IllegalArgumentException("type has no alignment: " + type);
	}

	static int scalarSize(ScalarType scalar) {
		return switch (scalar) {
			case I32 -> 4;
			// bool is emitted as a C int
			case BOOL -> 4;
			case U8 -> 1;
		};
	}

	/**
	 * Size rounded up to the next power of two, capped at the word size.
	 */
	static int naturalAlignment(int size) {
		int alignment = 1;
		while (alignment < size && alignment < WORD_SIZE) {
			alignment <<= 1;
		}
		return alignment;
	}

	/**
	 * @throws ArithmeticException if the result does not fit an {@code int}
	 */
	static int alignUp(int offset, int alignment) {
		return Math.addExact(offset, alignment - 1) / alignment * alignment;
	}
}
