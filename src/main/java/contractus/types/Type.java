package contractus.types;

/**
 * Closed set of Contractus types. Equality is structural except for structs,
 * which compare by name only.
 */
public sealed interface Type
		permits ScalarType, StructType, ArrayType, SliceType, PointerType, FunctionType, UnitType, RangeType {
	default boolean isInteger() {
		return this == ScalarType.I32 || this == ScalarType.U8;
	}

	default boolean isScalar() {
		return this instanceof ScalarType;
	}

	/**
	 * Whether a value of this type can live in a variable, a field or a
	 * register.
	 */
	default boolean isStorable() {
		return !(this instanceof UnitType) && !(this instanceof RangeType);
	}
}
