package contractus.codegen;

import contractus.types.ArrayType;
import contractus.types.FunctionType;
import contractus.types.PointerType;
import contractus.types.RangeType;
import contractus.types.ScalarType;
import contractus.types.SliceType;
import contractus.types.StructType;
import contractus.types.Type;
import contractus.types.UnitType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * C spellings of Contractus types for one generator run. Arrays, slices and
 * function types get numbered wrapper names in the order they are first seen,
 * so the same MIR always produces the same names.
 */
final class CTypeNames {
	private final Map<ArrayType, String> arrays = new LinkedHashMap<>();
	private final Map<SliceType, String> slices = new LinkedHashMap<>();
	private final Map<FunctionType, String> functions = new LinkedHashMap<>();

	/**
	 * Registers {@code type} and everything it mentions, components first.
	 */
	void register(Type type) {
		if (type instanceof PointerType pointer) {
			register(pointer.pointee());
		} else if (type instanceof ArrayType array && !arrays.containsKey(array)) {
			register(array.element());
			arrays.put(array, "ctx_arr_" + arrays.size());
		} else if (type instanceof SliceType slice && !slices.containsKey(slice)) {
			register(slice.element());
			slices.put(slice, "ctx_slice_" + slices.size());
		} else if (type instanceof FunctionType function && !functions.containsKey(function)) {
			function.params().forEach(this::register);
			register(function.returnType());
			functions.put(function, "ctx_fn_" + functions.size());
		}
	}

	String name(Type type) {
		if (type instanceof ScalarType scalar) {
			return switch (scalar) {
				case I32 -> "int32_t";
				case BOOL -> "int";
				case U8 -> "uint8_t";
			};
		}
		if (type instanceof StructType struct) {
			return structName(struct.name());
		}
		if (type instanceof PointerType pointer) {
			return name(pointer.pointee()) + " *";
		}
		if (type instanceof ArrayType array) {
			return lookup(arrays, array);
		}
		if (type instanceof SliceType slice) {
			return lookup(slices, slice);
		}
		if (type instanceof FunctionType function) {
			return lookup(functions, function);
		}
		if (type instanceof UnitType) {
			return "void";
		}
		if (type instanceof RangeType) {
			throw new CodeGenException("range values have no C representation");
		}
		throw new CodeGenException("unknown type " + type);
	}

	/**
	 * {@code type name}, without a space after a pointer star.
	 */
	String declare(Type type, String variable) {
		String typeName = name(type);
		return typeName.endsWith("*") ? typeName + variable : typeName + " " + variable;
	}

	Map<ArrayType, String> arrays() {
		return arrays;
	}

	Map<SliceType, String> slices() {
		return slices;
	}

	Map<FunctionType, String> functions() {
		return functions;
	}

	static String structName(String name) {
		return "ctx_" + name;
	}

	static String fieldName(String name) {
		return "f_" + name;
	}

	static String functionName(String name) {
		return "ctx_" + name;
	}

	private static <T extends Type> String lookup(Map<T, String> names, T type) {
		String name = names.get(type);
		if (name == null) {
			throw new CodeGenException("type " + type + " was not registered before use");
		}
		return name;
	}
}
