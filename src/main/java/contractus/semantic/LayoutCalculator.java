package contractus.semantic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import contractus.ast.Span;
import contractus.types.ArrayType;
import contractus.types.StructType;
import contractus.types.Type;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sequential C-compatible layout: no reordering, each field aligned to its own
 * alignment, struct alignment is the largest field alignment and the size is
 * rounded up to it. A struct that contains itself by value has no layout and
 * is reported.
 */
final class LayoutCalculator {
	private final Map<String, List<ResolvedField>> structs;
	private final Map<String, Span> structSpans;
	private final List<SemanticError> errors;

	private final Map<String, StructLayout> done = new LinkedHashMap<>();
	private final Set<String> failed = new HashSet<>();
	private final Set<String> visiting = new LinkedHashSet<>();

	LayoutCalculator(Map<String, List<ResolvedField>> structs, Map<String, Span> structSpans,
			List<SemanticError> errors) {
		this.structs = structs;
		this.structSpans = structSpans;
		this.errors = errors;
	}

	LayoutTable compute() {
		for (String name : structs.keySet()) {
			layout(name);
		}
		// keep declaration order
		ImmutableMap.Builder<String, StructLayout> ordered = ImmutableMap.builder();
		for (String name : structs.keySet()) {
			StructLayout layout = done.get(name);
			if (layout != null) {
				ordered.put(name, layout);
			}
		}
		return new LayoutTable(ordered.build());
	}

	private boolean layout(String name) {
		if (done.containsKey(name)) {
			return true;
		}
		if (failed.contains(name)) {
			return false;
		}
		if (visiting.contains(name)) {
			errors.add(SemanticError.semantic(
					"struct `" + name + "` contains itself by value and would have infinite size; use a pointer",
					structSpans.get(name)));
			failed.add(name);
			return false;
		}

		visiting.add(name);
		boolean ok = true;
		for (ResolvedField field : structs.get(name)) {
			String dependency = embeddedStruct(field.type());
			if (dependency != null && structs.containsKey(dependency) && !layout(dependency)) {
				ok = false;
			}
		}
		visiting.remove(name);

		if (!ok) {
			failed.add(name);
			return false;
		}

		LayoutTable partial = new LayoutTable(ImmutableMap.copyOf(done));
		List<FieldLayout> fields = new ArrayList<>();
		int offset = 0;
		int alignment = 1;
		int size;
		try {
			for (ResolvedField field : structs.get(name)) {
				int fieldAlign = partial.alignOf(field.type());
				offset = LayoutTable.alignUp(offset, fieldAlign);
				fields.add(new FieldLayout(field.name(), field.type(), offset));
				offset = Math.addExact(offset, partial.sizeOf(field.type()));
				alignment = Math.max(alignment, fieldAlign);
			}
			size = LayoutTable.alignUp(offset, alignment);
		} catch (ArithmeticException e) {
			errors.add(SemanticError.semantic("struct `" + name + "` is too large", structSpans.get(name)));
			failed.add(name);
			return false;
		}
		done.put(name, new StructLayout(name, ImmutableList.copyOf(fields), size, alignment));
		return true;
	}

	/**
	 * The struct stored inline by a value of this type, if any. Pointers,
	 * slices and functions only refer to their target.
	 */
	private static String embeddedStruct(Type type) {
		if (type instanceof StructType struct) {
			return struct.name();
		}
		if (type instanceof ArrayType array) {
			return embeddedStruct(array.element());
		}
		return null;
	}
}
