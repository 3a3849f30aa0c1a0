package contractus.codegen;

import contractus.mir.Instruction;
import contractus.mir.MirBinaryOp;
import contractus.mir.MirFunction;
import contractus.mir.MirProgram;
import contractus.mir.MirStruct;
import contractus.mir.MirValidator;
import contractus.mir.Register;
import contractus.semantic.FieldLayout;
import contractus.types.ArrayType;
import contractus.types.FunctionType;
import contractus.types.PointerType;
import contractus.types.ScalarType;
import contractus.types.SliceType;
import contractus.types.StructType;
import contractus.types.Type;
import contractus.types.UnitType;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Emits one self-contained C translation unit for a MIR program.
 *
 * Output order: runtime preamble, forward typedefs, function-pointer
 * typedefs, aggregate definitions (with layout assertions), prototypes,
 * function bodies, then the {@code main} wrapper. Registers become C locals
 * declared at the top of each function and jumps become {@code goto}, so
 * evaluation order and trip counts are exactly those of the MIR.
 */
public final class CGenerator {
	static final String PREAMBLE = """
			#include <stddef.h>
			#include <stdint.h>
			#include <stdio.h>
			#include <stdlib.h>

			static inline void *ctxrt_alloc(size_t size) {
				void *p = calloc(1, size);
				if (p == NULL) {
					abort();
				}
				return p;
			}

			static inline void ctxrt_free(void *p) {
				free(p);
			}

			static inline void ctxrt_print_i32(int32_t value) {
				printf("%d\\n", (int) value);
			}

			static inline void ctxrt_print_bool(int value) {
				puts(value ? "true" : "false");
			}

			static inline void ctxrt_print_u8(uint8_t value) {
				printf("%u\\n", (unsigned) value);
			}
			""";

	private final boolean layoutAssertions;
	private final String entryPoint;

	public CGenerator() {
		this(true, "main");
	}

	public CGenerator(boolean layoutAssertions, String entryPoint) {
		this.layoutAssertions = layoutAssertions;
		this.entryPoint = entryPoint;
	}

	public String generate(MirProgram program) {
		List<String> problems = new MirValidator().validate(program);
		if (!problems.isEmpty()) {
			throw new CodeGenException("invalid MIR: " + String.join("; ", problems));
		}

		CTypeNames types = new CTypeNames();
		for (MirStruct struct : program.structs()) {
			struct.fields().forEach(field -> types.register(field.type()));
		}
		for (MirFunction function : program.functions()) {
			types.register(function.returnType());
			function.registers().forEach(register -> types.register(register.type()));
		}

		StringBuilder out = new StringBuilder(PREAMBLE);
		emitTypes(program, types, out);
		if (!program.functions().isEmpty()) {
			out.append('\n');
			for (MirFunction function : program.functions()) {
				out.append(signature(function, types)).append(";\n");
			}
		}
		for (MirFunction function : program.functions()) {
			out.append('\n');
			new FunctionEmitter(function, types, out).emit();
		}
		program.function(entryPoint)
				.filter(main -> main.params().isEmpty())
				.ifPresent(main -> emitEntryWrapper(main, out));
		return out.toString();
	}

	// --------------------------------------------------------------- types

	private void emitTypes(MirProgram program, CTypeNames types, StringBuilder out) {
		Map<String, MirStruct> structs = new HashMap<>();
		for (MirStruct struct : program.structs()) {
			structs.put(struct.name(), struct);
		}
		if (structs.isEmpty() && types.arrays().isEmpty() && types.slices().isEmpty()
				&& types.functions().isEmpty()) {
			return;
		}

		out.append('\n');
		for (MirStruct struct : program.structs()) {
			forward(CTypeNames.structName(struct.name()), out);
		}
		types.arrays().values().forEach(name -> forward(name, out));
		types.slices().values().forEach(name -> forward(name, out));
		for (Map.Entry<FunctionType, String> entry : types.functions().entrySet()) {
			FunctionType function = entry.getKey();
			out.append("typedef ").append(types.name(function.returnType()))
					.append(" (*").append(entry.getValue()).append(")(")
					.append(parameterTypes(function, types)).append(");\n");
		}

		Set<Type> defined = new HashSet<>();
		for (MirStruct struct : program.structs()) {
			define(new StructType(struct.name()), structs, types, defined, out);
		}
		for (ArrayType array : types.arrays().keySet()) {
			define(array, structs, types, defined, out);
		}
		for (SliceType slice : types.slices().keySet()) {
			define(slice, structs, types, defined, out);
		}
	}

	private static void forward(String name, StringBuilder out) {
		out.append("typedef struct ").append(name).append(' ').append(name).append(";\n");
	}

	private static String parameterTypes(FunctionType function, CTypeNames types) {
		if (function.params().isEmpty()) {
			return "void";
		}
		return function.params().stream().map(types::name).collect(Collectors.joining(", "));
	}

	/**
	 * Emits the complete definition of an aggregate after everything it
	 * stores by value.
	 */
	private void define(Type type, Map<String, MirStruct> structs, CTypeNames types, Set<Type> defined,
			StringBuilder out) {
		if (!defined.add(type)) {
			return;
		}
		if (type instanceof StructType structType) {
			MirStruct struct = structs.get(structType.name());
			if (struct == null) {
				throw new CodeGenException("no layout for struct " + structType.name());
			}
			for (FieldLayout field : struct.fields()) {
				defineByValue(field.type(), structs, types, defined, out);
			}
			String name = CTypeNames.structName(struct.name());
			out.append("\nstruct ").append(name).append(" {\n");
			for (FieldLayout field : struct.fields()) {
				out.append('\t').append(types.declare(field.type(), CTypeNames.fieldName(field.name()))).append(";\n");
			}
			out.append("};\n");
			if (layoutAssertions) {
				assertLayout(struct, name, out);
			}
		} else if (type instanceof ArrayType array) {
			defineByValue(array.element(), structs, types, defined, out);
			String name = types.name(array);
			out.append("\nstruct ").append(name).append(" {\n\t")
					.append(types.declare(array.element(), "data[" + array.length() + "]"))
					.append(";\n};\n");
		} else if (type instanceof SliceType slice) {
			String name = types.name(slice);
			out.append("\nstruct ").append(name).append(" {\n\t")
					.append(types.declare(new PointerType(slice.element()), "ptr"))
					.append(";\n\tint32_t len;\n};\n");
		}
	}

	private void defineByValue(Type type, Map<String, MirStruct> structs, CTypeNames types, Set<Type> defined,
			StringBuilder out) {
		if (type instanceof StructType || type instanceof ArrayType || type instanceof SliceType) {
			define(type, structs, types, defined, out);
		}
	}

	private static void assertLayout(MirStruct struct, String name, StringBuilder out) {
		out.append("_Static_assert(sizeof(").append(name).append(") == ").append(struct.size())
				.append(", \"size of ").append(struct.name()).append("\");\n");
		out.append("_Static_assert(_Alignof(").append(name).append(") == ").append(struct.alignment())
				.append(", \"alignment of ").append(struct.name()).append("\");\n");
		for (FieldLayout field : struct.fields()) {
			out.append("_Static_assert(offsetof(").append(name).append(", ")
					.append(CTypeNames.fieldName(field.name())).append(") == ").append(field.offset())
					.append(", \"offset of ").append(struct.name()).append('.').append(field.name())
					.append("\");\n");
		}
	}

	// ------------------------------------------------------------ functions

	static String signature(MirFunction function, CTypeNames types) {
		String params = function.params().isEmpty()
				? "void"
				: function.params().stream()
						.map(p -> types.declare(p.type(), FunctionEmitter.registerName(p)))
						.collect(Collectors.joining(", "));
		return types.declare(function.returnType(), CTypeNames.functionName(function.name())) + "(" + params + ")";
	}

	private static void emitEntryWrapper(MirFunction main, StringBuilder out) {
		out.append("\nint main(void) {\n");
		if (main.returnType() == ScalarType.I32) {
			out.append("\treturn (int) ").append(CTypeNames.functionName(main.name())).append("();\n");
		} else if (main.returnType() instanceof UnitType) {
			out.append('\t').append(CTypeNames.functionName(main.name())).append("();\n\treturn 0;\n");
		} else {
			throw new CodeGenException("entry point " + main.name() + " returns " + main.returnType());
		}
		out.append("}\n");
	}

	/**
	 * Writes one C function body from its MIR.
	 */
	private static final class FunctionEmitter {
		private final MirFunction function;
		private final CTypeNames types;
		private final StringBuilder out;

		FunctionEmitter(MirFunction function, CTypeNames types, StringBuilder out) {
			this.function = function;
			this.types = types;
			this.out = out;
		}

		static String registerName(Register register) {
			return "r" + register.id();
		}

		static String slotName(Register register) {
			return "slot" + register.id();
		}

		void emit() {
			out.append(signature(function, types)).append(" {\n");
			Set<Register> params = new HashSet<>(function.params());
			for (Register register : function.registers()) {
				if (!params.contains(register)) {
					out.append('\t').append(types.declare(register.type(), registerName(register))).append(";\n");
				}
			}
			for (Instruction instruction : function.instructions()) {
				if (instruction instanceof Instruction.Alloc alloc) {
					out.append('\t').append(types.declare(alloc.slotType(), slotName(alloc.dest()))).append(";\n");
				}
			}
			for (Instruction instruction : function.instructions()) {
				if (instruction instanceof Instruction.Label label) {
					out.append("L").append(label.id()).append(":;\n");
				} else {
					out.append('\t').append(statement(instruction)).append('\n');
				}
			}
			out.append("}\n");
		}

		private String statement(Instruction instruction) {
			if (instruction instanceof Instruction.Const i) {
				return assign(i.dest(), literal(i.dest().type(), i.value()));
			}
			if (instruction instanceof Instruction.BinOp i) {
				return assign(i.dest(), binary(i));
			}
			if (instruction instanceof Instruction.UnOp i) {
				return assign(i.dest(), unary(i));
			}
			if (instruction instanceof Instruction.Cast i) {
				return assign(i.dest(), "(" + types.name(i.dest().type()) + ") " + r(i.operand()));
			}
			if (instruction instanceof Instruction.Alloc i) {
				return assign(i.dest(), "&" + slotName(i.dest()));
			}
			if (instruction instanceof Instruction.Load i) {
				return assign(i.dest(), "*" + r(i.address()));
			}
			if (instruction instanceof Instruction.Store i) {
				return "*" + r(i.address()) + " = " + r(i.value()) + ";";
			}
			if (instruction instanceof Instruction.GetFieldPtr i) {
				return assign(i.dest(), "(" + types.name(i.dest().type()) + ") ((uint8_t *) " + r(i.base()) + " + "
						+ i.offset() + ")");
			}
			if (instruction instanceof Instruction.GetElementPtr i) {
				String base = i.base().type() instanceof SliceType ? r(i.base()) + ".ptr" : r(i.base());
				return assign(i.dest(), "(" + types.name(i.dest().type()) + ") ((uint8_t *) " + base
						+ " + (ptrdiff_t) " + r(i.index()) + " * " + i.stride() + ")");
			}
			if (instruction instanceof Instruction.MakeSlice i) {
				return assign(i.dest(), "(" + types.name(i.dest().type()) + ") { " + r(i.elements()) + ", "
						+ r(i.length()) + " }");
			}
			if (instruction instanceof Instruction.SliceLen i) {
				return assign(i.dest(), r(i.slice()) + ".len");
			}
			if (instruction instanceof Instruction.FuncRef i) {
				return assign(i.dest(), CTypeNames.functionName(i.function()));
			}
			if (instruction instanceof Instruction.Call i) {
				String callee = i.builtin() ? "ctxrt_" + i.function() : CTypeNames.functionName(i.function());
				return call(i.dest(), callee, i.args());
			}
			if (instruction instanceof Instruction.CallIndirect i) {
				return call(i.dest(), r(i.callee()), i.args());
			}
			if (instruction instanceof Instruction.Jump i) {
				return "goto L" + i.target() + ";";
			}
			if (instruction instanceof Instruction.JumpIf i) {
				return "if (" + r(i.condition()) + ") goto L" + i.target() + ";";
			}
			if (instruction instanceof Instruction.Return i) {
				return i.value() == null ? "return;" : "return " + r(i.value()) + ";";
			}
			throw new CodeGenException("cannot generate " + instruction + " in " + function.name());
		}

		private static String literal(Type type, long value) {
			if (type == ScalarType.I32 && value == Integer.MIN_VALUE) {
				// -2147483648 would be the negation of an out-of-range constant
				return "(-2147483647 - 1)";
			}
			return Long.toString(value);
		}

		/**
		 * {@code i32} add, subtract, multiply and left shift wrap on overflow,
		 * so they go through unsigned arithmetic; dividing the minimum by -1
		 * wraps too. Shift counts are taken modulo the operand width.
		 */
		private String binary(Instruction.BinOp op) {
			String lhs = r(op.lhs());
			String rhs = r(op.rhs());
			MirBinaryOp kind = op.op();
			Type type = op.dest().type();
			boolean i32 = type == ScalarType.I32;
			if (i32 && kind == MirBinaryOp.DIV) {
				return "(" + rhs + " == -1 ? (int32_t) (0u - (uint32_t) " + lhs + ") : " + lhs + " / " + rhs + ")";
			}
			if (i32 && kind == MirBinaryOp.REM) {
				return "(" + rhs + " == -1 ? 0 : " + lhs + " % " + rhs + ")";
			}
			if (kind == MirBinaryOp.SHL || kind == MirBinaryOp.SHR) {
				String count = "(" + rhs + " & " + (i32 ? 31 : 7) + ")";
				if (i32 && kind == MirBinaryOp.SHL) {
					return "(int32_t) ((uint32_t) " + lhs + " << " + count + ")";
				}
				if (i32) {
					// arithmetic shift without relying on how C shifts negative values
					return "(" + lhs + " < 0 ? ~(~" + lhs + " >> " + count + ") : " + lhs + " >> " + count + ")";
				}
				return "(" + types.name(type) + ") (" + lhs + (kind == MirBinaryOp.SHL ? " << " : " >> ") + count + ")";
			}

			String symbol = switch (kind) {
				case ADD -> "+";
				case SUB -> "-";
				case MUL -> "*";
				case DIV -> "/";
				case REM -> "%";
				case BIT_AND -> "&";
				case BIT_OR -> "|";
				case BIT_XOR -> "^";
				case SHL -> "<<";
				case SHR -> ">>";
				case EQ -> "==";
				case NE -> "!=";
				case LT -> "<";
				case LE -> "<=";
				case GT -> ">";
				case GE -> ">=";
			};
			if (kind.isComparison()) {
				return lhs + " " + symbol + " " + rhs;
			}
			boolean wraps = kind == MirBinaryOp.ADD || kind == MirBinaryOp.SUB || kind == MirBinaryOp.MUL;
			if (i32 && wraps) {
				return "(int32_t) ((uint32_t) " + lhs + " " + symbol + " (uint32_t) " + rhs + ")";
			}
			return "(" + types.name(type) + ") (" + lhs + " " + symbol + " " + rhs + ")";
		}

		private String unary(Instruction.UnOp op) {
			return switch (op.op()) {
				case NEG -> "(int32_t) (0u - (uint32_t) " + r(op.operand()) + ")";
				case NOT -> "!" + r(op.operand());
			};
		}

		private static String call(Register dest, String callee, List<Register> args) {
			String call = callee + "(" + args.stream().map(FunctionEmitter::r).collect(Collectors.joining(", "))
					+ ");";
			return dest == null ? call : registerName(dest) + " = " + call;
		}

		private static String assign(Register dest, String value) {
			return registerName(dest) + " = " + value + ";";
		}

		private static String r(Register register) {
			return registerName(register);
		}
	}
}
