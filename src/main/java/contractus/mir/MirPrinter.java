package contractus.mir;

import contractus.semantic.FieldLayout;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Human-readable MIR listing, used by {@code --emit-mir} and in test failure
 * messages.
 */
public final class MirPrinter {
	public String print(MirProgram program) {
		StringBuilder out = new StringBuilder();
		for (MirStruct struct : program.structs()) {
			out.append("struct ").append(struct.name())
					.append(" size ").append(struct.size())
					.append(" align ").append(struct.alignment())
					.append(" {\n");
			for (FieldLayout field : struct.fields()) {
				out.append("  ").append(field.offset()).append(": ")
						.append(field.name()).append(' ').append(field.type()).append('\n');
			}
			out.append("}\n\n");
		}
		for (MirFunction function : program.functions()) {
			out.append(print(function)).append('\n');
		}
		return out.toString();
	}

	public String print(MirFunction function) {
		StringBuilder out = new StringBuilder();
		out.append("fn ").append(function.name()).append('(')
				.append(function.params().stream()
						.map(p -> p + ": " + p.type())
						.collect(Collectors.joining(", ")))
				.append(") -> ").append(function.returnType()).append(" {\n");
		for (Instruction instruction : function.instructions()) {
			if (instruction instanceof Instruction.Label) {
				out.append(print(instruction)).append('\n');
			} else {
				out.append("  ").append(print(instruction)).append('\n');
			}
		}
		return out.append("}\n").toString();
	}

	public String print(Instruction instruction) {
		if (instruction instanceof Instruction.Const i) {
			return def(i.dest()) + "const " + i.value();
		}
		if (instruction instanceof Instruction.BinOp i) {
			return def(i.dest()) + i.op().mnemonic() + " " + i.lhs() + ", " + i.rhs();
		}
		if (instruction instanceof Instruction.UnOp i) {
			return def(i.dest()) + i.op().mnemonic() + " " + i.operand();
		}
		if (instruction instanceof Instruction.Cast i) {
			return def(i.dest()) + "cast " + i.operand();
		}
		if (instruction instanceof Instruction.Alloc i) {
			return def(i.dest()) + "alloc " + i.slotType();
		}
		if (instruction instanceof Instruction.Load i) {
			return def(i.dest()) + "load " + i.address();
		}
		if (instruction instanceof Instruction.Store i) {
			return "store " + i.address() + ", " + i.value();
		}
		if (instruction instanceof Instruction.GetFieldPtr i) {
			return def(i.dest()) + "field " + i.base() + "." + i.field() + " +" + i.offset();
		}
		if (instruction instanceof Instruction.GetElementPtr i) {
			return def(i.dest()) + "element " + i.base() + "[" + i.index() + "] *" + i.stride();
		}
		if (instruction instanceof Instruction.MakeSlice i) {
			return def(i.dest()) + "slice " + i.elements() + ", " + i.length();
		}
		if (instruction instanceof Instruction.SliceLen i) {
			return def(i.dest()) + "len " + i.slice();
		}
		if (instruction instanceof Instruction.FuncRef i) {
			return def(i.dest()) + "fnref " + i.function();
		}
		if (instruction instanceof Instruction.Call i) {
			String call = i.builtin() ? "call builtin " : "call ";
			return def(i.dest()) + call + i.function() + "(" + join(i.args()) + ")";
		}
		if (instruction instanceof Instruction.CallIndirect i) {
			return def(i.dest()) + "call " + i.callee() + "(" + join(i.args()) + ")";
		}
		if (instruction instanceof Instruction.Label i) {
			return "L" + i.id() + ":";
		}
		if (instruction instanceof Instruction.Jump i) {
			return "jump L" + i.target();
		}
		if (instruction instanceof Instruction.JumpIf i) {
			return "jumpif " + i.condition() + ", L" + i.target();
		}
		if (instruction instanceof Instruction.Return i) {
			return i.value() == null ? "ret" : "ret " + i.value();
		}
		throw new IllegalArgumentException("unknown instruction " + instruction);
	}

	private static String def(Register dest) {
		return dest == null ? "" : dest + ": " + dest.type() + " = ";
	}

	private static String join(List<Register> registers) {
		return registers.stream().map(Register::toString).collect(Collectors.joining(", "));
	}
}
