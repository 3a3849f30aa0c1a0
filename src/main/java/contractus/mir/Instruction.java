package contractus.mir;

import contractus.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed MIR instruction set. Control flow is expressed with labels and
 * jumps; every other instruction defines at most one register.
 */
public sealed interface Instruction {
	/**
	 * Register written by this instruction, or null.
	 */
	default Register defined() {
		return null;
	}

	/**
	 * Registers read by this instruction, in operand order.
	 */
	List<Register> uses();

	record Const(Register dest, long value) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of();
		}
	}

	record BinOp(Register dest, MirBinaryOp op, Register lhs, Register rhs) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of(lhs, rhs);
		}
	}

	record UnOp(Register dest, MirUnaryOp op, Register operand) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of(operand);
		}
	}

	/**
	 * Integer conversion to the destination register's type.
	 */
	record Cast(Register dest, Register operand) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of(operand);
		}
	}

	/**
	 * Reserves a stack slot of {@code slotType}; {@code dest} points at it.
	 */
	record Alloc(Register dest, Type slotType) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of();
		}
	}

	record Load(Register dest, Register address) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of(address);
		}
	}

	record Store(Register address, Register value) implements Instruction {
		@Override
		public List<Register> uses() {
			return List.of(address, value);
		}
	}

	/**
	 * Address of a field, {@code offset} bytes past the struct pointer.
	 */
	record GetFieldPtr(Register dest, Register base, String field, int offset) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of(base);
		}
	}

	/**
	 * Address of element {@code index}, {@code index * stride} bytes past the
	 * base. The base is a pointer to an array or element, or a slice whose
	 * element pointer is used.
	 */
	record GetElementPtr(Register dest, Register base, Register index, int stride) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of(base, index);
		}
	}

	record MakeSlice(Register dest, Register elements, Register length) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of(elements, length);
		}
	}

	record SliceLen(Register dest, Register slice) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of(slice);
		}
	}

	record FuncRef(Register dest, String function) implements Instruction {
		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return List.of();
		}
	}

	/**
	 * Direct call. {@code dest} is null for unit-returning callees;
	 * {@code builtin} marks runtime preamble functions.
	 */
	record Call(Register dest, String function, List<Register> args, boolean builtin) implements Instruction {
		public Call {
			args = List.copyOf(args);
		}

		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			return args;
		}
	}

	record CallIndirect(Register dest, Register callee, List<Register> args) implements Instruction {
		public CallIndirect {
			args = List.copyOf(args);
		}

		@Override
		public Register defined() {
			return dest;
		}

		@Override
		public List<Register> uses() {
			List<Register> uses = new ArrayList<>();
			uses.add(callee);
			uses.addAll(args);
			return uses;
		}
	}

	record Label(int id) implements Instruction {
		@Override
		public List<Register> uses() {
			return List.of();
		}
	}

	record Jump(int target) implements Instruction {
		@Override
		public List<Register> uses() {
			return List.of();
		}
	}

	/**
	 * Jumps to {@code target} when {@code condition} is true, falls through
	 * otherwise.
	 */
	record JumpIf(Register condition, int target) implements Instruction {
		@Override
		public List<Register> uses() {
			return List.of(condition);
		}
	}

	/**
	 * Returns {@code value}, or nothing when it is null.
	 */
	record Return(Register value) implements Instruction {
		@Override
		public List<Register> uses() {
			return value == null ? List.of() : List.of(value);
		}
	}
}
