package contractus.mir;

import com.google.common.collect.ImmutableList;
import contractus.types.Type;

/**
 * One lowered function. {@code registers} lists every register the body uses,
 * parameters first, in id order.
 */
public record MirFunction(
		String name,
		ImmutableList<Register> params,
		Type returnType,
		ImmutableList<Register> registers,
		ImmutableList<Instruction> instructions) {
}
