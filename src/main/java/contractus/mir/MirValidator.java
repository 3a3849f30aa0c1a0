package contractus.mir;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks the code generator relies on: every register that is
 * read has a definition, no register is defined twice, every register
 * belongs to its function and every jump target names a label.
 */
public final class MirValidator {
	/**
	 * Returns one message per violation; an empty list means the program is
	 * well formed.
	 */
	public List<String> validate(MirProgram program) {
		List<String> problems = new ArrayList<>();
		for (MirFunction function : program.functions()) {
			validate(function, problems);
		}
		return problems;
	}

	private void validate(MirFunction function, List<String> problems) {
		String where = "in " + function.name() + ": ";
		Set<Register> known = new HashSet<>(function.registers());
		Set<Register> defined = new HashSet<>();
		for (Register param : function.params()) {
			if (!defined.add(param)) {
				problems.add(where + "parameter " + param + " is listed twice");
			}
		}

		Set<Integer> labels = new HashSet<>();
		for (Instruction instruction : function.instructions()) {
			if (instruction instanceof Instruction.Label label && !labels.add(label.id())) {
				problems.add(where + "label L" + label.id() + " is placed twice");
			}
			Register dest = instruction.defined();
			if (dest != null && !defined.add(dest)) {
				problems.add(where + "register " + dest + " is defined more than once");
			}
		}

		for (Instruction instruction : function.instructions()) {
			List<Register> operands = new ArrayList<>(instruction.uses());
			if (instruction.defined() != null) {
				operands.add(instruction.defined());
			}
			for (Register register : operands) {
				if (!known.contains(register)) {
					problems.add(where + "register " + register + " is not declared by the function");
				}
			}
			for (Register used : instruction.uses()) {
				if (!defined.contains(used)) {
					problems.add(where + "register " + used + " is used but never defined");
				}
			}
			int target = jumpTarget(instruction);
			if (target >= 0 && !labels.contains(target)) {
				problems.add(where + "jump to missing label L" + target);
			}
		}
	}

	private static int jumpTarget(Instruction instruction) {
		if (instruction instanceof Instruction.Jump jump) {
			return jump.target();
		}
		if (instruction instanceof Instruction.JumpIf jumpIf) {
			return jumpIf.target();
		}
		return -1;
	}
}
