package contractus.mir;

import com.google.common.collect.ImmutableList;
import contractus.ast.FunctionDef;
import contractus.semantic.TypedProgram;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lowers a checked program to MIR. Only error-free programs may be lowered;
 * each function gets its own {@link FunctionLowering} so no naming state is
 * shared between functions or between invocations.
 */
public final class MirBuilder {
	private static final Logger LOGGER = Logger.getLogger(MirBuilder.class.getName());

	public MirProgram lower(TypedProgram program) {
		ImmutableList<MirStruct> structs = program.layouts().layouts().values().stream()
				.map(MirStruct::of)
				.collect(ImmutableList.toImmutableList());

		ImmutableList.Builder<MirFunction> functions = ImmutableList.builder();
		for (FunctionDef function : program.program().functions()) {
			MirFunction lowered = new FunctionLowering(program, function).lower();
			if (LOGGER.isLoggable(Level.FINE)) {
				LOGGER.fine("lowered " + function.name() + ": " + lowered.instructions().size() + " instructions, "
						+ lowered.registers().size() + " registers");
			}
			functions.add(lowered);
		}
		return new MirProgram(structs, functions.build());
	}
}
