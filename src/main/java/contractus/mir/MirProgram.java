package contractus.mir;

import com.google.common.collect.ImmutableList;

import java.util.Optional;

public record MirProgram(ImmutableList<MirStruct> structs, ImmutableList<MirFunction> functions) {
	public Optional<MirFunction> function(String name) {
		return functions.stream().filter(f -> f.name().equals(name)).findFirst();
	}
}
