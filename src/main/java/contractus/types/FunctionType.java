package contractus.types;

import java.util.List;
import java.util.stream.Collectors;

public record FunctionType(List<Type> params, Type returnType) implements Type {
	public FunctionType {
		params = List.copyOf(params);
	}

	@Override
	public String toString() {
		return "fn(" + params.stream().map(Type::toString).collect(Collectors.joining(", ")) + ") -> " + returnType;
	}
}
