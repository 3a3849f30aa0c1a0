package contractus.types;

public record ArrayType(Type element, int length) implements Type {
	@Override
	public String toString() {
		return "[" + element + "; " + length + "]";
	}
}
