package contractus.types;

public record PointerType(Type pointee) implements Type {
	@Override
	public String toString() {
		return "*" + pointee;
	}
}
