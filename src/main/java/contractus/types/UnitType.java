package contractus.types;

public record UnitType() implements Type {
	public static final UnitType INSTANCE = new UnitType();

	@Override
	public String toString() {
		return "()";
	}
}
