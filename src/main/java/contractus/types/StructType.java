package contractus.types;

/**
 * Nominal reference to a struct; its fields live in the layout table.
 */
public record StructType(String name) implements Type {
	@Override
	public String toString() {
		return name;
	}
}
