package contractus.types;

/**
 * Type of {@code a..b}. Only valid as a for-loop iterable or as an index.
 */
public record RangeType(Type element) implements Type {
	@Override
	public String toString() {
		return "Range<" + element + ">";
	}
}
