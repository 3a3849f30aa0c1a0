package contractus.types;

/**
 * Unsized view over consecutive elements. Represented at run time as
 * {@code {element pointer, i32 length}}.
 */
public record SliceType(Type element) implements Type {
	@Override
	public String toString() {
		return "[" + element + "]";
	}
}
