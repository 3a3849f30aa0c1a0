package contractus.mir;

import contractus.types.Type;

/**
 * Typed virtual register, unique by id within its function.
 */
public record Register(int id, Type type) {
	@Override
	public String toString() {
		return "%" + id;
	}
}
