package contractus.semantic;

import contractus.types.Type;

/**
 * The value of a top-level constant. {@code value} holds an {@code i32} as its
 * signed value, a {@code u8} in 0..255 and a {@code bool} as 0 or 1.
 */
public record Constant(String name, Type type, long value) {
}
