package contractus.ast;

/**
 * Source span for diagnostics.
 *
 * Offsets are 0-based character indices into the source text; line
 * and column are 1-based and describe the first character of the span.
 */
public record Span(int start, int end, int line, int column) {
	public static final Span NONE = new Span(-1, -1, 0, 0);

	/**
	 * Smallest span covering both this span and {@code other}.
	 */
	public Span to(Span other) {
		if (this == NONE) {
			return other;
		}
		if (other == NONE) {
			return this;
		}
		if (other.start < start) {
			return new Span(other.start, Math.max(end, other.end), other.line, other.column);
		}
		return new Span(start, Math.max(end, other.end), line, column);
	}

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
