package contractus.ast;

public enum BinaryOp {
	ADD("+"),
	SUB("-"),
	MUL("*"),
	DIV("/"),
	REM("%"),
	EQ("=="),
	NE("!="),
	LT("<"),
	LE("<="),
	GT(">"),
	GE(">="),
	BIT_AND("&"),
	BIT_OR("|"),
	BIT_XOR("^"),
	SHL("<<"),
	SHR(">>"),
	AND("&&"),
	OR("||");

	private final String symbol;

	BinaryOp(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public boolean isArithmetic() {
		return this == ADD || this == SUB || this == MUL || this == DIV || this == REM;
	}

	/**
	 * {@code & | ^} and the shifts. Shifts apply to integers only; the others
	 * also combine two {@code bool} values without short-circuiting.
	 */
	public boolean isBitwise() {
		return this == BIT_AND || this == BIT_OR || this == BIT_XOR || isShift();
	}

	public boolean isShift() {
		return this == SHL || this == SHR;
	}

	public boolean isEquality() {
		return this == EQ || this == NE;
	}

	public boolean isOrdering() {
		return this == LT || this == LE || this == GT || this == GE;
	}

	public boolean isLogical() {
		return this == AND || this == OR;
	}
}
