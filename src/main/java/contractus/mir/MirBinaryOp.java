package contractus.mir;

public enum MirBinaryOp {
	ADD("add"),
	SUB("sub"),
	MUL("mul"),
	DIV("div"),
	REM("rem"),
	BIT_AND("and"),
	BIT_OR("or"),
	BIT_XOR("xor"),
	SHL("shl"),
	SHR("shr"),
	EQ("eq"),
	NE("ne"),
	LT("lt"),
	LE("le"),
	GT("gt"),
	GE("ge");

	private final String mnemonic;

	MirBinaryOp(String mnemonic) {
		this.mnemonic = mnemonic;
	}

	public String mnemonic() {
		return mnemonic;
	}

	public boolean isComparison() {
		return ordinal() >= EQ.ordinal();
	}
}
