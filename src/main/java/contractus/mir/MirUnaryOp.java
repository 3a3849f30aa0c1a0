package contractus.mir;

public enum MirUnaryOp {
	NEG("neg"),
	NOT("not");

	private final String mnemonic;

	MirUnaryOp(String mnemonic) {
		this.mnemonic = mnemonic;
	}

	public String mnemonic() {
		return mnemonic;
	}
}
