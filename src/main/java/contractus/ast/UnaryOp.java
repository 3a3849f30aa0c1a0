package contractus.ast;

public enum UnaryOp {
	NEG("-"),
	NOT("!"),
	DEREF("*"),
	ADDRESS_OF("&");

	private final String symbol;

	UnaryOp(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}
}
