package contractus.types;

public enum ScalarType implements Type {
	I32("i32"),
	BOOL("bool"),
	U8("u8");

	private final String keyword;

	ScalarType(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}

	public static ScalarType fromKeyword(String name) {
		for (ScalarType t : values()) {
			if (t.keyword.equals(name)) {
				return t;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return keyword;
	}
}
