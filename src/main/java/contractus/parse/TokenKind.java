package contractus.parse;

import java.util.Map;

public enum TokenKind {
	INT_LITERAL("integer literal"),
	IDENT("identifier"),

	// keywords
	FN("'fn'"),
	STRUCT("'struct'"),
	LET("'let'"),
	MUT("'mut'"),
	RETURN("'return'"),
	IF("'if'"),
	ELSE("'else'"),
	WHILE("'while'"),
	FOR("'for'"),
	IN("'in'"),
	BREAK("'break'"),
	CONTINUE("'continue'"),
	TRUE("'true'"),
	FALSE("'false'"),
	AS("'as'"),
	CONST("'const'"),

	// operators
	PLUS("'+'"),
	MINUS("'-'"),
	STAR("'*'"),
	SLASH("'/'"),
	PERCENT("'%'"),
	ASSIGN("'='"),
	PLUS_ASSIGN("'+='"),
	MINUS_ASSIGN("'-='"),
	STAR_ASSIGN("'*='"),
	SLASH_ASSIGN("'/='"),
	PERCENT_ASSIGN("'%='"),
	EQ("'=='"),
	NE("'!='"),
	LT("'<'"),
	LE("'<='"),
	GT("'>'"),
	GE("'>='"),
	AND_AND("'&&'"),
	OR_OR("'||'"),
	BANG("'!'"),
	AMP("'&'"),
	PIPE("'|'"),
	CARET("'^'"),
	SHL("'<<'"),
	SHR("'>>'"),
	DOT_DOT("'..'"),
	DOT_DOT_EQ("'..='"),
	ARROW("'->'"),

	// delimiters
	LPAREN("'('"),
	RPAREN("')'"),
	LBRACE("'{'"),
	RBRACE("'}'"),
	LBRACKET("'['"),
	RBRACKET("']'"),
	SEMICOLON("';'"),
	COLON("':'"),
	COMMA("','"),
	DOT("'.'"),

	ERROR("invalid character"),
	EOF("end of input");

	static final Map<String, TokenKind> KEYWORDS = Map.ofEntries(
			Map.entry("fn", FN),
			Map.entry("struct", STRUCT),
			Map.entry("let", LET),
			Map.entry("mut", MUT),
			Map.entry("return", RETURN),
			Map.entry("if", IF),
			Map.entry("else", ELSE),
			Map.entry("while", WHILE),
			Map.entry("for", FOR),
			Map.entry("in", IN),
			Map.entry("break", BREAK),
			Map.entry("continue", CONTINUE),
			Map.entry("true", TRUE),
			Map.entry("false", FALSE),
			Map.entry("as", AS),
			Map.entry("const", CONST));

	private final String description;

	TokenKind(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}
