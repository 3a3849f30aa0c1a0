package contractus.parse;

import contractus.ast.ArrayLiteral;
import contractus.ast.ArrayTypeRef;
import contractus.ast.AssignExpr;
import contractus.ast.BinaryExpr;
import contractus.ast.BinaryOp;
import contractus.ast.Block;
import contractus.ast.BlockStmt;
import contractus.ast.BoolLiteral;
import contractus.ast.BreakStmt;
import contractus.ast.CallExpr;
import contractus.ast.CastExpr;
import contractus.ast.ConstDef;
import contractus.ast.ContinueStmt;
import contractus.ast.Expr;
import contractus.ast.ExprStmt;
import contractus.ast.FieldDef;
import contractus.ast.FieldExpr;
import contractus.ast.FieldInit;
import contractus.ast.ForStmt;
import contractus.ast.FunctionDef;
import contractus.ast.FunctionTypeRef;
import contractus.ast.IfStmt;
import contractus.ast.IndexExpr;
import contractus.ast.IntLiteral;
import contractus.ast.Item;
import contractus.ast.LetStmt;
import contractus.ast.NameExpr;
import contractus.ast.NamedTypeRef;
import contractus.ast.Param;
import contractus.ast.PointerTypeRef;
import contractus.ast.Program;
import contractus.ast.RangeExpr;
import contractus.ast.RepeatArrayLiteral;
import contractus.ast.ReturnStmt;
import contractus.ast.SliceTypeRef;
import contractus.ast.Span;
import contractus.ast.Stmt;
import contractus.ast.StructDef;
import contractus.ast.StructLiteral;
import contractus.ast.TypeRef;
import contractus.ast.UnaryExpr;
import contractus.ast.UnaryOp;
import contractus.ast.UnitTypeRef;
import contractus.ast.WhileStmt;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for declarations and statements, with precedence
 * climbing for expressions.
 *
 * Binding order, loosest to tightest: assignment (right-associative), ||, &&,
 * equality, comparison, range (non-associative), |, ^, &, shifts, additive,
 * multiplicative, cast, unary, postfix, primary.
 *
 * Errors never abort the parse. A broken statement is reported once and
 * dropped, and parsing resumes at the next statement boundary.
 */
public final class Parser {
	private static final int ASSIGNMENT = 1;
	private static final int LOGICAL_OR = 2;
	private static final int LOGICAL_AND = 3;
	private static final int EQUALITY = 4;
	private static final int COMPARISON = 5;
	private static final int RANGE = 6;
	private static final int BIT_OR = 7;
	private static final int BIT_XOR = 8;
	private static final int BIT_AND = 9;
	private static final int SHIFT = 10;
	private static final int ADDITIVE = 11;
	private static final int MULTIPLICATIVE = 12;
	private static final int CAST = 13;

	private Cursor c;
	private List<ParseError> errors;
	private int loopDepth;
	private boolean structLiteralAllowed;

	public ParseResult parse(List<Token> tokens) {
		this.c = new Cursor(withEof(tokens));
		this.errors = new ArrayList<>();
		this.loopDepth = 0;
		this.structLiteralAllowed = true;

		Span start = c.peek().span();
		List<Item> items = new ArrayList<>();
		while (!c.isAtEnd()) {
			int itemStart = c.position();
			try {
				items.add(parseItem());
			} catch (ParseFailure failure) {
				errors.add(failure.error);
				synchronizeItem(itemStart);
			}
		}

		Span span = items.isEmpty() ? start : start.to(items.get(items.size() - 1).span());
		return new ParseResult(new Program(List.copyOf(items), span), errors);
	}

	private static List<Token> withEof(List<Token> tokens) {
		if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() == TokenKind.EOF) {
			return tokens;
		}
		List<Token> copy = new ArrayList<>(tokens);
		Span last = tokens.isEmpty() ? new Span(0, 0, 1, 1) : tokens.get(tokens.size() - 1).span();
		copy.add(new Token(TokenKind.EOF, "", new Span(last.end(), last.end(), last.line(), last.column())));
		return copy;
	}

	// ---------------------------------------------------------------- items

	private Item parseItem() {
		if (c.check(TokenKind.FN)) {
			return parseFunction();
		}
		if (c.check(TokenKind.STRUCT)) {
			return parseStruct();
		}
		if (c.check(TokenKind.CONST)) {
			return parseConst();
		}
		throw failure("'fn', 'struct' or 'const'");
	}

	private ConstDef parseConst() {
		Token start = c.expect(TokenKind.CONST);
		Token name = c.expect(TokenKind.IDENT);
		c.expect(TokenKind.COLON);
		TypeRef type = parseType();
		c.expect(TokenKind.ASSIGN);
		Expr value = parseExpression();
		Token end = c.expect(TokenKind.SEMICOLON);
		return new ConstDef(name.lexeme(), type, value, start.span().to(end.span()));
	}

	private FunctionDef parseFunction() {
		Token start = c.expect(TokenKind.FN);
		Token name = c.expect(TokenKind.IDENT);
		c.expect(TokenKind.LPAREN);

		List<Param> params = new ArrayList<>();
		while (!c.check(TokenKind.RPAREN)) {
			Token paramStart = c.peek();
			boolean mutable = c.match(TokenKind.MUT);
			Token paramName = c.expect(TokenKind.IDENT);
			c.expect(TokenKind.COLON);
			TypeRef type = parseType();
			params.add(new Param(paramName.lexeme(), mutable, type, paramStart.span().to(type.span())));
			if (!c.match(TokenKind.COMMA)) {
				break;
			}
		}
		c.expect(TokenKind.RPAREN);

		TypeRef returnType = null;
		if (c.match(TokenKind.ARROW)) {
			returnType = parseType();
		}

		Block body = parseBlock();
		return new FunctionDef(name.lexeme(), List.copyOf(params), returnType, body, start.span().to(body.span()));
	}

	private StructDef parseStruct() {
		Token start = c.expect(TokenKind.STRUCT);
		Token name = c.expect(TokenKind.IDENT);
		c.expect(TokenKind.LBRACE);

		List<FieldDef> fields = new ArrayList<>();
		while (!c.check(TokenKind.RBRACE)) {
			Token fieldName = c.expect(TokenKind.IDENT);
			c.expect(TokenKind.COLON);
			TypeRef type = parseType();
			fields.add(new FieldDef(fieldName.lexeme(), type, fieldName.span().to(type.span())));
			if (!c.match(TokenKind.COMMA)) {
				break;
			}
		}
		Token end = c.expect(TokenKind.RBRACE);
		return new StructDef(name.lexeme(), List.copyOf(fields), start.span().to(end.span()));
	}

	// ---------------------------------------------------------------- types

	private TypeRef parseType() {
		Token t = c.peek();
		switch (t.kind()) {
			case IDENT:
				c.next();
				return new NamedTypeRef(t.lexeme(), t.span());
			case LBRACKET: {
				c.next();
				TypeRef element = parseType();
				if (c.match(TokenKind.SEMICOLON)) {
					Token length = c.expect(TokenKind.INT_LITERAL);
					int n = parseLength(length);
					Token end = c.expect(TokenKind.RBRACKET);
					return new ArrayTypeRef(element, n, t.span().to(end.span()));
				}
				Token end = c.expect(TokenKind.RBRACKET);
				return new SliceTypeRef(element, t.span().to(end.span()));
			}
			case STAR: {
				c.next();
				c.match(TokenKind.MUT);
				TypeRef pointee = parseType();
				return new PointerTypeRef(pointee, t.span().to(pointee.span()));
			}
			case FN: {
				c.next();
				c.expect(TokenKind.LPAREN);
				List<TypeRef> params = new ArrayList<>();
				while (!c.check(TokenKind.RPAREN)) {
					params.add(parseType());
					if (!c.match(TokenKind.COMMA)) {
						break;
					}
				}
				Token close = c.expect(TokenKind.RPAREN);
				TypeRef returnType = c.match(TokenKind.ARROW) ? parseType() : new UnitTypeRef(close.span());
				return new FunctionTypeRef(List.copyOf(params), returnType, t.span().to(c.previous().span()));
			}
			case LPAREN: {
				c.next();
				Token end = c.expect(TokenKind.RPAREN);
				return new UnitTypeRef(t.span().to(end.span()));
			}
			default:
				throw failure("type");
		}
	}

	private int parseLength(Token literal) {
		try {
			return Integer.parseInt(literal.lexeme());
		} catch (NumberFormatException e) {
			throw new ParseFailure(new ParseError(literal.span(), "array length that fits in i32", literal.describe()));
		}
	}

	// ----------------------------------------------------------- statements

	private Block parseBlock() {
		Token open = c.expect(TokenKind.LBRACE);
		List<Stmt> stmts = new ArrayList<>();
		while (!c.check(TokenKind.RBRACE)) {
			if (c.isAtEnd() || c.check(TokenKind.FN) || c.check(TokenKind.STRUCT)) {
				// the block was never closed; give up on the whole item
				throw new ParseFailure(new ParseError(c.peek().span(), TokenKind.RBRACE.description(),
						c.peek().describe()), true);
			}
			int stmtStart = c.position();
			try {
				stmts.add(parseStatement());
			} catch (ParseFailure failure) {
				if (failure.unterminatedBlock) {
					throw failure;
				}
				errors.add(failure.error);
				synchronizeStatement(stmtStart);
			}
		}
		Token close = c.next();
		return new Block(List.copyOf(stmts), open.span().to(close.span()));
	}

	private Stmt parseStatement() {
		return switch (c.peek().kind()) {
			case LET -> parseLet();
			case RETURN -> parseReturn();
			case IF -> parseIf();
			case WHILE -> parseWhile();
			case FOR -> parseFor();
			case BREAK -> parseBreak();
			case CONTINUE -> parseContinue();
			case LBRACE -> {
				Block block = parseBlock();
				yield new BlockStmt(block, block.span());
			}
			default -> {
				Expr expr = parseExpression();
				Token semi = c.expect(TokenKind.SEMICOLON);
				yield new ExprStmt(expr, expr.span().to(semi.span()));
			}
		};
	}

	private LetStmt parseLet() {
		Token start = c.expect(TokenKind.LET);
		boolean mutable = c.match(TokenKind.MUT);
		Token name = c.expect(TokenKind.IDENT);

		TypeRef type = null;
		if (c.match(TokenKind.COLON)) {
			type = parseType();
		}
		Expr init = null;
		if (c.match(TokenKind.ASSIGN)) {
			init = parseExpression();
		}
		if (type == null && init == null) {
			throw failure("':' or '='");
		}
		Token end = c.expect(TokenKind.SEMICOLON);
		return new LetStmt(name.lexeme(), mutable, type, init, start.span().to(end.span()));
	}

	private ReturnStmt parseReturn() {
		Token start = c.expect(TokenKind.RETURN);
		Expr value = c.check(TokenKind.SEMICOLON) ? null : parseExpression();
		Token end = c.expect(TokenKind.SEMICOLON);
		return new ReturnStmt(value, start.span().to(end.span()));
	}

	private IfStmt parseIf() {
		Token start = c.expect(TokenKind.IF);
		Expr condition = withoutStructLiterals(this::parseExpression);
		Block thenBlock = parseBlock();

		Block elseBlock = null;
		if (c.match(TokenKind.ELSE)) {
			if (c.check(TokenKind.IF)) {
				IfStmt nested = parseIf();
				elseBlock = new Block(List.of(nested), nested.span());
			} else {
				elseBlock = parseBlock();
			}
		}
		return new IfStmt(condition, thenBlock, elseBlock, start.span().to(c.previous().span()));
	}

	private WhileStmt parseWhile() {
		Token start = c.expect(TokenKind.WHILE);
		Expr condition = withoutStructLiterals(this::parseExpression);
		Block body = parseLoopBody();
		return new WhileStmt(condition, body, start.span().to(body.span()));
	}

	private ForStmt parseFor() {
		Token start = c.expect(TokenKind.FOR);
		boolean mutable = c.match(TokenKind.MUT);
		Token variable = c.expect(TokenKind.IDENT);
		c.expect(TokenKind.IN);
		Expr iterable = withoutStructLiterals(this::parseExpression);
		Block body = parseLoopBody();
		return new ForStmt(variable.lexeme(), mutable, iterable, body, start.span().to(body.span()));
	}

	private Block parseLoopBody() {
		loopDepth++;
		try {
			return parseBlock();
		} finally {
			loopDepth--;
		}
	}

	private BreakStmt parseBreak() {
		if (loopDepth == 0) {
			throw failure("'break' inside a loop");
		}
		Token start = c.expect(TokenKind.BREAK);
		Token end = c.expect(TokenKind.SEMICOLON);
		return new BreakStmt(start.span().to(end.span()));
	}

	private ContinueStmt parseContinue() {
		if (loopDepth == 0) {
			throw failure("'continue' inside a loop");
		}
		Token start = c.expect(TokenKind.CONTINUE);
		Token end = c.expect(TokenKind.SEMICOLON);
		return new ContinueStmt(start.span().to(end.span()));
	}

	// ---------------------------------------------------------- expressions

	private Expr parseExpression() {
		return parseBinary(ASSIGNMENT);
	}

	private Expr parseBinary(int minPrecedence) {
		Expr left = parseUnary();
		while (true) {
			Token op = c.peek();
			int precedence = infixPrecedence(op.kind());
			if (precedence == 0 || precedence < minPrecedence) {
				return left;
			}
			c.next();

			if (precedence == ASSIGNMENT) {
				Expr value = parseBinary(ASSIGNMENT);
				left = new AssignExpr(left, compoundOperator(op.kind()), value, left.span().to(value.span()));
			} else if (precedence == RANGE) {
				if (left instanceof RangeExpr) {
					throw new ParseFailure(new ParseError(op.span(), "at most one range per expression", op.describe()));
				}
				Expr end = parseBinary(RANGE + 1);
				left = new RangeExpr(left, end, op.kind() == TokenKind.DOT_DOT_EQ, left.span().to(end.span()));
			} else if (precedence == CAST) {
				TypeRef type = parseType();
				left = new CastExpr(left, type, left.span().to(type.span()));
			} else {
				Expr right = parseBinary(precedence + 1);
				left = new BinaryExpr(binaryOperator(op.kind()), left, right, left.span().to(right.span()));
			}
		}
	}

	private static int infixPrecedence(TokenKind kind) {
		return switch (kind) {
			case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN -> ASSIGNMENT;
			case OR_OR -> LOGICAL_OR;
			case AND_AND -> LOGICAL_AND;
			case EQ, NE -> EQUALITY;
			case LT, LE, GT, GE -> COMPARISON;
			case DOT_DOT, DOT_DOT_EQ -> RANGE;
			case PIPE -> BIT_OR;
			case CARET -> BIT_XOR;
			case AMP -> BIT_AND;
			case SHL, SHR -> SHIFT;
			case PLUS, MINUS -> ADDITIVE;
			case STAR, SLASH, PERCENT -> MULTIPLICATIVE;
			case AS -> CAST;
			default -> 0;
		};
	}

	private static BinaryOp binaryOperator(TokenKind kind) {
		return switch (kind) {
			case OR_OR -> BinaryOp.OR;
			case AND_AND -> BinaryOp.AND;
			case EQ -> BinaryOp.EQ;
			case NE -> BinaryOp.NE;
			case LT -> BinaryOp.LT;
			case LE -> BinaryOp.LE;
			case GT -> BinaryOp.GT;
			case GE -> BinaryOp.GE;
			case PLUS -> BinaryOp.ADD;
			case MINUS -> BinaryOp.SUB;
			case STAR -> BinaryOp.MUL;
			case SLASH -> BinaryOp.DIV;
			case PERCENT -> BinaryOp.REM;
			case PIPE -> BinaryOp.BIT_OR;
			case CARET -> BinaryOp.BIT_XOR;
			case AMP -> BinaryOp.BIT_AND;
			case SHL -> BinaryOp.SHL;
			case SHR -> BinaryOp.SHR;
			default -> throw new IllegalArgumentException("not a binary operator: " + kind);
		};
	}

	private static BinaryOp compoundOperator(TokenKind kind) {
		return switch (kind) {
			case PLUS_ASSIGN -> BinaryOp.ADD;
			case MINUS_ASSIGN -> BinaryOp.SUB;
			case STAR_ASSIGN -> BinaryOp.MUL;
			case SLASH_ASSIGN -> BinaryOp.DIV;
			case PERCENT_ASSIGN -> BinaryOp.REM;
			default -> null;
		};
	}

	private Expr parseUnary() {
		Token t = c.peek();
		UnaryOp op = switch (t.kind()) {
			case MINUS -> UnaryOp.NEG;
			case BANG -> UnaryOp.NOT;
			case STAR -> UnaryOp.DEREF;
			case AMP -> UnaryOp.ADDRESS_OF;
			default -> null;
		};
		if (op == null) {
			return parsePostfix();
		}
		c.next();
		if (op == UnaryOp.ADDRESS_OF) {
			c.match(TokenKind.MUT);
		}
		Expr operand = parseUnary();
		return new UnaryExpr(op, operand, t.span().to(operand.span()));
	}

	private Expr parsePostfix() {
		Expr expr = parsePrimary();
		while (true) {
			if (c.match(TokenKind.DOT)) {
				Token field = c.expect(TokenKind.IDENT);
				expr = new FieldExpr(expr, field.lexeme(), expr.span().to(field.span()));
				continue;
			}
			if (c.match(TokenKind.LBRACKET)) {
				Expr index = withStructLiterals(this::parseExpression);
				Token end = c.expect(TokenKind.RBRACKET);
				expr = new IndexExpr(expr, index, expr.span().to(end.span()));
				continue;
			}
			return expr;
		}
	}

	private Expr parsePrimary() {
		Token t = c.peek();
		switch (t.kind()) {
			case INT_LITERAL:
				c.next();
				try {
					return new IntLiteral(Long.parseLong(t.lexeme()), t.span());
				} catch (NumberFormatException e) {
					throw new ParseFailure(new ParseError(t.span(), "integer literal that fits in 64 bits",
							t.describe()));
				}
			case TRUE:
			case FALSE:
				c.next();
				return new BoolLiteral(t.kind() == TokenKind.TRUE, t.span());
			case IDENT:
				c.next();
				if (c.check(TokenKind.LPAREN)) {
					return parseCall(t);
				}
				if (c.check(TokenKind.LBRACE) && structLiteralAllowed) {
					return parseStructLiteral(t);
				}
				return new NameExpr(t.lexeme(), t.span());
			case LPAREN: {
				c.next();
				Expr inner = withStructLiterals(this::parseExpression);
				c.expect(TokenKind.RPAREN);
				return inner;
			}
			case LBRACKET:
				return withStructLiterals(this::parseArrayLiteral);
			default:
				throw failure("expression");
		}
	}

	private CallExpr parseCall(Token callee) {
		c.expect(TokenKind.LPAREN);
		List<Expr> args = new ArrayList<>();
		while (!c.check(TokenKind.RPAREN)) {
			args.add(withStructLiterals(this::parseExpression));
			if (!c.match(TokenKind.COMMA)) {
				break;
			}
		}
		Token end = c.expect(TokenKind.RPAREN);
		return new CallExpr(callee.lexeme(), List.copyOf(args), callee.span().to(end.span()));
	}

	private StructLiteral parseStructLiteral(Token name) {
		c.expect(TokenKind.LBRACE);
		List<FieldInit> fields = new ArrayList<>();
		while (!c.check(TokenKind.RBRACE)) {
			Token field = c.expect(TokenKind.IDENT);
			Expr value;
			if (c.match(TokenKind.COLON)) {
				value = parseExpression();
			} else {
				// shorthand `Point { x, y }`
				value = new NameExpr(field.lexeme(), field.span());
			}
			fields.add(new FieldInit(field.lexeme(), value, field.span().to(value.span())));
			if (!c.match(TokenKind.COMMA)) {
				break;
			}
		}
		Token end = c.expect(TokenKind.RBRACE);
		return new StructLiteral(name.lexeme(), List.copyOf(fields), name.span().to(end.span()));
	}

	private Expr parseArrayLiteral() {
		Token open = c.expect(TokenKind.LBRACKET);
		List<Expr> elements = new ArrayList<>();
		if (!c.check(TokenKind.RBRACKET)) {
			Expr first = parseExpression();
			if (c.match(TokenKind.SEMICOLON)) {
				Token count = c.expect(TokenKind.INT_LITERAL);
				int n = parseLength(count);
				Token end = c.expect(TokenKind.RBRACKET);
				return new RepeatArrayLiteral(first, n, open.span().to(end.span()));
			}
			elements.add(first);
			while (c.match(TokenKind.COMMA) && !c.check(TokenKind.RBRACKET)) {
				elements.add(parseExpression());
			}
		}
		Token end = c.expect(TokenKind.RBRACKET);
		return new ArrayLiteral(List.copyOf(elements), open.span().to(end.span()));
	}

	private <T> T withoutStructLiterals(Supplier<T> body) {
		return withStructLiteralMode(false, body);
	}

	private <T> T withStructLiterals(Supplier<T> body) {
		return withStructLiteralMode(true, body);
	}

	private <T> T withStructLiteralMode(boolean allowed, Supplier<T> body) {
		boolean saved = structLiteralAllowed;
		structLiteralAllowed = allowed;
		try {
			return body.get();
		} finally {
			structLiteralAllowed = saved;
		}
	}

	// ------------------------------------------------------------- recovery

	/**
	 * Skips to the next statement boundary: after a ';', or before 'fn',
	 * 'struct', 'let', '}' or the end of input. Brace pairs opened while
	 * skipping are skipped whole.
	 */
	private void synchronizeStatement(int stmtStart) {
		if (c.position() == stmtStart && !c.isAtEnd()) {
			c.next();
			if (c.previous().kind() == TokenKind.SEMICOLON) {
				return;
			}
		}
		int depth = 0;
		while (!c.isAtEnd()) {
			TokenKind kind = c.peek().kind();
			if (kind == TokenKind.FN || kind == TokenKind.STRUCT) {
				return;
			}
			if (depth == 0 && (kind == TokenKind.LET || kind == TokenKind.RBRACE)) {
				return;
			}
			c.next();
			if (kind == TokenKind.LBRACE) {
				depth++;
			} else if (kind == TokenKind.RBRACE) {
				depth--;
			} else if (kind == TokenKind.SEMICOLON && depth == 0) {
				return;
			}
		}
	}

	private void synchronizeItem(int itemStart) {
		if (c.position() == itemStart && !c.isAtEnd()) {
			c.next();
		}
		while (!c.isAtEnd() && !c.check(TokenKind.FN) && !c.check(TokenKind.STRUCT) && !c.check(TokenKind.CONST)) {
			c.next();
		}
	}

	private ParseFailure failure(String expected) {
		Token found = c.peek();
		return new ParseFailure(new ParseError(found.span(), expected, found.describe()));
	}

	/**
	 * Unwinds to the nearest recovery point.
	 */
	private static final class ParseFailure extends RuntimeException {
		private final ParseError error;
		private final boolean unterminatedBlock;

		ParseFailure(ParseError error) {
			this(error, false);
		}

		ParseFailure(ParseError error, boolean unterminatedBlock) {
			super(error.message(), null, false, false);
			this.error = error;
			this.unterminatedBlock = unterminatedBlock;
		}
	}

	private static final class Cursor {
		private final List<Token> tokens;
		private int pos;

		Cursor(List<Token> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		int position() {
			return pos;
		}

		boolean isAtEnd() {
			return peek().kind() == TokenKind.EOF;
		}

		Token peek() {
			return tokens.get(pos);
		}

		Token previous() {
			return tokens.get(Math.max(0, pos - 1));
		}

		Token next() {
			Token t = tokens.get(pos);
			if (t.kind() != TokenKind.EOF) {
				pos++;
			}
			return t;
		}

		boolean check(TokenKind kind) {
			return peek().kind() == kind;
		}

		boolean match(TokenKind kind) {
			if (check(kind)) {
				next();
				return true;
			}
			return false;
		}

		Token expect(TokenKind kind) {
			Token t = peek();
			if (t.kind() != kind) {
				throw new ParseFailure(new ParseError(t.span(), kind.description(), t.describe()));
			}
			return next();
		}
	}
}
