package contractus.parse;

import contractus.ast.AssignExpr;
import contractus.ast.BinaryExpr;
import contractus.ast.BinaryOp;
import contractus.ast.CastExpr;
import contractus.ast.ConstDef;
import contractus.ast.Expr;
import contractus.ast.ExprStmt;
import contractus.ast.FieldExpr;
import contractus.ast.ForStmt;
import contractus.ast.FunctionDef;
import contractus.ast.IfStmt;
import contractus.ast.IndexExpr;
import contractus.ast.IntLiteral;
import contractus.ast.LetStmt;
import contractus.ast.NameExpr;
import contractus.ast.NamedTypeRef;
import contractus.ast.PointerTypeRef;
import contractus.ast.RangeExpr;
import contractus.ast.RepeatArrayLiteral;
import contractus.ast.SliceTypeRef;
import contractus.ast.Span;
import contractus.ast.Stmt;
import contractus.ast.StructDef;
import contractus.ast.StructLiteral;
import contractus.ast.UnaryExpr;
import contractus.ast.UnaryOp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParserTest {
	private static ParseResult parse(String source) {
		return new Parser().parse(new Lexer().lex(source));
	}

	private static List<Stmt> body(String statements) {
		ParseResult result = parse("fn f() { " + statements + " }");
		assertFalse(result.hasErrors(), () -> result.errors().toString());
		return result.program().functions().get(0).body().stmts();
	}

	private static Expr expression(String source) {
		return ((ExprStmt) body(source + ";").get(0)).expr();
	}

	private static String name(Expr expr) {
		return ((NameExpr) expr).name();
	}

	@Test
	void multiplicationBindsTighterThanAddition() {
		BinaryExpr add = assertInstanceOf(BinaryExpr.class, expression("1 + 2 * 3"));
		assertEquals(BinaryOp.ADD, add.op());
		assertEquals(1, ((IntLiteral) add.left()).value());
		BinaryExpr mul = assertInstanceOf(BinaryExpr.class, add.right());
		assertEquals(BinaryOp.MUL, mul.op());
	}

	@Test
	void assignmentIsRightAssociative() {
		AssignExpr outer = assertInstanceOf(AssignExpr.class, expression("a = b = 1"));
		assertEquals("a", name(outer.target()));
		assertNull(outer.compoundOp());
		AssignExpr inner = assertInstanceOf(AssignExpr.class, outer.value());
		assertEquals("b", name(inner.target()));
	}

	@Test
	void compoundAssignmentKeepsOperator() {
		AssignExpr assign = assertInstanceOf(AssignExpr.class, expression("total += x * 2"));
		assertEquals(BinaryOp.ADD, assign.compoundOp());
		assertInstanceOf(BinaryExpr.class, assign.value());
	}

	@Test
	void logicalOperatorsBindLooserThanComparisons() {
		BinaryExpr or = assertInstanceOf(BinaryExpr.class, expression("a < b && c == d || e"));
		assertEquals(BinaryOp.OR, or.op());
		BinaryExpr and = assertInstanceOf(BinaryExpr.class, or.left());
		assertEquals(BinaryOp.AND, and.op());
		assertEquals(BinaryOp.LT, ((BinaryExpr) and.left()).op());
		assertEquals(BinaryOp.EQ, ((BinaryExpr) and.right()).op());
		assertEquals("e", name(or.right()));
	}

	@Test
	void bitwiseOperatorsBindTighterThanComparisons() {
		BinaryExpr eq = assertInstanceOf(BinaryExpr.class, expression("a | b ^ c & d << 1 == e"));
		assertEquals(BinaryOp.EQ, eq.op());
		BinaryExpr or = assertInstanceOf(BinaryExpr.class, eq.left());
		assertEquals(BinaryOp.BIT_OR, or.op());
		BinaryExpr xor = assertInstanceOf(BinaryExpr.class, or.right());
		assertEquals(BinaryOp.BIT_XOR, xor.op());
		BinaryExpr and = assertInstanceOf(BinaryExpr.class, xor.right());
		assertEquals(BinaryOp.BIT_AND, and.op());
		BinaryExpr shift = assertInstanceOf(BinaryExpr.class, and.right());
		assertEquals(BinaryOp.SHL, shift.op());
	}

	@Test
	void shiftBindsLooserThanAddition() {
		BinaryExpr shift = assertInstanceOf(BinaryExpr.class, expression("x >> n + 1"));
		assertEquals(BinaryOp.SHR, shift.op());
		assertEquals(BinaryOp.ADD, ((BinaryExpr) shift.right()).op());
	}

	@Test
	void ampersandAfterAnOperandIsBitwiseAnd() {
		BinaryExpr and = assertInstanceOf(BinaryExpr.class, expression("a & &b"));
		assertEquals(BinaryOp.BIT_AND, and.op());
		assertEquals(UnaryOp.ADDRESS_OF, ((UnaryExpr) and.right()).op());
	}

	@Test
	void constItem() {
		ParseResult result = parse("const LIMIT: i32 = 1 << 4;\nfn main() { }");
		assertFalse(result.hasErrors(), () -> result.errors().toString());
		ConstDef limit = result.program().constants().get(0);
		assertEquals("LIMIT", limit.name());
		assertEquals("i32", ((NamedTypeRef) limit.type()).name());
		assertEquals(BinaryOp.SHL, ((BinaryExpr) limit.value()).op());
		assertEquals(1, result.program().functions().size());
	}

	@Test
	void brokenConstResumesAtNextItem() {
		ParseResult result = parse("const X: i32 = ;\nconst Y: u8 = 2;\nfn main() { }");
		assertEquals(1, result.errors().size(), () -> result.errors().toString());
		assertEquals(List.of("Y"), result.program().constants().stream().map(ConstDef::name).toList());
	}

	@Test
	void postfixBindsTighterThanUnary() {
		UnaryExpr neg = assertInstanceOf(UnaryExpr.class, expression("-p.x[1]"));
		assertEquals(UnaryOp.NEG, neg.op());
		IndexExpr index = assertInstanceOf(IndexExpr.class, neg.operand());
		FieldExpr field = assertInstanceOf(FieldExpr.class, index.target());
		assertEquals("x", field.field());
	}

	@Test
	void castBindsTighterThanAddition() {
		BinaryExpr add = assertInstanceOf(BinaryExpr.class, expression("a + b as u8"));
		CastExpr cast = assertInstanceOf(CastExpr.class, add.right());
		assertEquals("u8", ((NamedTypeRef) cast.type()).name());
	}

	@Test
	void rangeBindsLooserThanAddition() {
		ForStmt loop = assertInstanceOf(ForStmt.class, body("for i in 0..n + 1 { }").get(0));
		RangeExpr range = assertInstanceOf(RangeExpr.class, loop.iterable());
		assertFalse(range.inclusive());
		assertEquals(BinaryOp.ADD, ((BinaryExpr) range.end()).op());
	}

	@Test
	void inclusiveRange() {
		ForStmt loop = assertInstanceOf(ForStmt.class, body("for mut i in 1..=3 { }").get(0));
		assertTrue(loop.mutable());
		assertTrue(((RangeExpr) loop.iterable()).inclusive());
	}

	@Test
	void chainedRangeIsRejected() {
		ParseResult result = parse("fn f() { for i in 0..1..2 { } }");
		assertEquals(1, result.errors().size());
		assertTrue(result.errors().get(0).message().contains("at most one range"), result.errors().toString());
	}

	@Test
	void blockAfterIfConditionIsNotAStructLiteral() {
		IfStmt ifStmt = assertInstanceOf(IfStmt.class, body("if ready { x = 1; } else if other { x = 2; }").get(0));
		assertEquals("ready", name(ifStmt.condition()));
		assertInstanceOf(IfStmt.class, ifStmt.elseBlock().stmts().get(0));
	}

	@Test
	void parenthesizedStructLiteralInCondition() {
		IfStmt ifStmt = assertInstanceOf(IfStmt.class, body("if (P { a: 1 }).a == 1 { }").get(0));
		BinaryExpr eq = (BinaryExpr) ifStmt.condition();
		FieldExpr field = assertInstanceOf(FieldExpr.class, eq.left());
		assertInstanceOf(StructLiteral.class, field.target());
	}

	@Test
	void structLiteralShorthand() {
		LetStmt let = assertInstanceOf(LetStmt.class, body("let p = Point { x, y: 2 };").get(0));
		StructLiteral literal = assertInstanceOf(StructLiteral.class, let.init());
		assertEquals("x", name(literal.fields().get(0).value()));
		assertEquals(2, ((IntLiteral) literal.fields().get(1).value()).value());
	}

	@Test
	void typesAndRepeatLiterals() {
		List<Stmt> stmts = body("let s: [u8] = [0; 4]; let p: *mut Point = q;");
		LetStmt slice = (LetStmt) stmts.get(0);
		assertInstanceOf(SliceTypeRef.class, slice.type());
		RepeatArrayLiteral repeat = assertInstanceOf(RepeatArrayLiteral.class, slice.init());
		assertEquals(4, repeat.count());
		LetStmt pointer = (LetStmt) stmts.get(1);
		assertInstanceOf(PointerTypeRef.class, pointer.type());
	}

	@Test
	void itemsAndSpans() {
		ParseResult result = parse("struct Point { x: i32, y: i32, }\nfn main() {}");
		assertFalse(result.hasErrors());
		StructDef point = result.program().structs().get(0);
		assertEquals(List.of("x", "y"), point.fields().stream().map(f -> f.name()).toList());

		FunctionDef main = result.program().functions().get(0);
		assertNull(main.returnType());
		assertEquals(new Span(33, 45, 2, 1), main.span());
	}

	@Test
	void reportsTwoErrorsAroundAValidStatement() {
		ParseResult result = parse("""
				fn main() {
					let x = ;
					let y = 2;
					let = 3;
				}
				""");
		assertEquals(2, result.errors().size(), result.errors().toString());
		assertEquals(2, result.errors().get(0).span().line());
		assertEquals("expected expression, found ';'", result.errors().get(0).message());
		assertEquals(4, result.errors().get(1).span().line());

		List<Stmt> kept = result.program().functions().get(0).body().stmts();
		assertEquals(1, kept.size());
		assertEquals("y", ((LetStmt) kept.get(0)).name());
	}

	@Test
	void breakOutsideLoopIsAParseError() {
		ParseResult result = parse("fn f() { break; }");
		assertEquals(1, result.errors().size());
		assertEquals("expected 'break' inside a loop, found 'break'", result.errors().get(0).message());
	}

	@Test
	void continueInsideLoopIsAccepted() {
		assertFalse(parse("fn f() { while true { if x { continue; } break; } }").hasErrors());
	}

	@Test
	void unterminatedBlockResumesAtNextItem() {
		ParseResult result = parse("fn a() { let x = 1;\nfn b() { }");
		assertEquals(1, result.errors().size());
		assertEquals("expected '}', found 'fn'", result.errors().get(0).message());
		assertEquals(List.of("b"), result.program().functions().stream().map(FunctionDef::name).toList());
	}

	@Test
	void garbageAtTopLevelIsSkipped() {
		ParseResult result = parse("42 ; fn ok() { }");
		assertEquals(1, result.errors().size());
		assertEquals("expected 'fn', 'struct' or 'const', found integer literal '42'", result.errors().get(0).message());
		assertEquals(1, result.program().functions().size());
	}

	@Test
	void errorTokenIsReported() {
		ParseResult result = parse("fn f() { let x = 1 @ 2; }");
		assertEquals(1, result.errors().size());
		assertEquals("expected ';', found invalid character '@'", result.errors().get(0).message());
	}
}
