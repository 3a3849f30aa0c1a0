package contractus.semantic;

import contractus.ast.CallExpr;
import contractus.ast.ExprStmt;
import contractus.ast.FunctionDef;
import contractus.ast.LetStmt;
import contractus.diag.ErrorKind;
import contractus.parse.Lexer;
import contractus.parse.ParseResult;
import contractus.parse.Parser;
import contractus.types.ArrayType;
import contractus.types.FunctionType;
import contractus.types.PointerType;
import contractus.types.ScalarType;
import contractus.types.SliceType;
import contractus.types.StructType;
import contractus.types.Type;
import contractus.types.UnitType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SemanticAnalyzerTest {
	private static AnalysisResult analyze(String source) {
		ParseResult parsed = new Parser().parse(new Lexer().lex(source));
		assertFalse(parsed.hasErrors(), () -> parsed.errors().toString());
		return new SemanticAnalyzer().analyze(parsed.program());
	}

	private static TypedProgram ok(String source) {
		AnalysisResult result = analyze(source);
		assertFalse(result.hasErrors(), () -> result.errors().toString());
		return result.program();
	}

	private static SemanticError single(String source) {
		AnalysisResult result = analyze(source);
		assertEquals(1, result.errors().size(), () -> result.errors().toString());
		return result.errors().get(0);
	}

	private static List<ErrorKind> kinds(String source) {
		return analyze(source).errors().stream().map(SemanticError::kind).toList();
	}

	@Test
	void acceptsRangeAndArrayLoops() {
		ok("""
				fn main() -> i32 {
					let mut sum = 0;
					for i in 0..5 { sum = sum + i; }
					for item in [10, 20, 30] { sum += item; }
					return sum;
				}
				""");
	}

	@Test
	void infersLetTypesLocally() {
		TypedProgram typed = ok("""
				struct Point { x: i32, y: i32 }
				fn main() {
					let p = Point { x: 1, y: 2 };
					let xs = [1, 2, 3];
					let q = &p;
					let b: u8 = 7;
				}
				""");
		FunctionDef main = typed.program().functions().get(0);
		List<Type> types = main.body().stmts().stream().map(s -> typed.typeOf((LetStmt) s)).toList();
		assertEquals(List.of(new StructType("Point"), new ArrayType(ScalarType.I32, 3),
				new PointerType(new StructType("Point")), ScalarType.U8), types);
	}

	@Test
	void undefinedVariable() {
		SemanticError error = single("fn main() { let x = y + 1; }");
		assertEquals(ErrorKind.UNDEFINED_VARIABLE, error.kind());
		assertEquals("cannot find value `y` in this scope", error.message());
		assertEquals(1, error.span().line());
		assertEquals(21, error.span().column());
	}

	@Test
	void undefinedFunctionIsAnUndefinedVariable() {
		assertEquals(List.of(ErrorKind.UNDEFINED_VARIABLE), kinds("fn main() { missing(1); }"));
	}

	@Test
	void undefinedField() {
		SemanticError error = single("struct Point { x: i32 } fn main() { let p = Point { x: 1 }; let z = p.z; }");
		assertEquals(ErrorKind.UNDEFINED_FIELD, error.kind());
		assertEquals("no field `z` on type `Point`", error.message());
	}

	@Test
	void undefinedStruct() {
		assertEquals(List.of(ErrorKind.UNDEFINED_STRUCT), kinds("fn f(p: Shape) { }"));
		assertEquals(List.of(ErrorKind.UNDEFINED_STRUCT), kinds("fn main() { let s = Shape { w: 1 }; }"));
	}

	@Test
	void nonIterableIsRejected() {
		SemanticError error = single("fn main() { let n = 5; for i in n { } }");
		assertEquals(ErrorKind.INVALID_ITERABLE, error.kind());
		assertEquals("`i32` is not iterable", error.message());
	}

	@Test
	void returnTypeMismatch() {
		SemanticError error = single("fn f() -> i32 { return true; }");
		assertEquals(ErrorKind.TYPE_ERROR, error.kind());
		assertEquals("expected `i32`, found `bool`", error.message());
	}

	@Test
	void missingReturnValue() {
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn f() -> i32 { return; }"));
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("fn f(c: bool) -> i32 { if c { return 1; } }"));
	}

	@Test
	void divergingBodiesNeedNoTrailingReturn() {
		ok("fn f(c: bool) -> i32 { if c { return 1; } else { return 2; } }");
		ok("fn g() -> i32 { while true { } }");
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("fn h() -> i32 { while true { break; } }"));
	}

	@Test
	void operandsMustMatch() {
		SemanticError error = single("fn main() { let a: u8 = 1; let b = 2; let c = a + b; }");
		assertEquals("expected `u8`, found `i32`", error.message());
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { let c = true + 1; }"));
	}

	@Test
	void literalsAdoptU8FromContext() {
		ok("fn main() { let a: u8 = 200; let b = a + 55; let c = 1 + a; let ok = a < 255; }");
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { let a: u8 = 256; }"));
	}

	@Test
	void i32LiteralBounds() {
		ok("fn main() { let lo = -2147483648; let hi = 2147483647; }");
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { let x = 2147483648; }"));
	}

	@Test
	void conditionsMustBeBool() {
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { if 1 { } }"));
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { while 0 { } }"));
	}

	@Test
	void immutableBindingsCannotBeReassigned() {
		SemanticError error = single("fn main() { let x = 1; x = 2; }");
		assertEquals(ErrorKind.SEMANTIC_ERROR, error.kind());
		assertEquals("cannot assign twice to immutable variable `x`", error.message());
	}

	@Test
	void deferredInitializationAllowsOneAssignment() {
		ok("fn main() { let x: i32; x = 2; let y = x; }");
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("fn main() { let x: i32; let y = x; }"));
	}

	@Test
	void assignmentInOneBranchLeavesVariableUninitialized() {
		SemanticError error = single("fn main() -> i32 { let x: i32; if false { x = 1; } return x; }");
		assertEquals("use of possibly uninitialized variable `x`", error.message());
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds("fn f(c: bool) -> i32 { let x: i32; if c { x = 1; } else { } return x; }"));
	}

	@Test
	void assignmentInBothBranchesInitializes() {
		ok("fn f(c: bool) -> i32 { let x: i32; if c { x = 1; } else { x = 2; } return x; }");
		ok("fn f(c: bool) -> i32 { let x: i32; if c { return 0; } else { x = 2; } return x; }");
		ok("fn f(c: bool) -> i32 { let x: i32; if c { x = 1; } else if !c { x = 2; } else { x = 3; } return x; }");
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds("fn f(c: bool) -> i32 { let x: i32; if c { x = 1; } else if !c { x = 2; } return x; }"));
	}

	@Test
	void loopBodyAssignmentDoesNotInitializeAfterLoop() {
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds("fn f(c: bool) -> i32 { let mut x: i32; while c { x = 1; } return x; }"));
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds("fn f() -> i32 { let mut x: i32; for i in 0..3 { x = i; } return x; }"));
		ok("fn f(c: bool) -> i32 { let mut x: i32; x = 0; while c { x = 1; } return x; }");
	}

	@Test
	void immutableCannotBeAssignedInsideLoop() {
		SemanticError error = single("fn main() { let x: i32; while true { x = 1; } }");
		assertEquals("cannot assign to immutable variable `x` inside a loop", error.message());
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds("fn main() { let x: i32; for i in 0..3 { x = i; } }"));
		ok("fn main() { for i in 0..3 { let x: i32; x = i; } }");
	}

	@Test
	void immutableAssignedOnAnyPathCannotBeAssignedAgain() {
		SemanticError error = single("fn f(c: bool) { let x: i32; if c { x = 1; } x = 2; }");
		assertEquals("cannot assign twice to immutable variable `x`", error.message());
		ok("fn f(c: bool) { let x: i32; if c { x = 1; } else { x = 2; } let y = x; }");
	}

	@Test
	void rightOperandOfLogicalOperatorMayNotRun() {
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds("fn f(c: bool) { let mut x: i32; let b = c && (x = 1) == 1; let y = x; }"));
	}

	@Test
	void bitwiseOperators() {
		ok("fn main() { let a = 6 & 3 | 1 ^ 2; let b: u8 = 200; let c = b >> 2; let d = true & !false; let e = a << 2; }");
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { let s = true << 1; }"));
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { let a: u8 = 1; let b = 2; let c = a & b; }"));
	}

	@Test
	void constantsAreFoldedWithRuntimeArithmetic() {
		TypedProgram typed = ok("""
				const BITS: i32 = 4;
				const MASK: i32 = (1 << BITS) - 1;
				const SMALL: u8 = 250 + 10;
				const ON: bool = MASK > 10 && !false;
				const MIN: i32 = -2147483648 / -1;
				const LATE: i32 = EARLY * 2;
				const EARLY: i32 = 21;
				fn main() -> i32 { return MASK & LATE; }
				""");
		assertEquals(new Constant("MASK", ScalarType.I32, 15), typed.constants().get("MASK"));
		assertEquals(4, typed.constants().get("SMALL").value());
		assertEquals(1, typed.constants().get("ON").value());
		assertEquals(Integer.MIN_VALUE, typed.constants().get("MIN").value());
		assertEquals(42, typed.constants().get("LATE").value());
	}

	@Test
	void localsShadowConstants() {
		ok("const X: i32 = 1; fn main() { let X = true; if X { } }");
	}

	@Test
	void rejectedConstants() {
		assertTrue(single("const A: i32 = B; const B: i32 = A;").message().contains("depends on itself"));
		assertEquals("division by zero in constant", single("const X: i32 = 1 / 0;").message());
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds("const X: i32 = f(); fn f() -> i32 { return 1; }"));
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("const X: i32 = true;"));
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("const X: *i32 = 0;"));
		assertEquals(List.of(ErrorKind.UNDEFINED_VARIABLE), kinds("const X: i32 = Y;"));
		assertEquals("`f` is a function, not a constant", single("const X: i32 = f; fn f() { }").message());
	}

	@Test
	void constantsShareTheItemNamespace() {
		assertEquals("cannot assign to constant `X`", single("const X: i32 = 1; fn main() { X = 2; }").message());
		assertEquals("function `X` has the same name as a constant", single("const X: i32 = 1; fn X() { }").message());
		assertEquals("constant `X` is defined more than once", single("const X: i32 = 1; const X: i32 = 2;").message());
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("const X: i32 = 1; fn main() { X(); }"));
	}

	@Test
	void writesNeedAMutableRoot() {
		String struct = "struct Point { x: i32, y: i32 } ";
		ok(struct + "fn main() { let mut p = Point { x: 1, y: 2 }; p.x = 5; }");
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds(struct + "fn main() { let p = Point { x: 1, y: 2 }; p.x = 5; }"));
		ok(struct + "fn move(p: *Point) { p.x = 5; *p = Point { x: 0, y: 0 }; }");
		ok("fn fill(s: [i32]) { s[0] = 1; }");
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("fn main() { let a = [1, 2]; a[0] = 3; }"));
	}

	@Test
	void loopVariableIsImmutableUnlessDeclaredMut() {
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("fn main() { for v in [1, 2] { v = 3; } }"));
		ok("fn main() { for mut v in [1, 2] { v = 3; } }");
	}

	@Test
	void loopVariableIsScopedToTheBody() {
		assertEquals(List.of(ErrorKind.UNDEFINED_VARIABLE), kinds("fn main() { for i in 0..3 { } let j = i; }"));
	}

	@Test
	void structLiteralFieldsAreChecked() {
		String struct = "struct Point { x: i32, y: i32 } ";
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds(struct + "fn main() { let p = Point { x: 1 }; }"));
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR),
				kinds(struct + "fn main() { let p = Point { x: 1, x: 2, y: 3 }; }"));
		assertEquals(List.of(ErrorKind.UNDEFINED_FIELD),
				kinds(struct + "fn main() { let p = Point { x: 1, y: 2, z: 3 }; }"));
	}

	@Test
	void duplicateDefinitions() {
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("struct A { x: i32 } struct A { y: i32 }"));
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("struct A { x: i32, x: u8 }"));
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("fn f() { } fn f() { }"));
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("struct i32 { x: i32 }"));
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("struct Empty { }"));
	}

	@Test
	void functionsMayBeCalledBeforeTheirDefinition() {
		TypedProgram typed = ok("fn main() -> i32 { return twice(21); } fn twice(x: i32) -> i32 { return x * 2; }");
		assertEquals(new FunctionType(List.of(ScalarType.I32), ScalarType.I32), typed.signatures().get("twice"));
	}

	@Test
	void callArgumentsAreChecked() {
		String callee = "fn add(a: i32, b: i32) -> i32 { return a + b; } ";
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds(callee + "fn main() { add(1); }"));
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds(callee + "fn main() { add(1, true); }"));
	}

	@Test
	void functionValuesCanBeStoredAndCalled() {
		TypedProgram typed = ok("""
				fn inc(x: i32) -> i32 { return x + 1; }
				fn apply(f: fn(i32) -> i32, v: i32) -> i32 { return f(v); }
				fn main() { let g = inc; print(apply(g, 1)); }
				""");
		LetStmt let = (LetStmt) typed.program().functions().get(2).body().stmts().get(0);
		assertEquals(new FunctionType(List.of(ScalarType.I32), ScalarType.I32), typed.typeOf(let));
	}

	@Test
	void arraysCoerceToSlices() {
		TypedProgram typed = ok("""
				fn sum(xs: [i32]) -> i32 {
					let mut total = 0;
					for x in xs { total += x; }
					return total;
				}
				fn main() { let a = [1, 2, 3]; print(sum(a)); let s: [i32] = a[1..3]; print(s.len); }
				""");
		FunctionDef main = typed.program().functions().get(1);
		ExprStmt print = (ExprStmt) main.body().stmts().get(1);
		CallExpr outer = (CallExpr) print.expr();
		CallExpr inner = (CallExpr) outer.args().get(0);
		assertTrue(typed.coercesToSlice(inner.args().get(0)));
		LetStmt slice = (LetStmt) main.body().stmts().get(2);
		assertEquals(new SliceType(ScalarType.I32), typed.typeOf(slice));
		assertFalse(typed.coercesToSlice(slice.init()));
	}

	@Test
	void rangesOnlyAppearInLoopsAndIndexes() {
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { let r = 0..3; }"));
	}

	@Test
	void emptyArrayLiteralIsRejected() {
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { let a: [i32; 1] = []; }"));
	}

	@Test
	void unitValuesCannotBeBound() {
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn nothing() { } fn main() { let x = nothing(); }"));
	}

	@Test
	void printAcceptsScalarsOnly() {
		ok("fn main() { print(1); print(true); let b: u8 = 3; print(b); }");
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { print([1]); }"));
	}

	@Test
	void castsBetweenIntegersAndFromBool() {
		ok("fn main() { let a = 300 as u8; let b = a as i32; let c = true as i32; }");
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() { let c = 1 as bool; }"));
	}

	@Test
	void entryPointSignature() {
		assertEquals(List.of(ErrorKind.SEMANTIC_ERROR), kinds("fn main(x: i32) { }"));
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds("fn main() -> bool { return true; }"));
	}

	@Test
	void errorsInOneFunctionDoNotHideAnother() {
		assertEquals(List.of(ErrorKind.UNDEFINED_VARIABLE, ErrorKind.TYPE_ERROR),
				kinds("fn a() { let x = y; } fn b() -> i32 { return false; }"));
	}

	@Test
	void unitReturnTypeIsImplicit() {
		TypedProgram typed = ok("fn f() { return; }");
		assertEquals(UnitType.INSTANCE, typed.signatures().get("f").returnType());
	}
}
