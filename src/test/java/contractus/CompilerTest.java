package contractus;

import contractus.diag.Diagnostic;
import contractus.diag.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompilerTest {
	private static final String SUM = """
			fn main() -> i32 {
				let mut sum = 0;
				for i in 0..5 { sum += i; }
				print(sum);
				return 0;
			}
			""";

	private static List<ErrorKind> kinds(CompileException e) {
		return e.diagnostics().stream().map(Diagnostic::kind).toList();
	}

	@Test
	void compilesToC() throws CompileException {
		String c = new Compiler().compile(SUM);
		assertTrue(c.contains("int32_t ctx_main(void) {"), c);
		assertTrue(c.contains("int main(void) {"), c);
	}

	@Test
	void compilationIsIdempotent() throws CompileException {
		Compiler compiler = new Compiler();
		assertEquals(compiler.compile(SUM), compiler.compile(SUM));
		assertEquals(compiler.compile(SUM), new Compiler().compile(SUM));
	}

	@Test
	void undefinedNamesProduceNoOutput() {
		CompileException e = assertThrows(CompileException.class,
				() -> new Compiler().compile("fn main() { let x = y; }"));
		assertEquals(List.of(ErrorKind.UNDEFINED_VARIABLE), kinds(e));
		assertEquals("1:21: UndefinedVariable: cannot find value `y` in this scope", e.getMessage());
	}

	@Test
	void eachNamedErrorKindIsReported() {
		String point = "struct Point { x: i32 } ";
		assertEquals(List.of(ErrorKind.UNDEFINED_STRUCT), kinds(assertThrows(CompileException.class,
				() -> new Compiler().compile("fn main() { let s: Shape; }"))));
		assertEquals(List.of(ErrorKind.UNDEFINED_FIELD), kinds(assertThrows(CompileException.class,
				() -> new Compiler().compile(point + "fn main() { let p = Point { x: 1 }; print(p.y); }"))));
		assertEquals(List.of(ErrorKind.INVALID_ITERABLE), kinds(assertThrows(CompileException.class,
				() -> new Compiler().compile("fn main() { for c in true { } }"))));
		assertEquals(List.of(ErrorKind.TYPE_ERROR), kinds(assertThrows(CompileException.class,
				() -> new Compiler().compile("fn main() { let b: bool = 1; }"))));
	}

	@Test
	void parseErrorsStopBeforeAnalysis() {
		CompileException e = assertThrows(CompileException.class, () -> new Compiler().compile("""
				fn main() {
					let x = ;
					let y = undefined;
					let = 3;
				}
				"""));
		assertEquals(List.of(ErrorKind.PARSE_ERROR, ErrorKind.PARSE_ERROR), kinds(e));
		assertEquals(2, e.diagnostics().get(0).span().line());
		assertEquals(4, e.diagnostics().get(1).span().line());
	}

	@Test
	void lowersWithoutGeneratingC() throws CompileException {
		assertTrue(new Compiler().lower(SUM).function("main").isPresent());
	}

	@Test
	void layoutAssertionsFollowTheOptions() throws CompileException {
		String source = "struct Point { x: i32, y: i32 } fn main() { }";
		assertTrue(new Compiler().compile(source).contains("_Static_assert"));
		Compiler plain = new Compiler(CompilerOptions.defaults().withLayoutAssertions(false));
		assertFalse(plain.compile(source).contains("_Static_assert"));
	}

	@Test
	void entryPointIsConfigurable() throws CompileException {
		Compiler compiler = new Compiler(new CompilerOptions(true, "start"));
		String c = compiler.compile("fn start() { print(true); }");
		assertTrue(c.contains("ctx_start();"), c);
	}

	@Test
	void optionsRejectABlankEntryPoint() {
		assertThrows(IllegalArgumentException.class, () -> new CompilerOptions(true, " "));
		assertThrows(NullPointerException.class, () -> new CompilerOptions(true, null));
	}
}
