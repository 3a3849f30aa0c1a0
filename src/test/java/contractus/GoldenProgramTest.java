package contractus;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class GoldenProgramTest {
	private static final Path GOLDEN = Path.of("src", "test", "resources", "golden");

	private static boolean ccAvailable;

	@TempDir
	Path dir;

	@BeforeAll
	static void findCompiler() {
		ccAvailable = CRunner.available();
	}

	@Test
	void rangeLoopSums() throws Exception {
		assertRuns("range_sum");
	}

	@Test
	void arrayLoopSums() throws Exception {
		assertRuns("array_sum");
	}

	@Test
	void rangeBoundIsEvaluatedOnce() throws Exception {
		assertRuns("bound_once");
	}

	@Test
	void loopVariableWritesDoNotReachTheArray() throws Exception {
		assertRuns("loop_variable");
	}

	@Test
	void structsPointersAndSlices() throws Exception {
		assertRuns("structs");
	}

	@Test
	void functionValuesAndLoops() throws Exception {
		assertRuns("functions");
	}

	@Test
	void integerEdgeCasesBitwiseOperatorsAndConstants() throws Exception {
		assertRuns("integer_ops");
	}

	private void assertRuns(String name) throws Exception {
		String source = Files.readString(GOLDEN.resolve(name + ".ctx"));
		String expected = Files.readString(GOLDEN.resolve(name + ".out"));
		// the front end runs even where no C compiler is installed
		String c = new Compiler().compile(source);

		assumeTrue(ccAvailable, "no C compiler on PATH");
		assertEquals(normalize(expected), normalize(CRunner.compileAndRun(c, dir)));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
