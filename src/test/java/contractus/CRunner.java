package contractus;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds generated C with the system compiler and runs the result.
 */
final class CRunner {
	private static final String CC = System.getenv().getOrDefault("CC", "cc");

	private CRunner() {
	}

	/**
	 * Whether a C compiler can be started at all.
	 */
	static boolean available() {
		try {
			return execute(List.of(CC, "--version")).exitCode() == 0;
		} catch (IOException e) {
			return false;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	/**
	 * Compiles {@code c} in {@code dir} and returns the program's standard
	 * output.
	 *
	 * @throws IllegalStateException if the C compiler rejects the source or the
	 *                               program exits with a non-zero status
	 */
	static String compileAndRun(String c, Path dir) throws IOException, InterruptedException {
		Path source = dir.resolve("program.c");
		Path binary = dir.resolve("program");
		Files.writeString(source, c);

		Result build = execute(List.of(CC, "-std=c11", "-O0", "-o", binary.toString(), source.toString()));
		if (build.exitCode() != 0) {
			throw new IllegalStateException("C compiler exited with code " + build.exitCode() + ":\n" + build.output());
		}
		Result run = execute(List.of(binary.toString()));
		if (run.exitCode() != 0) {
			throw new IllegalStateException("program exited with code " + run.exitCode() + ":\n" + run.output());
		}
		return run.output();
	}

	private record Result(int exitCode, String output) {
	}

	private static Result execute(List<String> command) throws IOException, InterruptedException {
		ProcessBuilder processBuilder = new ProcessBuilder(command);
		processBuilder.redirectErrorStream(true);

		Process process = processBuilder.start();

		StringBuilder output = new StringBuilder();
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				output.append(line).append("\n");
			}
		}
		return new Result(process.waitFor(), output.toString());
	}
}
