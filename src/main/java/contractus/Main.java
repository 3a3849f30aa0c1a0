package contractus;

import contractus.codegen.CodeGenException;
import contractus.diag.Diagnostic;
import contractus.mir.MirPrinter;
import contractus.mir.MirProgram;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Command line entry point:
 * {@code contractus <file.ctx> [-o out.c] [--emit-mir] [--no-layout-asserts]}.
 *
 * Without {@code -o} the C output goes next to the source with a {@code .c}
 * extension. Diagnostics are printed as {@code file:line:column: Kind: message}.
 */
public final class Main {
	private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

	static final int EXIT_OK = 0;
	static final int EXIT_COMPILE_ERROR = 1;
	static final int EXIT_USAGE = 2;
	static final int EXIT_INTERNAL = 3;

	private static final String USAGE = "usage: contractus <file.ctx> [-o out.c] [--emit-mir] [--no-layout-asserts]";

	private final PrintStream out;
	private final PrintStream err;

	Main(PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		System.exit(new Main(System.out, System.err).run(List.of(args)));
	}

	int run(List<String> args) {
		Path input = null;
		Path output = null;
		boolean emitMir = false;
		CompilerOptions options = CompilerOptions.defaults();

		for (int i = 0; i < args.size(); i++) {
			String arg = args.get(i);
			switch (arg) {
				case "-o":
					if (i + 1 >= args.size()) {
						err.println("-o needs a file name");
						err.println(USAGE);
						return EXIT_USAGE;
					}
					output = Path.of(args.get(++i));
					break;
				case "--emit-mir":
					emitMir = true;
					break;
				case "--no-layout-asserts":
					options = options.withLayoutAssertions(false);
					break;
				default:
					if (arg.startsWith("-") || input != null) {
						err.println("unexpected argument: " + arg);
						err.println(USAGE);
						return EXIT_USAGE;
					}
					input = Path.of(arg);
			}
		}
		if (input == null) {
			err.println(USAGE);
			return EXIT_USAGE;
		}
		Path target = output == null ? defaultOutput(input) : output;

		String source;
		try {
			source = Files.readString(input);
		} catch (IOException e) {
			err.println("cannot read " + input + ": " + e.getMessage());
			return EXIT_USAGE;
		}

		Compiler compiler = new Compiler(options);
		String fileName = input.toString();
		try {
			MirProgram mir = compiler.lower(source);
			if (emitMir) {
				out.print(new MirPrinter().print(mir));
			}
			String c = compiler.generate(mir);
			Files.writeString(target, c);
			LOGGER.info(() -> "wrote " + target);
			return EXIT_OK;
		} catch (CompileException e) {
			for (Diagnostic diagnostic : e.diagnostics()) {
				err.println(diagnostic.render(fileName));
			}
			err.println(e.diagnostics().size() + " error(s), no output written");
			return EXIT_COMPILE_ERROR;
		} catch (CodeGenException e) {
			err.println(fileName + ": internal compiler error: " + e.getMessage());
			return EXIT_INTERNAL;
		} catch (IOException e) {
			err.println("cannot write " + target + ": " + e.getMessage());
			return EXIT_USAGE;
		}
	}

	static Path defaultOutput(Path input) {
		String name = input.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String stem = dot > 0 ? name.substring(0, dot) : name;
		return input.resolveSibling(stem + ".c");
	}
}
