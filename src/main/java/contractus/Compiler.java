package contractus;

import contractus.codegen.CGenerator;
import contractus.mir.MirBuilder;
import contractus.mir.MirProgram;
import contractus.parse.Lexer;
import contractus.parse.ParseResult;
import contractus.parse.Parser;
import contractus.parse.Token;
import contractus.semantic.AnalysisResult;
import contractus.semantic.SemanticAnalyzer;

import java.util.List;
import java.util.logging.Logger;

/**
 * Source text to C, one stage after another. Parse and analysis errors stop
 * the pipeline before any MIR is built.
 */
public final class Compiler {
	private static final Logger LOGGER = Logger.getLogger(Compiler.class.getName());

	private final CompilerOptions options;

	public Compiler() {
		this(CompilerOptions.defaults());
	}

	public Compiler(CompilerOptions options) {
		this.options = options;
	}

	public String compile(String source) throws CompileException {
		return generate(lower(source));
	}

	/**
	 * Emits C for an already lowered program.
	 */
	public String generate(MirProgram program) {
		return new CGenerator(options.layoutAssertions(), options.entryPoint()).generate(program);
	}

	/**
	 * Runs the front end and lowering only.
	 */
	public MirProgram lower(String source) throws CompileException {
		List<Token> tokens = new Lexer().lex(source);
		LOGGER.fine(() -> "lexed " + tokens.size() + " tokens");

		ParseResult parsed = new Parser().parse(tokens);
		if (parsed.hasErrors()) {
			LOGGER.fine(() -> "parsing failed with " + parsed.errors().size() + " error(s)");
			throw new CompileException(parsed.errors());
		}

		AnalysisResult analyzed = new SemanticAnalyzer(options.entryPoint()).analyze(parsed.program());
		if (analyzed.hasErrors()) {
			LOGGER.fine(() -> "analysis failed with " + analyzed.errors().size() + " error(s)");
			throw new CompileException(analyzed.errors());
		}
		LOGGER.fine(() -> "analyzed " + parsed.program().items().size() + " items, "
				+ analyzed.program().layouts().layouts().size() + " struct layouts");

		return new MirBuilder().lower(analyzed.program());
	}
}
