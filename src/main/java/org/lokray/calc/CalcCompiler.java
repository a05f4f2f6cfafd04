package org.lokray.calc;

import org.lokray.calc.ast.ASTNode;
import org.lokray.calc.codegen.LLVMIRGenerator;
import org.lokray.calc.lexer.Lexer;
import org.lokray.calc.parser.CalcParser;
import org.lokray.calc.semantics.AnalysisResult;
import org.lokray.calc.semantics.SemanticAnalyzer;
import org.lokray.calc.util.CompilerConfig;
import org.lokray.calc.util.Debug;
import org.lokray.calc.util.ErrorReporter;

import java.util.Optional;

/**
 * Runs lexer, parser, semantic analysis and code generation for one program.
 * Stops after the first failing phase; no IR is generated once an error is known.
 */
public class CalcCompiler
{
	private final CompilerConfig config;
	private final ErrorReporter errorReporter;

	public CalcCompiler(CompilerConfig config, ErrorReporter errorReporter)
	{
		this.config = config;
		this.errorReporter = errorReporter;
	}

	/**
	 * Compiles one program. The shared {@link ErrorReporter} is reset first and
	 * decides after each phase whether to go on.
	 */
	public CompilationResult compile(String source)
	{
		errorReporter.reset();

		Debug.log("--- Parsing Phase ---");
		CalcParser parser = new CalcParser(new Lexer(source), errorReporter);
		Optional<ASTNode> tree = parser.parse();

		if (tree.isEmpty() || errorReporter.hasErrors())
		{
			return CompilationResult.syntaxError();
		}

		Debug.log("--- Semantic Analysis Phase ---");
		AnalysisResult analysis = new SemanticAnalyzer(errorReporter).analyze(tree.get());
		if (errorReporter.hasErrors())
		{
			return CompilationResult.semanticError(analysis.getErrors());
		}

		Debug.log("--- Code Generation Phase ---");
		String ir = new LLVMIRGenerator(config).generate(tree.get());
		return CompilationResult.success(ir);
	}
}
