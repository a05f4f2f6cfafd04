package org.lokray.calc;

import org.lokray.calc.semantics.SemanticError;

import java.util.List;
import java.util.Optional;

/**
 * What one call to {@link CalcCompiler#compile(String)} produced. IR is only
 * present on success.
 */
public class CompilationResult
{
	public enum Status
	{
		SUCCESS("Compilation succeeded"),
		SYNTAX_ERROR("Syntax errors occured"),
		SEMANTIC_ERROR("Semantic errors occured");

		private final String message;

		Status(String message)
		{
			this.message = message;
		}

		/**
		 * @return The one-line summary the driver prints for this status.
		 */
		public String getMessage()
		{
			return message;
		}
	}

	private final Status status;
	private final String ir;
	private final List<SemanticError> semanticErrors;

	private CompilationResult(Status status, String ir, List<SemanticError> semanticErrors)
	{
		this.status = status;
		this.ir = ir;
		this.semanticErrors = List.copyOf(semanticErrors);
	}

	static CompilationResult success(String ir)
	{
		return new CompilationResult(Status.SUCCESS, ir, List.of());
	}

	static CompilationResult syntaxError()
	{
		return new CompilationResult(Status.SYNTAX_ERROR, null, List.of());
	}

	static CompilationResult semanticError(List<SemanticError> errors)
	{
		return new CompilationResult(Status.SEMANTIC_ERROR, null, errors);
	}

	public Status getStatus()
	{
		return status;
	}

	public boolean isSuccess()
	{
		return status == Status.SUCCESS;
	}

	public Optional<String> getIr()
	{
		return Optional.ofNullable(ir);
	}

	public List<SemanticError> getSemanticErrors()
	{
		return semanticErrors;
	}
}
