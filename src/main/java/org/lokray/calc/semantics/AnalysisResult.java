package org.lokray.calc.semantics;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one semantic analysis run.
 */
public class AnalysisResult
{
	private final List<SemanticError> errors;

	public AnalysisResult(List<SemanticError> errors)
	{
		this.errors = List.copyOf(errors);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<SemanticError> getErrors()
	{
		return errors;
	}

	public List<SemanticError> getErrors(SemanticError.Kind kind)
	{
		return errors.stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
	}
}
