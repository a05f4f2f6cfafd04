package org.lokray.calc.ast;

import org.lokray.calc.lexer.Token;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Program root that declares input variables before the expression:
 * {@code with a, b: a * b}.
 * <p>
 * Variables keep declaration order. Duplicates are kept as written; the
 * semantic analyzer reports them.
 */
public final class WithDecl implements ASTNode
{
	private final Token withKeyword;
	private final List<Token> variables; // IDENTIFIER tokens, in declaration order
	private final Expression body; // null when recovery dropped the expression

	public WithDecl(Token withKeyword, List<Token> variables, Expression body)
	{
		if (variables.isEmpty())
		{
			throw new IllegalArgumentException("A 'with' declaration needs at least one variable.");
		}
		this.withKeyword = withKeyword;
		this.variables = List.copyOf(variables);
		this.body = body;
	}

	public List<Token> getVariables()
	{
		return variables;
	}

	/**
	 * @return The declared names in declaration order.
	 */
	public List<String> getVariableNames()
	{
		return variables.stream().map(Token::getLexeme).collect(Collectors.toList());
	}

	public Optional<Expression> getBody()
	{
		return Optional.ofNullable(body);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWithDecl(this);
	}

	@Override
	public Token getFirstToken()
	{
		return withKeyword;
	}

	@Override
	public String toString()
	{
		return "with " + String.join(", ", getVariableNames()) + ": " + (body == null ? "<missing>" : body);
	}
}
