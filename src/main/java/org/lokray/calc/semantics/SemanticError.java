package org.lokray.calc.semantics;

import org.lokray.calc.lexer.Token;

/**
 * One finding of the semantic analyzer.
 */
public class SemanticError
{
	public enum Kind
	{
		/**
		 * A name appears twice in the same 'with' list.
		 */
		DUPLICATE_DECLARATION,
		/**
		 * A variable is used but never declared.
		 */
		UNDECLARED_USE,
		/**
		 * A binary operation lost an operand to parser recovery.
		 */
		MISSING_OPERAND,
		/**
		 * A 'with' declaration lost its expression to parser recovery.
		 */
		MISSING_BODY
	}

	private final Kind kind;
	private final String message;
	private final Token token; // Where the problem was found

	public SemanticError(Kind kind, String message, Token token)
	{
		this.kind = kind;
		this.message = message;
		this.token = token;
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getMessage()
	{
		return message;
	}

	public Token getToken()
	{
		return token;
	}

	@Override
	public String toString()
	{
		return kind + ": " + message + " (Line:" + token.getLine() + ", Col:" + token.getColumn() + ")";
	}
}
