package org.lokray.calc.ast;

import org.lokray.calc.lexer.Token;
import org.lokray.calc.lexer.TokenType;

/**
 * Leaf node: a number literal or a variable reference.
 */
public final class Factor implements Expression
{
	public enum Kind
	{
		NUMBER, IDENTIFIER
	}

	private final Kind kind;
	private final Token token; // The NUMBER or IDENTIFIER token

	public Factor(Kind kind, Token token)
	{
		TokenType expected = kind == Kind.NUMBER ? TokenType.NUMBER : TokenType.IDENTIFIER;
		if (token.getType() != expected)
		{
			throw new IllegalArgumentException("Token for a " + kind + " factor must be " + expected + ", got " + token.getType() + ".");
		}
		this.kind = kind;
		this.token = token;
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * @return The literal digits or the identifier name.
	 */
	public String getValue()
	{
		return token.getLexeme();
	}

	public Token getToken()
	{
		return token;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFactor(this);
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public String toString()
	{
		return token.getLexeme();
	}
}
