package org.lokray.calc.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the calc Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * and its position in the source for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, NUMBER, PLUS)
	private final String lexeme;     // The exact slice of the source (e.g., "x", "123", "+")
	private final int line;          // The line number in the source where the token starts
	private final int column;        // The column number in the source where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type   The TokenType of this token.
	 * @param lexeme The raw string value of the token from the source code.
	 * @param line   The line number where this token begins.
	 * @param column The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, int line, int column)
	{
		this.type = Objects.requireNonNull(type);
		this.lexeme = Objects.requireNonNull(lexeme);
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public boolean is(TokenType expected)
	{
		return type == expected;
	}

	public boolean isOneOf(TokenType... candidates)
	{
		for (TokenType candidate : candidates)
		{
			if (type == candidate)
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Format: "TokenType 'lexeme' (Line:Column)"
	 */
	@Override
	public String toString()
	{
		return type + " '" + lexeme + "' (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Compares type and lexeme only. Tokens at different positions with the same
	 * text are the same token for testing purposes.
	 */
	@Override
	public boolean equals(Object o)
	{
		if(this == o)
			return true;
		if(o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;
		return type == token.type && lexeme.equals(token.lexeme);
	}

	@Override
	public int hashCode()
	{
		return 31 * type.hashCode() + lexeme.hashCode();
	}
}
