package org.lokray.calc.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw calc source and hands out one Token per call to {@link #next()}.
 * The parser pulls tokens on demand; nothing is buffered ahead of the cursor.
 */
public class Lexer
{
	private static final String WITH_KEYWORD = "with";

	private final String source; // The raw source code string

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;

	/**
	 * Constructs a Lexer.
	 *
	 * @param source The source code string to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source == null ? "" : source;
	}

	/**
	 * Scans the next token. Once the input is exhausted every further call
	 * returns an EOF token.
	 *
	 * @return The next token in the stream.
	 */
	public Token next()
	{
		skipWhitespace();

		start = current;
		startLine = line;
		startColumn = column;

		if (isAtEnd())
		{
			return new Token(TokenType.EOF, "", startLine, startColumn);
		}

		char c = advance();

		if (isLetter(c))
		{
			return scanIdentifier();
		}
		if (isDigit(c))
		{
			return scanNumber();
		}

		switch (c)
		{
			case '+':
				return makeToken(TokenType.PLUS);
			case '-':
				return makeToken(TokenType.MINUS);
			case '*':
				return makeToken(TokenType.STAR);
			case '/':
				return makeToken(TokenType.SLASH);
			case '(':
				return makeToken(TokenType.LEFT_PAREN);
			case ')':
				return makeToken(TokenType.RIGHT_PAREN);
			case ':':
				return makeToken(TokenType.COLON);
			case ',':
				return makeToken(TokenType.COMMA);
			default:
				// Exactly one character; the parser decides what to make of it.
				return makeToken(TokenType.UNKNOWN);
		}
	}

	/**
	 * Scans the entire source code and returns a list of tokens.
	 * The list always ends with exactly one EOF token.
	 */
	public List<Token> scanTokens()
	{
		List<Token> tokens = new ArrayList<>();
		Token token;
		do
		{
			token = next();
			tokens.add(token);
		}
		while (!token.is(TokenType.EOF));
		return tokens;
	}

	private void skipWhitespace()
	{
		while (!isAtEnd() && isWhitespace(peek()))
		{
			advance();
		}
	}

	/**
	 * An identifier starts with a letter and runs over letters and digits.
	 * Only the whole run "with" is the keyword, so "with12" stays one identifier.
	 */
	private Token scanIdentifier()
	{
		while (isLetter(peek()) || isDigit(peek()))
		{
			advance();
		}
		String text = source.substring(start, current);
		return makeToken(text.equals(WITH_KEYWORD) ? TokenType.WITH : TokenType.IDENTIFIER);
	}

	private Token scanNumber()
	{
		while (isDigit(peek()))
		{
			advance();
		}
		return makeToken(TokenType.NUMBER);
	}

	private Token makeToken(TokenType type)
	{
		return new Token(type, source.substring(start, current), startLine, startColumn);
	}

	/**
	 * Consumes the current character and returns it, also updates line/column.
	 *
	 * @return The consumed character.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
		return c;
	}

	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	// ASCII only: Character.isLetter would accept accented letters and other scripts.
	private static boolean isLetter(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isWhitespace(char c)
	{
		return c == ' ' || c == '\t' || c == '\f' || c == '\u000B' || c == '\r' || c == '\n';
	}
}
