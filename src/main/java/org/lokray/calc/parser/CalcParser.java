package org.lokray.calc.parser;

import org.lokray.calc.ast.ASTNode;
import org.lokray.calc.ast.BinaryOp;
import org.lokray.calc.ast.Expression;
import org.lokray.calc.ast.Factor;
import org.lokray.calc.ast.WithDecl;
import org.lokray.calc.lexer.Lexer;
import org.lokray.calc.lexer.Token;
import org.lokray.calc.lexer.TokenType;
import org.lokray.calc.util.Debug;
import org.lokray.calc.util.ErrorReporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The CalcParser is responsible for performing syntactic analysis.
 * It pulls tokens from the lexer one at a time and builds an Abstract Syntax
 * Tree with a recursive-descent approach over the LL(1) grammar:
 * <pre>
 * Program := ( 'with' Ident (',' Ident)* ':' )? Expr
 * Expr    := Term (('+' | '-') Term)*
 * Term    := Factor (('*' | '/') Factor)*
 * Factor  := Number | Ident | '(' Expr ')'
 * </pre>
 * Errors never escape {@link #parse()}. A broken factor is skipped up to the
 * next operator, ')' or end of input and left out of the tree; a broken
 * declaration header, trailing garbage or parentheses nested deeper than
 * {@link #MAX_NESTING_DEPTH} discard the whole program.
 */
public class CalcParser
{
	/**
	 * Tokens that can legally follow a factor. Factor-level recovery stops here.
	 */
	private static final Set<TokenType> FACTOR_FOLLOW = Collections.unmodifiableSet(EnumSet.of(
			TokenType.RIGHT_PAREN, TokenType.STAR, TokenType.PLUS, TokenType.MINUS, TokenType.SLASH, TokenType.EOF));

	private static final Set<TokenType> END_OF_INPUT = Collections.unmodifiableSet(EnumSet.of(TokenType.EOF));

	/**
	 * Deepest parenthesis nesting accepted. Each level costs a few stack frames here.
	 */
	static final int MAX_NESTING_DEPTH = 256;

	private final Lexer lexer;
	private final ErrorReporter errorReporter; // For reporting parsing errors
	private Token current; // One token of lookahead
	private boolean hasErrors = false;
	private int nestingDepth = 0; // Parentheses currently open

	/**
	 * Constructs a CalcParser and primes the lookahead token.
	 *
	 * @param lexer         The token source.
	 * @param errorReporter An instance of ErrorReporter for handling parsing errors.
	 */
	public CalcParser(Lexer lexer, ErrorReporter errorReporter)
	{
		this.lexer = lexer;
		this.errorReporter = errorReporter;
		this.current = lexer.next();
	}

	/**
	 * Parses a whole program.
	 * <p>
	 * An empty result means the program was discarded. A present result can
	 * still contain nodes with missing operands, so callers must also check
	 * {@link #hasErrors()}.
	 *
	 * @return The root of the parsed AST, or empty if parsing failed at program level.
	 */
	public Optional<ASTNode> parse()
	{
		Debug.log("Parsing program...");
		Debug.indent();
		try
		{
			Optional<ASTNode> root = Optional.ofNullable(program());
			if (Debug.isEnabled())
			{
				Debug.log("Parsed: %s", root.map(Object::toString).orElse("<nothing>"));
			}
			return root;
		}
		catch (SyntaxError e)
		{
			skipUntil(END_OF_INPUT);
			Debug.log("Program discarded after a syntax error.");
			return Optional.empty();
		}
		finally
		{
			Debug.dedent();
		}
	}

	/**
	 * @return True if any syntax error was reported during {@link #parse()}.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	/**
	 * Grammar: `( WITH IDENTIFIER ( , IDENTIFIER )* : )? EXPR EOF`
	 *
	 * @return The root node, or null if the expression itself was lost to recovery.
	 * @throws SyntaxError if the header is malformed or input remains after the expression.
	 */
	private ASTNode program() throws SyntaxError
	{
		Token withKeyword = null;
		List<Token> variables = new ArrayList<>();

		if (current.is(TokenType.WITH))
		{
			withKeyword = advance();
			variables.add(consume(TokenType.IDENTIFIER, "Expected a variable name after 'with'."));
			while (match(TokenType.COMMA))
			{
				variables.add(consume(TokenType.IDENTIFIER, "Expected a variable name after ','."));
			}
			consume(TokenType.COLON, "Expected ':' after the declared variables.");
		}

		Expression body = expression();

		if (!current.is(TokenType.EOF))
		{
			throw error(current, "Expected end of input.");
		}

		if (withKeyword == null)
		{
			return body;
		}
		return new WithDecl(withKeyword, variables, body);
	}

	/**
	 * Grammar: `TERM ( ( + | - ) TERM )*`
	 */
	private Expression expression()
	{
		Expression expr = term();

		while (current.isOneOf(TokenType.PLUS, TokenType.MINUS))
		{
			Token operator = advance();
			Expression right = term();
			expr = new BinaryOp(operator, expr, right);
		}
		return expr;
	}

	/**
	 * Grammar: `FACTOR ( ( * | / ) FACTOR )*`
	 */
	private Expression term()
	{
		Expression expr = factor();

		while (current.isOneOf(TokenType.STAR, TokenType.SLASH))
		{
			Token operator = advance();
			Expression right = factor();
			expr = new BinaryOp(operator, expr, right);
		}
		return expr;
	}

	/**
	 * Grammar: `NUMBER | IDENTIFIER | ( EXPR )`
	 *
	 * @return The factor, or null if no factor could be formed here.
	 * @throws SyntaxError if parentheses nest deeper than {@link #MAX_NESTING_DEPTH}.
	 */
	private Expression factor() throws SyntaxError
	{
		switch (current.getType())
		{
			case NUMBER:
				return new Factor(Factor.Kind.NUMBER, advance());
			case IDENTIFIER:
				return new Factor(Factor.Kind.IDENTIFIER, advance());
			case LEFT_PAREN:
				if (nestingDepth == MAX_NESTING_DEPTH)
				{
					throw error(current, "Parentheses nested deeper than " + MAX_NESTING_DEPTH + " levels.");
				}
				advance();
				nestingDepth++;
				Expression inner = expression();
				nestingDepth--;
				if (!match(TokenType.RIGHT_PAREN))
				{
					error(current, "Expected ')' after expression.");
					skipUntil(FACTOR_FOLLOW);
				}
				return inner;
			default:
				error(current, "Expected a number, a variable or '('.");
				skipUntil(FACTOR_FOLLOW);
				return null;
		}
	}

	/**
	 * Panic-mode primitive shared by both recovery levels: discards tokens until
	 * one in {@code stopSet} (or end of input) is current.
	 *
	 * @param stopSet The synchronization tokens.
	 * @return The token the parser stopped at.
	 */
	private Token skipUntil(Set<TokenType> stopSet)
	{
		while (!current.is(TokenType.EOF) && !stopSet.contains(current.getType()))
		{
			Debug.log("Skipping %s", current);
			advance();
		}
		return current;
	}

	/**
	 * Consumes the current token if its type matches.
	 *
	 * @param type The TokenType to match against.
	 * @return True if the token matched and was consumed, false otherwise.
	 */
	private boolean match(TokenType type)
	{
		if (current.is(type))
		{
			advance();
			return true;
		}
		return false;
	}

	/**
	 * Consumes the current token if it has the expected type; otherwise reports
	 * a syntax error and throws.
	 *
	 * @param type    The expected TokenType.
	 * @param message The error message to report if the type doesn't match.
	 * @return The consumed Token.
	 * @throws SyntaxError if the current token's type does not match the expected type.
	 */
	private Token consume(TokenType type, String message) throws SyntaxError
	{
		if (current.is(type))
		{
			return advance();
		}
		throw error(current, message);
	}

	/**
	 * Moves the lookahead forward. The lexer keeps returning EOF at the end,
	 * so this is safe to call there.
	 *
	 * @return The token that was current before the call.
	 */
	private Token advance()
	{
		Token consumed = current;
		current = lexer.next();
		return consumed;
	}

	/**
	 * Reports a parsing error and creates a SyntaxError.
	 *
	 * @param token   The token where the error occurred.
	 * @param message The error message.
	 * @return A new SyntaxError instance.
	 */
	private SyntaxError error(Token token, String message)
	{
		hasErrors = true;
		errorReporter.report(token.getLine(), token.getColumn(), "Unexpected: " + describe(token) + ". " + message);
		return new SyntaxError();
	}

	private static String describe(Token token)
	{
		return token.is(TokenType.EOF) ? "end of input" : "'" + token.getLexeme() + "'";
	}

	/**
	 * Unwinds the parser from a malformed program header or trailing input
	 * back to {@link #parse()}, which then skips to the end of input.
	 */
	private static class SyntaxError extends RuntimeException
	{
		SyntaxError()
		{
			super(null, null, false, false);
		}
	}
}
