package org.lokray.calc.ast;

import org.lokray.calc.lexer.Token;
import org.lokray.calc.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * AST node representing a binary operation (e.g., a + b, x / 2).
 * <p>
 * After factor-level error recovery an operand can be missing. The getters
 * return {@link Optional} so every consumer has to deal with that case.
 */
public final class BinaryOp implements Expression
{
	public enum Operator
	{
		PLUS("+"), MINUS("-"), MUL("*"), DIV("/");

		private final String symbol;

		Operator(String symbol)
		{
			this.symbol = symbol;
		}

		public String getSymbol()
		{
			return symbol;
		}

		public static Operator fromToken(Token token)
		{
			switch (token.getType())
			{
				case PLUS:
					return PLUS;
				case MINUS:
					return MINUS;
				case STAR:
					return MUL;
				case SLASH:
					return DIV;
				default:
					throw new IllegalArgumentException("Not a binary operator: " + token);
			}
		}
	}

	private static final String MISSING = "<missing>";

	private final Operator operator;
	private final Token operatorToken; // The binary operator token (PLUS, MINUS, STAR or SLASH)
	private final Expression left; // null when recovery dropped the operand
	private final Expression right; // null when recovery dropped the operand

	public BinaryOp(Token operatorToken, Expression left, Expression right)
	{
		if (!operatorToken.isOneOf(TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH))
		{
			throw new IllegalArgumentException("Token for BinaryOp must be an arithmetic operator, got " + operatorToken.getType() + ".");
		}
		this.operator = Operator.fromToken(operatorToken);
		this.operatorToken = operatorToken;
		this.left = left;
		this.right = right;
	}

	public Operator getOperator()
	{
		return operator;
	}

	public Token getOperatorToken()
	{
		return operatorToken;
	}

	public Optional<Expression> getLeft()
	{
		return Optional.ofNullable(left);
	}

	public Optional<Expression> getRight()
	{
		return Optional.ofNullable(right);
	}

	/**
	 * @return True if neither operand was lost to error recovery.
	 */
	public boolean isComplete()
	{
		return left != null && right != null;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryOp(this);
	}

	@Override
	public Token getFirstToken()
	{
		BinaryOp node = this;
		while (node.left instanceof BinaryOp)
		{
			node = (BinaryOp) node.left;
		}
		return node.left != null ? node.left.getFirstToken() : node.operatorToken;
	}

	/**
	 * Fully parenthesized form, e.g. {@code ((1 + 2) * x)}. Built with an explicit
	 * stack: operator chains can be as deep as the input is long.
	 */
	@Override
	public String toString()
	{
		StringBuilder text = new StringBuilder();
		Deque<Object> pending = new ArrayDeque<>();
		pending.push(this);
		while (!pending.isEmpty())
		{
			Object next = pending.pop();
			if (next instanceof BinaryOp)
			{
				BinaryOp op = (BinaryOp) next;
				text.append('(');
				pending.push(")");
				pending.push(op.right == null ? MISSING : op.right);
				pending.push(" " + op.operator.getSymbol() + " ");
				pending.push(op.left == null ? MISSING : op.left);
			}
			else
			{
				text.append(next);
			}
		}
		return text.toString();
	}
}
