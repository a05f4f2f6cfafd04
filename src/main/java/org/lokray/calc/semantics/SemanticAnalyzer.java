package org.lokray.calc.semantics;

import org.lokray.calc.ast.ASTNode;
import org.lokray.calc.ast.ASTVisitor;
import org.lokray.calc.ast.BinaryOp;
import org.lokray.calc.ast.Expression;
import org.lokray.calc.ast.Factor;
import org.lokray.calc.ast.WithDecl;
import org.lokray.calc.lexer.Token;
import org.lokray.calc.util.Debug;
import org.lokray.calc.util.ErrorReporter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Checks that every variable is declared exactly once before it is used.
 * <p>
 * A single top-down pass over a finished tree. The tree is never modified and
 * analysis does not stop at the first problem: every duplicate declaration and
 * every undeclared use is reported. Per-run state lives in the {@link Scope}
 * handed to the traversal, so one analyzer can check any number of trees.
 */
public class SemanticAnalyzer
{
	private final ErrorReporter errorReporter;

	public SemanticAnalyzer(ErrorReporter errorReporter)
	{
		this.errorReporter = errorReporter;
	}

	/**
	 * Analyzes the parser's result. No tree means nothing to check: the caller
	 * already knows parsing failed.
	 */
	public AnalysisResult analyze(Optional<ASTNode> root)
	{
		return root.map(this::analyze).orElseGet(() -> new AnalysisResult(List.of()));
	}

	public AnalysisResult analyze(ASTNode root)
	{
		return analyze(root, new Scope());
	}

	/**
	 * Analyzes a tree against an explicit scope. Declarations found in the tree
	 * are added to {@code scope}.
	 *
	 * @param root  The program root.
	 * @param scope The names considered declared before the program starts.
	 * @return Every error found.
	 */
	public AnalysisResult analyze(ASTNode root, Scope scope)
	{
		Debug.log("Starting semantic analysis...");
		Debug.indent();
		DeclarationCheck check = new DeclarationCheck(scope);
		root.accept(check);
		Debug.dedent();
		Debug.log("Semantic analysis finished with %d error(s). %s", check.errors.size(), scope);
		return new AnalysisResult(check.errors);
	}

	/**
	 * An operand still to be checked; {@code expression} is null when recovery dropped it.
	 */
	private static final class Operand
	{
		final BinaryOp parent;
		final Expression expression;

		Operand(BinaryOp parent, Expression expression)
		{
			this.parent = parent;
			this.expression = expression;
		}
	}

	private class DeclarationCheck implements ASTVisitor<Void>
	{
		private final Scope scope;
		private final List<SemanticError> errors = new ArrayList<>();

		DeclarationCheck(Scope scope)
		{
			this.scope = scope;
		}

		@Override
		public Void visitFactor(Factor factor)
		{
			if (factor.getKind() == Factor.Kind.IDENTIFIER && !scope.isDeclared(factor.getValue()))
			{
				error(SemanticError.Kind.UNDECLARED_USE, "Variable " + factor.getValue() + " not declared", factor.getToken());
			}
			return null;
		}

		/**
		 * Walks the operator tree with an explicit stack, left operand first so
		 * errors come out in source order.
		 */
		@Override
		public Void visitBinaryOp(BinaryOp binaryOp)
		{
			Deque<Operand> pending = new ArrayDeque<>();
			pending.push(new Operand(null, binaryOp));
			while (!pending.isEmpty())
			{
				Operand next = pending.pop();
				if (next.expression == null)
				{
					error(SemanticError.Kind.MISSING_OPERAND, "Missing operand for '" + next.parent.getOperator().getSymbol() + "'", next.parent.getOperatorToken());
				}
				else if (next.expression instanceof BinaryOp)
				{
					BinaryOp op = (BinaryOp) next.expression;
					pending.push(new Operand(op, op.getRight().orElse(null)));
					pending.push(new Operand(op, op.getLeft().orElse(null)));
				}
				else
				{
					next.expression.accept(this);
				}
			}
			return null;
		}

		@Override
		public Void visitWithDecl(WithDecl withDecl)
		{
			for (Token variable : withDecl.getVariables())
			{
				Debug.log("Declaring %s", variable.getLexeme());
				if (!scope.declare(variable.getLexeme()))
				{
					error(SemanticError.Kind.DUPLICATE_DECLARATION, "Variable " + variable.getLexeme() + " already declared", variable);
				}
			}

			if (withDecl.getBody().isPresent())
			{
				withDecl.getBody().get().accept(this);
			}
			else
			{
				error(SemanticError.Kind.MISSING_BODY, "Missing expression after declarations", withDecl.getFirstToken());
			}
			return null;
		}

		private void error(SemanticError.Kind kind, String message, Token token)
		{
			errors.add(new SemanticError(kind, message, token));
			errorReporter.report(token.getLine(), token.getColumn(), message);
		}
	}
}
