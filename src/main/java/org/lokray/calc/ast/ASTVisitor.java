package org.lokray.calc.ast;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to one node of the closed node set, so an
 * implementation that compiles handles every variant.
 *
 * @param <R> The return value type of the `visit` methods.
 */
public interface ASTVisitor<R>
{
	R visitFactor(Factor factor);

	R visitBinaryOp(BinaryOp binaryOp);

	R visitWithDecl(WithDecl withDecl);
}
