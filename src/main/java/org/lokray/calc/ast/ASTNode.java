package org.lokray.calc.ast;

import org.lokray.calc.lexer.Token;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * The set of nodes is closed: a program root is either a bare {@link Expression}
 * or a {@link WithDecl}.
 */
public sealed interface ASTNode permits Expression, WithDecl
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);

	/**
	 * Returns the first token that constitutes this node.
	 * Used to pinpoint diagnostics.
	 *
	 * @return The first Token of this node.
	 */
	Token getFirstToken();
}
