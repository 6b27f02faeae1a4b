package org.lokray.sleaf.ast;

import org.lokray.sleaf.lexer.Token;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * A node never prints, checks or lowers itself; every consumer is an {@link ASTVisitor}.
 */
public interface ASTNode
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
	 * @return The token this node starts at, used for positioned diagnostics.
	 */
	Token getFirstToken();
}
