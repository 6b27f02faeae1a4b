package org.lokray.sleaf.ast.expressions;

import org.lokray.sleaf.ast.ASTNode;
import org.lokray.sleaf.lexer.TokenType;

/**
 * Base interface for all expression nodes in the AST.
 */
public interface Expression extends ASTNode
{
	/**
	 * Returns the source-level type of this expression as a type keyword kind.
	 * Identifiers and calls are not resolved against their declarations and
	 * always report {@link TokenType#I32}.
	 */
	TokenType getResultType();
}
