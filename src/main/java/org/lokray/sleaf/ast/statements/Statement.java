package org.lokray.sleaf.ast.statements;

import org.lokray.sleaf.ast.ASTNode;

/**
 * Marker interface for all statement nodes in the AST.
 */
public interface Statement extends ASTNode
{
}
