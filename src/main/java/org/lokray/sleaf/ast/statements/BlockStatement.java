package org.lokray.sleaf.ast.statements;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;

import java.util.List;

/**
 * AST node representing a block of statements enclosed in curly braces.
 * Blocks synthesized by the parser (for-loop desugaring) carry the token of the
 * construct they were built from.
 */
public class BlockStatement implements Statement
{
	private final Token leftBrace;
	private final List<Statement> statements;

	public BlockStatement(Token leftBrace, List<Statement> statements)
	{
		this.leftBrace = leftBrace;
		this.statements = List.copyOf(statements);
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftBrace;
	}

	@Override
	public String toString()
	{
		return "Block" + statements;
	}
}
