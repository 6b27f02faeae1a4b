package org.lokray.sleaf.ast.expressions;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

/**
 * AST node representing a reference to a variable, parameter or function by name.
 */
public class IdentifierExpression implements Expression
{
	private final Token name;

	public IdentifierExpression(Token name)
	{
		this.name = name;
	}

	public Token getName()
	{
		return name;
	}

	@Override
	public TokenType getResultType()
	{
		return TokenType.I32;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
