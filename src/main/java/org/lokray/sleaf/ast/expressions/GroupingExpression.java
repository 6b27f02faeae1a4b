package org.lokray.sleaf.ast.expressions;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

/**
 * A parenthesized expression.
 */
public class GroupingExpression implements Expression
{
	private final Token leftParen;
	private final Expression expression;

	public GroupingExpression(Token leftParen, Expression expression)
	{
		this.leftParen = leftParen;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public TokenType getResultType()
	{
		return expression.getResultType();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGroupingExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen;
	}

	@Override
	public String toString()
	{
		return "(" + expression + ")";
	}
}
