package org.lokray.sleaf.ast.statements;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.ast.expressions.Expression;
import org.lokray.sleaf.lexer.Token;

/**
 * An expression evaluated for its side effects, followed by ';'.
 */
public class ExpressionStatement implements Statement
{
	private final Expression expression;

	public ExpressionStatement(Expression expression)
	{
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return expression.getFirstToken();
	}

	@Override
	public String toString()
	{
		return expression + ";";
	}
}
