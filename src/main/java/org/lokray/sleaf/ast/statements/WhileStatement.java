package org.lokray.sleaf.ast.statements;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.ast.expressions.Expression;
import org.lokray.sleaf.lexer.Token;

/**
 * AST node for a 'while' loop. Desugared 'for' loops also end up here.
 */
public class WhileStatement implements Statement
{
	private final Token keyword;
	private final Expression condition;
	private final Statement body;

	public WhileStatement(Token keyword, Expression condition, Statement body)
	{
		this.keyword = keyword;
		this.condition = condition;
		this.body = body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return "while (" + condition + ") " + body;
	}
}
