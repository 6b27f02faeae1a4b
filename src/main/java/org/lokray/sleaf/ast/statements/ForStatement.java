package org.lokray.sleaf.ast.statements;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.ast.expressions.Expression;
import org.lokray.sleaf.lexer.Token;

/**
 * AST node for a C-style 'for' loop.
 * The parser desugars 'for' into blocks and a {@link WhileStatement}, so this node only
 * appears in trees built programmatically. Consumers still handle it.
 */
public class ForStatement implements Statement
{
	private final Token forKeyword;
	private final Statement initializer; // Can be null
	private final Expression condition;  // Can be null (loops forever)
	private final Expression increment;  // Can be null
	private final Statement body;

	public ForStatement(Token forKeyword, Statement initializer, Expression condition, Expression increment, Statement body)
	{
		this.forKeyword = forKeyword;
		this.initializer = initializer;
		this.condition = condition;
		this.increment = increment;
		this.body = body;
	}

	public Statement getInitializer()
	{
		return initializer;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Expression getIncrement()
	{
		return increment;
	}

	public Statement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return forKeyword;
	}

	@Override
	public String toString()
	{
		return "for (" + initializer + " " + condition + "; " + increment + ") " + body;
	}
}
