package org.lokray.sleaf.ast.statements;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.ast.expressions.Expression;
import org.lokray.sleaf.lexer.Token;

/**
 * AST node representing an 'if-else' statement.
 * Includes a condition, a 'then' branch and an optional 'else' branch.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;
	private final Expression condition;
	private final Statement thenBranch;
	private final Statement elseBranch; // Null when there is no 'else'

	/**
	 * Constructs an IfStatement.
	 *
	 * @param ifKeyword  The 'if' keyword token.
	 * @param condition  The expression for the condition.
	 * @param thenBranch The statement or block to execute if the condition is true.
	 * @param elseBranch The optional statement or block to execute if the condition is false.
	 */
	public IfStatement(Token ifKeyword, Expression condition, Statement thenBranch, Statement elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Statement getThenBranch()
	{
		return thenBranch;
	}

	public Statement getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return ifKeyword;
	}

	@Override
	public String toString()
	{
		return "if (" + condition + ") " + thenBranch + (elseBranch != null ? " else " + elseBranch : "");
	}
}
