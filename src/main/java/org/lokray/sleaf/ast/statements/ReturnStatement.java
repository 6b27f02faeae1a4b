package org.lokray.sleaf.ast.statements;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.ast.expressions.Expression;
import org.lokray.sleaf.lexer.Token;

/**
 * AST node representing a 'return' statement, with or without a value.
 */
public class ReturnStatement implements Statement
{
	private final Token keyword;
	private final Expression value; // Null for a bare 'return;'

	public ReturnStatement(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return "return" + (value != null ? " " + value : "") + ";";
	}
}
