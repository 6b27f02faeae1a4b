package org.lokray.sleaf.ast.expressions;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

/**
 * AST node for {@code name = value} and {@code name += value}.
 * Only identifiers are valid targets; the parser rejects anything else.
 */
public class AssignmentExpression implements Expression
{
	private final Token name;
	private final Token operator; // EQUAL or PLUS_EQUAL
	private final Expression value;

	public AssignmentExpression(Token name, Token operator, Expression value)
	{
		this.name = name;
		this.operator = operator;
		this.value = value;
	}

	public Token getName()
	{
		return name;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getValue()
	{
		return value;
	}

	public boolean isCompound()
	{
		return operator.getType() == TokenType.PLUS_EQUAL;
	}

	@Override
	public TokenType getResultType()
	{
		return value.getResultType();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return name.getLexeme() + " " + operator.getLexeme() + " " + value;
	}
}
