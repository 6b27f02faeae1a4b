package org.lokray.sleaf.ast.expressions;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

/**
 * AST node for a unary operation: {@code !x}, {@code -x}, {@code ++x} or the postfix {@code x++}.
 */
public class UnaryExpression implements Expression
{
	private final Token operator;
	private final Expression operand;
	private final boolean postfix;

	public UnaryExpression(Token operator, Expression operand)
	{
		this(operator, operand, false);
	}

	public UnaryExpression(Token operator, Expression operand, boolean postfix)
	{
		this.operator = operator;
		this.operand = operand;
		this.postfix = postfix;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	public boolean isPostfix()
	{
		return postfix;
	}

	@Override
	public TokenType getResultType()
	{
		return operand.getResultType();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return postfix ? operand.getFirstToken() : operator;
	}

	@Override
	public String toString()
	{
		return postfix ? "(" + operand + operator.getLexeme() + ")" : "(" + operator.getLexeme() + operand + ")";
	}
}
