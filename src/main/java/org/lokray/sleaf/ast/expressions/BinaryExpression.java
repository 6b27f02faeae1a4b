package org.lokray.sleaf.ast.expressions;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, c && d).
 * The ternary {@code c ? a : b} is also modeled with two of these: the outer node
 * uses the '?' token with the condition on the left, the inner one uses ':' and holds
 * both arms.
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator;
	private final Expression right;

	public BinaryExpression(Expression left, Token operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	/**
	 * Promotes to F64 when either operand is floating, otherwise I32.
	 */
	@Override
	public TokenType getResultType()
	{
		if (left.getResultType().isFloatingType() || right.getResultType().isFloatingType())
		{
			return TokenType.F64;
		}
		return TokenType.I32;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken(); // The first token of a binary expression is its left operand's first token
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getLexeme() + " " + right + ")";
	}
}
