package org.lokray.sleaf.ast.expressions;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node for a call: {@code callee(arg, ...)}.
 */
public class CallExpression implements Expression
{
	private final Expression callee;
	private final Token closingParen; // Position used when reporting call errors
	private final List<Expression> arguments;

	public CallExpression(Expression callee, Token closingParen, List<Expression> arguments)
	{
		this.callee = callee;
		this.closingParen = closingParen;
		this.arguments = List.copyOf(arguments);
	}

	public Expression getCallee()
	{
		return callee;
	}

	public Token getClosingParen()
	{
		return closingParen;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public TokenType getResultType()
	{
		return TokenType.I32;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return callee.getFirstToken();
	}

	@Override
	public String toString()
	{
		return callee + "(" + arguments.stream().map(Object::toString).collect(Collectors.joining(", ")) + ")";
	}
}
