package org.lokray.sleaf.ast.declarations;

import org.lokray.sleaf.ast.ASTNode;
import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;

/**
 * A single function parameter: {@code name: type}.
 */
public class Parameter implements ASTNode
{
	private final Token name;
	private final Token type; // One of the primitive type keywords

	public Parameter(Token name, Token type)
	{
		this.name = name;
		this.type = type;
	}

	public Token getName()
	{
		return name;
	}

	public Token getType()
	{
		return type;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitParameter(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return name.getLexeme() + ": " + type.getLexeme();
	}
}
