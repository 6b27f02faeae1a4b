package org.lokray.sleaf.ast.statements;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.ast.expressions.Expression;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

/**
 * AST node for {@code var name: type (= init)?;} and {@code const name: type = init;}.
 */
public class VariableDeclarationStatement implements Statement
{
	private final Token keyword; // 'var' or 'const'
	private final Token name;
	private final Token type;
	private final Expression initializer; // Can be null for 'var'

	public VariableDeclarationStatement(Token keyword, Token name, Token type, Expression initializer)
	{
		this.keyword = keyword;
		this.name = name;
		this.type = type;
		this.initializer = initializer;
	}

	public Token getName()
	{
		return name;
	}

	public Token getType()
	{
		return type;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	public boolean isConst()
	{
		return keyword.getType() == TokenType.CONST;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclarationStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return keyword.getLexeme() + " " + name.getLexeme() + ": " + type.getLexeme()
				+ (initializer != null ? " = " + initializer : "") + ";";
	}
}
