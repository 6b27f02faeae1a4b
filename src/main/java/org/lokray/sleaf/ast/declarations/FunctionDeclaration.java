package org.lokray.sleaf.ast.declarations;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.ast.statements.BlockStatement;
import org.lokray.sleaf.ast.statements.Statement;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

import java.util.List;

/**
 * AST node for a function declaration:
 * {@code func name(p: type, ...) -> returnType { body }}.
 * When the arrow clause is omitted the function returns {@code void}.
 */
public class FunctionDeclaration implements Statement
{
	private final Token funcKeyword;
	private final Token name;
	private final List<Parameter> parameters;
	private final Token returnType; // Null when no '->' clause was written
	private final BlockStatement body;

	public FunctionDeclaration(Token funcKeyword, Token name, List<Parameter> parameters, Token returnType, BlockStatement body)
	{
		this.funcKeyword = funcKeyword;
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.returnType = returnType;
		this.body = body;
	}

	public Token getName()
	{
		return name;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public Token getReturnType()
	{
		return returnType;
	}

	/**
	 * @return The declared return kind, {@link TokenType#VOID} when no arrow clause exists.
	 */
	public TokenType getReturnKind()
	{
		return returnType != null ? returnType.getType() : TokenType.VOID;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return funcKeyword;
	}

	@Override
	public String toString()
	{
		return "func " + name.getLexeme() + "(" + parameters + ") -> " + getReturnKind();
	}
}
