package org.lokray.sleaf.ast.expressions;

import org.lokray.sleaf.ast.ASTVisitor;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;

/**
 * AST node representing a literal value (numbers, strings, characters, booleans).
 * The literal keeps its token; the value text is the lexeme exactly as scanned.
 */
public class LiteralExpression implements Expression
{
	private final Token literal;

	public LiteralExpression(Token literal)
	{
		this.literal = literal;
	}

	public Token getLiteral()
	{
		return literal;
	}

	public TokenType getKind()
	{
		return literal.getType();
	}

	public String getValue()
	{
		return literal.getLexeme();
	}

	@Override
	public TokenType getResultType()
	{
		switch (literal.getType())
		{
			case FLOAT_LITERAL:
				return TokenType.F64;
			case TRUE:
			case FALSE:
				return TokenType.BOOL;
			case STRING_LITERAL:
				return TokenType.STRING;
			case CHAR_LITERAL:
				return TokenType.CHAR;
			default:
				return TokenType.I32;
		}
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return literal;
	}

	@Override
	public String toString()
	{
		return literal.getLexeme();
	}
}
