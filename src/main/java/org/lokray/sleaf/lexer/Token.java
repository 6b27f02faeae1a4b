package org.lokray.sleaf.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the SLEAF Lexer.
 * A token is immutable: its kind, the exact text it was scanned from
 * and the 1-based position where it starts.
 * For ERROR tokens the lexeme holds a human-readable diagnostic instead of source text.
 */
public class Token
{
	private final TokenType type;   // The classification of the token (e.g., IDENTIFIER, INT_LITERAL, PLUS)
	private final String lexeme;    // The source text of the token, or the diagnostic for ERROR tokens
	private final int line;         // Line where the token starts
	private final int column;       // Column where the token starts

	public Token(TokenType type, String lexeme, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Format used by the lexer dump: "[line:col] TYPE 'lexeme'".
	 */
	@Override
	public String toString()
	{
		return "[" + line + ":" + column + "] " + type + " '" + lexeme + "'";
	}

	/**
	 * Tokens are equal when kind and lexeme match; the position is ignored so that
	 * a token re-scanned from a different offset still compares equal.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;
		return type == token.type && Objects.equals(lexeme, token.lexeme);
	}

	@Override
	public int hashCode()
	{
		return 31 * type.hashCode() + (lexeme != null ? lexeme.hashCode() : 0);
	}
}
