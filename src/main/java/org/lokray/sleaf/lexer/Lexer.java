package org.lokray.sleaf.lexer;

import java.util.HashMap;
import java.util.Map;

/**
 * The Lexer performs lexical analysis on SLEAF source text.
 * It is pull-based: every call to {@link #scanToken()} returns exactly one token and
 * advances the cursor. Once the end of input is reached, END_OF_FILE is returned forever.
 * <p>
 * Lexical problems never throw; they are materialized as ERROR tokens whose lexeme is
 * the diagnostic message.
 */
public class Lexer
{
	private final String source; // The raw source code string

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	// Position where the token being scanned begins
	private int startLine = 1;
	private int startColumn = 1;

	// Static map to store reserved keywords for quick lookup
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("func", TokenType.FUNC);
		keywords.put("return", TokenType.RETURN);
		keywords.put("i8", TokenType.I8);
		keywords.put("i16", TokenType.I16);
		keywords.put("i32", TokenType.I32);
		keywords.put("i64", TokenType.I64);
		keywords.put("u8", TokenType.U8);
		keywords.put("u16", TokenType.U16);
		keywords.put("u32", TokenType.U32);
		keywords.put("u64", TokenType.U64);
		keywords.put("f32", TokenType.F32);
		keywords.put("f64", TokenType.F64);
		keywords.put("bool", TokenType.BOOL);
		keywords.put("string", TokenType.STRING);
		keywords.put("char", TokenType.CHAR);
		keywords.put("void", TokenType.VOID);
		keywords.put("true", TokenType.TRUE);
		keywords.put("false", TokenType.FALSE);
		keywords.put("if", TokenType.IF);
		keywords.put("else", TokenType.ELSE);
		keywords.put("while", TokenType.WHILE);
		keywords.put("for", TokenType.FOR);
		keywords.put("struct", TokenType.STRUCT);
		keywords.put("import", TokenType.IMPORT);
		keywords.put("const", TokenType.CONST);
		keywords.put("var", TokenType.VAR);
	}

	/**
	 * Constructs a Lexer over a fully loaded source buffer.
	 *
	 * @param source The source code string to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source;
	}

	/**
	 * Scans and returns the next token.
	 */
	public Token scanToken()
	{
		skipWhitespaceAndComments();

		start = current;
		startLine = line;
		startColumn = column;

		if (isAtEnd())
		{
			return new Token(TokenType.END_OF_FILE, "", line, column);
		}

		char c = advance();

		if (isAlpha(c))
		{
			return scanIdentifier();
		}
		if (isDigit(c))
		{
			return scanNumber();
		}

		switch (c)
		{
			// --- Single-character tokens ---
			case '(':
				return makeToken(TokenType.LEFT_PAREN);
			case ')':
				return makeToken(TokenType.RIGHT_PAREN);
			case '{':
				return makeToken(TokenType.LEFT_BRACE);
			case '}':
				return makeToken(TokenType.RIGHT_BRACE);
			case '[':
				return makeToken(TokenType.LEFT_BRACKET);
			case ']':
				return makeToken(TokenType.RIGHT_BRACKET);
			case ',':
				return makeToken(TokenType.COMMA);
			case ';':
				return makeToken(TokenType.SEMICOLON);
			case ':':
				return makeToken(TokenType.COLON);
			case '.':
				return makeToken(TokenType.DOT);
			case '?':
				return makeToken(TokenType.QUESTION);
			case '*':
				return makeToken(TokenType.STAR);
			case '/':
				return makeToken(TokenType.SLASH);
			case '%':
				return makeToken(TokenType.PERCENT);

			// --- Operators that can be single or double characters ---
			case '+':
				if (match('+'))
				{
					return makeToken(TokenType.PLUS_PLUS);
				}
				if (match('='))
				{
					return makeToken(TokenType.PLUS_EQUAL);
				}
				return makeToken(TokenType.PLUS);
			case '-':
				return makeToken(match('>') ? TokenType.ARROW : TokenType.MINUS);
			case '=':
				return makeToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
			case '!':
				return makeToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
			case '<':
				return makeToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
			case '>':
				return makeToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
			case '&':
				return makeToken(match('&') ? TokenType.AND_AND : TokenType.AMPERSAND);
			case '|':
				return makeToken(match('|') ? TokenType.OR_OR : TokenType.PIPE);

			// --- Literals ---
			case '"':
				return scanString();
			case '\'':
				return scanCharacter();

			default:
				return errorToken("Unexpected character: " + c);
		}
	}

	/**
	 * Skips spaces, tabs, newlines and both comment forms.
	 * An unterminated block comment consumes the rest of the input.
	 */
	private void skipWhitespaceAndComments()
	{
		while (!isAtEnd())
		{
			char c = peek();
			switch (c)
			{
				case ' ':
				case '\r':
				case '\t':
				case '\n':
					advance();
					break;
				case '/':
					if (peekNext() == '/')
					{
						while (peek() != '\n' && !isAtEnd())
						{
							advance();
						}
					}
					else if (peekNext() == '*')
					{
						advance(); // Consume '/'
						advance(); // Consume '*'
						while (!isAtEnd() && !(peek() == '*' && peekNext() == '/'))
						{
							advance();
						}
						if (!isAtEnd())
						{
							advance(); // Consume '*'
							advance(); // Consume '/'
						}
					}
					else
					{
						return;
					}
					break;
				default:
					return;
			}
		}
	}

	private Token scanIdentifier()
	{
		while (isAlphaNumeric(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);
		TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
		return makeToken(type);
	}

	/**
	 * Scans a numeric literal. Handles the 0x/0b prefixes, '_' separators, a single
	 * decimal point and a decimal exponent.
	 */
	private Token scanNumber()
	{
		boolean isFloat = false;
		boolean isHex = false;
		boolean isBinary = false;

		// The prefix only counts directly after a lone leading '0'
		if (current - start == 1 && source.charAt(start) == '0')
		{
			if (peek() == 'x')
			{
				isHex = true;
				advance();
			}
			else if (peek() == 'b')
			{
				isBinary = true;
				advance();
			}
		}

		while (!isAtEnd())
		{
			char c = peek();
			if (c == '.')
			{
				if (isFloat || isHex || isBinary)
				{
					return errorToken("Invalid numeric format");
				}
				isFloat = true;
				advance();
			}
			else if (c == '_')
			{
				advance();
			}
			else if (isHex ? isHexDigit(c) : isBinary ? isBinaryDigit(c) : isDigit(c))
			{
				advance();
			}
			else
			{
				break;
			}
		}

		if (!isHex && !isBinary && (peek() == 'e' || peek() == 'E'))
		{
			isFloat = true;
			advance(); // Consume 'e'

			if (peek() == '+' || peek() == '-')
			{
				advance();
			}

			while (isDigit(peek()))
			{
				advance();
			}
		}

		return makeToken(isFloat ? TokenType.FLOAT_LITERAL : TokenType.INT_LITERAL);
	}

	/**
	 * Scans a string literal. A backslash skips the following character; escapes are
	 * decoded later by the code generator.
	 */
	private Token scanString()
	{
		while (!isAtEnd() && peek() != '"')
		{
			if (peek() == '\\')
			{
				advance();
			}
			advance();
		}

		if (isAtEnd())
		{
			return errorToken("Unterminated string");
		}

		advance(); // The closing '"'
		return makeToken(TokenType.STRING_LITERAL);
	}

	/**
	 * Scans a character literal: exactly one, possibly escaped, character between quotes.
	 */
	private Token scanCharacter()
	{
		if (isAtEnd())
		{
			return errorToken("Unterminated character");
		}

		if (peek() == '\\')
		{
			advance();
			if (isAtEnd())
			{
				return errorToken("Unterminated character after escape");
			}
		}
		advance();

		if (isAtEnd())
		{
			return errorToken("Unterminated character");
		}
		if (peek() != '\'')
		{
			return errorToken("Character too long");
		}

		advance(); // The closing '\''
		return makeToken(TokenType.CHAR_LITERAL);
	}

	/**
	 * Consumes the current character and returns it, tracking line and column.
	 */
	private char advance()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
		return c;
	}

	/**
	 * Consumes the current character only if it matches the expected one.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		advance();
		return true;
	}

	private char peek()
	{
		return isAtEnd() ? '\0' : source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private Token makeToken(TokenType type)
	{
		return new Token(type, source.substring(start, current), startLine, startColumn);
	}

	private Token errorToken(String message)
	{
		return new Token(TokenType.ERROR, message, startLine, startColumn);
	}

	private static boolean isAlpha(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c > 0x7F;
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isHexDigit(char c)
	{
		return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	private static boolean isBinaryDigit(char c)
	{
		return c == '0' || c == '1';
	}

	private static boolean isAlphaNumeric(char c)
	{
		return isAlpha(c) || isDigit(c);
	}
}
