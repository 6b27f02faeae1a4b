package org.lokray.sleaf.lexer;

/**
 * Defines all possible types of tokens in the SLEAF language.
 */
public enum TokenType
{
	// --- Keywords ---
	FUNC, RETURN, IF, ELSE, WHILE, FOR, STRUCT, IMPORT, CONST, VAR,

	// --- Primitive type keywords ---
	I8, I16, I32, I64,
	U8, U16, U32, U64,
	F32, F64,
	BOOL, STRING, CHAR, VOID,

	// --- Literals ---
	TRUE, FALSE,
	INT_LITERAL,
	FLOAT_LITERAL,
	STRING_LITERAL,
	CHAR_LITERAL,
	IDENTIFIER,

	// --- Arithmetic operators ---
	PLUS,         // +
	MINUS,        // -
	STAR,         // *
	SLASH,        // /
	PERCENT,      // %
	PLUS_PLUS,    // ++
	PLUS_EQUAL,   // +=

	// --- Assignment and comparison ---
	EQUAL,         // =
	EQUAL_EQUAL,   // ==
	BANG,          // !
	BANG_EQUAL,    // !=
	LESS,          // <
	LESS_EQUAL,    // <=
	GREATER,       // >
	GREATER_EQUAL, // >=

	// --- Logical and bitwise ---
	AMPERSAND,     // &
	AND_AND,       // &&
	PIPE,          // |
	OR_OR,         // ||
	ARROW,         // ->

	// --- Punctuators ---
	LEFT_PAREN, RIGHT_PAREN,     // ( )
	LEFT_BRACE, RIGHT_BRACE,     // { }
	LEFT_BRACKET, RIGHT_BRACKET, // [ ]
	COMMA,        // ,
	SEMICOLON,    // ;
	COLON,        // :
	DOT,          // .
	QUESTION,     // ?

	// --- Sentinels ---
	END_OF_FILE,
	ERROR;

	/**
	 * @return true if this token kind names a primitive type usable in a declaration.
	 */
	public boolean isTypeKeyword()
	{
		switch (this)
		{
			case I8:
			case I16:
			case I32:
			case I64:
			case U8:
			case U16:
			case U32:
			case U64:
			case F32:
			case F64:
			case BOOL:
			case STRING:
			case CHAR:
			case VOID:
				return true;
			default:
				return false;
		}
	}

	public boolean isFloatingType()
	{
		return this == F32 || this == F64;
	}
}
