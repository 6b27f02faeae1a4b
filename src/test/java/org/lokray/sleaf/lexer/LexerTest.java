package org.lokray.sleaf.lexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LexerTest
{
	private static List<Token> scanAll(String source)
	{
		Lexer lexer = new Lexer(source);
		List<Token> tokens = new ArrayList<>();
		Token token;
		do
		{
			token = lexer.scanToken();
			tokens.add(token);
		}
		while (token.getType() != TokenType.END_OF_FILE);
		return tokens;
	}

	private static List<TokenType> types(String source)
	{
		List<TokenType> types = new ArrayList<>();
		for (Token token : scanAll(source))
		{
			types.add(token.getType());
		}
		return types;
	}

	@Test
	void scansFunctionHeader()
	{
		assertThat(types("func add(a: i32) -> i32 { return a; }")).containsExactly(
				TokenType.FUNC, TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.IDENTIFIER,
				TokenType.COLON, TokenType.I32, TokenType.RIGHT_PAREN, TokenType.ARROW, TokenType.I32,
				TokenType.LEFT_BRACE, TokenType.RETURN, TokenType.IDENTIFIER, TokenType.SEMICOLON,
				TokenType.RIGHT_BRACE, TokenType.END_OF_FILE);
	}

	@Test
	void scansCompoundOperators()
	{
		assertThat(types("++ += + == = != ! <= < >= > && & || | ->")).containsExactly(
				TokenType.PLUS_PLUS, TokenType.PLUS_EQUAL, TokenType.PLUS, TokenType.EQUAL_EQUAL,
				TokenType.EQUAL, TokenType.BANG_EQUAL, TokenType.BANG, TokenType.LESS_EQUAL,
				TokenType.LESS, TokenType.GREATER_EQUAL, TokenType.GREATER, TokenType.AND_AND,
				TokenType.AMPERSAND, TokenType.OR_OR, TokenType.PIPE, TokenType.ARROW,
				TokenType.END_OF_FILE);
	}

	@Test
	void tracksTokenStartPositions()
	{
		List<Token> tokens = scanAll("var x\n  = 10;");
		assertThat(tokens.get(0).getLine()).isEqualTo(1);
		assertThat(tokens.get(0).getColumn()).isEqualTo(1);
		assertThat(tokens.get(1).getColumn()).isEqualTo(5);
		assertThat(tokens.get(2).getLine()).isEqualTo(2);
		assertThat(tokens.get(2).getColumn()).isEqualTo(3);
		assertThat(tokens.get(3).getColumn()).isEqualTo(5);
		assertThat(tokens.get(3).getLexeme()).isEqualTo("10");
	}

	@Test
	void skipsLineAndBlockComments()
	{
		assertThat(types("// line\nx /* block\n spanning */ y")).containsExactly(
				TokenType.IDENTIFIER, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
	}

	@Test
	void unterminatedBlockCommentConsumesRest()
	{
		assertThat(types("x /* never closed")).containsExactly(TokenType.IDENTIFIER, TokenType.END_OF_FILE);
	}

	@Test
	void scansNumericLiterals()
	{
		List<Token> tokens = scanAll("42 3.14 0xFF 0b1010 1_000 2e10 1.5E-3");
		assertThat(tokens).extracting(Token::getType).containsExactly(
				TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL, TokenType.INT_LITERAL, TokenType.INT_LITERAL,
				TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL, TokenType.FLOAT_LITERAL, TokenType.END_OF_FILE);
		assertThat(tokens).extracting(Token::getLexeme).startsWith("42", "3.14", "0xFF", "0b1010", "1_000", "2e10", "1.5E-3");
	}

	@Test
	void secondDecimalPointIsAnError()
	{
		Token token = new Lexer("1.2.3").scanToken();
		assertThat(token.getType()).isEqualTo(TokenType.ERROR);
		assertThat(token.getLexeme()).isEqualTo("Invalid numeric format");
	}

	@Test
	void scansStringAndCharacterLiterals()
	{
		List<Token> tokens = scanAll("\"hi \\\"there\\\"\" 'a' '\\n'");
		assertThat(tokens.get(0).getType()).isEqualTo(TokenType.STRING_LITERAL);
		assertThat(tokens.get(0).getLexeme()).isEqualTo("\"hi \\\"there\\\"\"");
		assertThat(tokens.get(1).getType()).isEqualTo(TokenType.CHAR_LITERAL);
		assertThat(tokens.get(1).getLexeme()).isEqualTo("'a'");
		assertThat(tokens.get(2).getType()).isEqualTo(TokenType.CHAR_LITERAL);
		assertThat(tokens.get(2).getLexeme()).isEqualTo("'\\n'");
	}

	@Test
	void reportsMalformedLiteralsAsErrorTokens()
	{
		assertThat(new Lexer("\"open").scanToken().getLexeme()).isEqualTo("Unterminated string");
		assertThat(new Lexer("'ab'").scanToken().getLexeme()).isEqualTo("Character too long");
		assertThat(new Lexer("'a").scanToken().getLexeme()).isEqualTo("Unterminated character");
		assertThat(new Lexer("'\\").scanToken().getLexeme()).isEqualTo("Unterminated character after escape");
	}

	@Test
	void unexpectedCharacterBecomesErrorAndScanningContinues()
	{
		List<Token> tokens = scanAll("a @ b");
		assertThat(tokens).extracting(Token::getType).containsExactly(
				TokenType.IDENTIFIER, TokenType.ERROR, TokenType.IDENTIFIER, TokenType.END_OF_FILE);
		assertThat(tokens.get(1).getLexeme()).isEqualTo("Unexpected character: @");
		assertThat(tokens.get(1).getColumn()).isEqualTo(3);
	}

	@Test
	void keepsReturningEndOfFile()
	{
		Lexer lexer = new Lexer("x");
		lexer.scanToken();
		assertThat(lexer.scanToken().getType()).isEqualTo(TokenType.END_OF_FILE);
		assertThat(lexer.scanToken().getType()).isEqualTo(TokenType.END_OF_FILE);
		assertThat(lexer.scanToken().getLexeme()).isEmpty();
	}

	@Test
	void recognizesKeywordsAndTypes()
	{
		assertThat(types("var const if else while for return true false void string char bool f64 u8 struct import")).containsExactly(
				TokenType.VAR, TokenType.CONST, TokenType.IF, TokenType.ELSE, TokenType.WHILE, TokenType.FOR,
				TokenType.RETURN, TokenType.TRUE, TokenType.FALSE, TokenType.VOID, TokenType.STRING, TokenType.CHAR,
				TokenType.BOOL, TokenType.F64, TokenType.U8, TokenType.STRUCT, TokenType.IMPORT, TokenType.END_OF_FILE);
	}

	@Test
	void formatsTokensForDumps()
	{
		assertThat(new Lexer("  foo").scanToken().toString()).isEqualTo("[1:3] IDENTIFIER 'foo'");
	}

	@Test
	void rescanningLiteralLexemesKeepsTheirKind()
	{
		for (Token literal : scanAll("7 0x1F 0b11 1_000 2.5 3e8 \"str\" 'q' true"))
		{
			if (literal.getType() == TokenType.END_OF_FILE)
			{
				continue;
			}
			Token rescanned = new Lexer(literal.getLexeme()).scanToken();
			assertThat(rescanned).isEqualTo(literal);
		}
	}

	@Test
	void unterminatedStringYieldsSingleErrorThenEnd()
	{
		assertThat(types("\"abc")).containsExactly(TokenType.ERROR, TokenType.END_OF_FILE);
	}
}
