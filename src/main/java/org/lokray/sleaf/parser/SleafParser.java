package org.lokray.sleaf.parser;

import org.lokray.sleaf.ast.declarations.FunctionDeclaration;
import org.lokray.sleaf.ast.declarations.Parameter;
import org.lokray.sleaf.ast.expressions.*;
import org.lokray.sleaf.ast.statements.*;
import org.lokray.sleaf.lexer.Lexer;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;
import org.lokray.sleaf.util.Debug;
import org.lokray.sleaf.util.ErrorReporter;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for SLEAF. Tokens are pulled from the {@link Lexer} on demand.
 * <p>
 * Errors put the parser in panic mode, where further reports are suppressed until it
 * re-synchronizes at a statement boundary. Parsing always runs to the end of the input;
 * callers check {@link #hadError()} before using the result.
 */
public class SleafParser
{
	// Tokens that start a fresh declaration or statement; synchronization stops in front of them.
	private static final Set<TokenType> RESTART_KEYWORDS = EnumSet.of(
			TokenType.FUNC, TokenType.VAR, TokenType.CONST, TokenType.FOR,
			TokenType.IF, TokenType.WHILE, TokenType.RETURN);

	private final Lexer lexer;
	private final ErrorReporter errorReporter;

	private Token current;
	private Token previous;
	private boolean panicMode = false;
	private int errorCount = 0;

	public SleafParser(Lexer lexer, ErrorReporter errorReporter)
	{
		this.lexer = lexer;
		this.errorReporter = errorReporter;
		this.current = new Token(TokenType.END_OF_FILE, "", 1, 1);
		this.previous = current;
		pullNext();
	}

	/**
	 * Parses the whole token stream.
	 *
	 * @return The top-level statements in source order. Statements that failed to parse are left out.
	 */
	public List<Statement> parse()
	{
		List<Statement> statements = new ArrayList<>();
		while (!isAtEnd())
		{
			Statement statement = declaration();
			if (statement != null)
			{
				Debug.log("Parsed top-level %s", statement.getClass().getSimpleName());
				statements.add(statement);
			}
		}
		return statements;
	}

	public boolean hadError()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	// --- Declarations ---

	/**
	 * Parses a declaration or falls back to a statement. This is the recovery boundary:
	 * a {@link SyntaxError} thrown anywhere below is caught here and followed by
	 * {@link #synchronize()}.
	 *
	 * @return The parsed statement, or null when it had to be discarded.
	 */
	private Statement declaration()
	{
		try
		{
			if (match(TokenType.FUNC))
			{
				return functionDeclaration();
			}
			if (match(TokenType.VAR, TokenType.CONST))
			{
				return variableDeclaration();
			}
			return statement();
		}
		catch (SyntaxError e)
		{
			synchronize();
			return null;
		}
	}

	/**
	 * Grammar: {@code FUNC IDENTIFIER ( (IDENTIFIER : TYPE (, IDENTIFIER : TYPE)*)? ) (-> TYPE)? BLOCK}
	 */
	private FunctionDeclaration functionDeclaration() throws SyntaxError
	{
		Token funcKeyword = previous;
		Token name = consume(TokenType.IDENTIFIER, "Expect function name");
		consume(TokenType.LEFT_PAREN, "Expect '(' after function name");

		List<Parameter> parameters = new ArrayList<>();
		if (!check(TokenType.RIGHT_PAREN))
		{
			do
			{
				Token parameterName = consume(TokenType.IDENTIFIER, "Expect parameter name");
				consume(TokenType.COLON, "Expect ':' after parameter name");
				Token parameterType = typeAnnotation();
				parameters.add(new Parameter(parameterName, parameterType));
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters");

		Token returnType = null;
		if (match(TokenType.ARROW))
		{
			returnType = typeAnnotation();
		}

		consume(TokenType.LEFT_BRACE, "Expect '{' before function body");
		BlockStatement body = block();
		return new FunctionDeclaration(funcKeyword, name, parameters, returnType, body);
	}

	/**
	 * Grammar: {@code (VAR | CONST) IDENTIFIER : TYPE (= EXPRESSION)? ;}
	 * The keyword has already been consumed.
	 */
	private VariableDeclarationStatement variableDeclaration() throws SyntaxError
	{
		Token keyword = previous;
		Token name = consume(TokenType.IDENTIFIER, "Expect variable name");
		consume(TokenType.COLON, "Expect ':' after variable name");
		Token type = typeAnnotation();

		Expression initializer = null;
		if (match(TokenType.EQUAL))
		{
			initializer = expression();
		}
		else if (keyword.getType() == TokenType.CONST)
		{
			reportWithoutPanic(current, "Constant must be initialized");
		}

		consume(TokenType.SEMICOLON, "Expect ';' after variable declaration");
		return new VariableDeclarationStatement(keyword, name, type, initializer);
	}

	private Token typeAnnotation() throws SyntaxError
	{
		if (current.getType().isTypeKeyword())
		{
			return advance();
		}
		if (check(TokenType.IDENTIFIER))
		{
			throw error(current, "Unknown type: " + current.getLexeme());
		}
		throw error(current, "Expect type");
	}

	// --- Statements ---

	private Statement statement() throws SyntaxError
	{
		if (match(TokenType.IF))
		{
			return ifStatement();
		}
		if (match(TokenType.WHILE))
		{
			return whileStatement();
		}
		if (match(TokenType.FOR))
		{
			return forStatement();
		}
		if (match(TokenType.RETURN))
		{
			return returnStatement();
		}
		if (match(TokenType.LEFT_BRACE))
		{
			return block();
		}
		return expressionStatement();
	}

	/**
	 * Parses the statements of a block. The opening brace has already been consumed.
	 */
	private BlockStatement block() throws SyntaxError
	{
		Token leftBrace = previous;
		List<Statement> statements = new ArrayList<>();

		while (!check(TokenType.RIGHT_BRACE) && !isAtEnd())
		{
			Statement statement = declaration();
			if (statement != null)
			{
				statements.add(statement);
			}
		}

		consume(TokenType.RIGHT_BRACE, "Expect '}' after block");
		return new BlockStatement(leftBrace, statements);
	}

	private IfStatement ifStatement() throws SyntaxError
	{
		Token ifKeyword = previous;
		consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition");

		Statement thenBranch = statement();
		Statement elseBranch = null;
		if (match(TokenType.ELSE))
		{
			elseBranch = statement();
		}
		return new IfStatement(ifKeyword, condition, thenBranch, elseBranch);
	}

	private WhileStatement whileStatement() throws SyntaxError
	{
		Token whileKeyword = previous;
		consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'");
		Expression condition = expression();
		consume(TokenType.RIGHT_PAREN, "Expect ')' after while condition");
		Statement body = statement();
		return new WhileStatement(whileKeyword, condition, body);
	}

	/**
	 * Parses a C-style for loop and desugars it:
	 * {@code for (init; cond; incr) body} becomes
	 * {@code { init; while (cond) { body; incr; } }}.
	 * A missing condition becomes the literal {@code true}; the outer block only exists
	 * when there is an initializer.
	 */
	private Statement forStatement() throws SyntaxError
	{
		Token forKeyword = previous;
		consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'");

		Statement initializer;
		if (match(TokenType.SEMICOLON))
		{
			initializer = null;
		}
		else if (match(TokenType.VAR, TokenType.CONST))
		{
			initializer = variableDeclaration();
		}
		else
		{
			initializer = expressionStatement();
		}

		Expression condition = null;
		if (!check(TokenType.SEMICOLON))
		{
			condition = expression();
		}
		consume(TokenType.SEMICOLON, "Expect ';' after loop condition");

		Expression increment = null;
		if (!check(TokenType.RIGHT_PAREN))
		{
			increment = expression();
		}
		consume(TokenType.RIGHT_PAREN, "Expect ')' after for clauses");

		Statement body = statement();

		if (increment != null)
		{
			body = new BlockStatement(forKeyword, List.of(body, new ExpressionStatement(increment)));
		}
		if (condition == null)
		{
			condition = new LiteralExpression(new Token(TokenType.TRUE, "true", forKeyword.getLine(), forKeyword.getColumn()));
		}

		Statement loop = new WhileStatement(forKeyword, condition, body);
		if (initializer != null)
		{
			return new BlockStatement(forKeyword, List.of(initializer, loop));
		}
		return loop;
	}

	private ReturnStatement returnStatement() throws SyntaxError
	{
		Token keyword = previous;
		Expression value = null;
		if (!check(TokenType.SEMICOLON))
		{
			value = expression();
		}
		consume(TokenType.SEMICOLON, "Expect ';' after return value");
		return new ReturnStatement(keyword, value);
	}

	private ExpressionStatement expressionStatement() throws SyntaxError
	{
		Expression expression = expression();
		consume(TokenType.SEMICOLON, "Expect ';' after expression");
		return new ExpressionStatement(expression);
	}

	// --- Expressions ---

	/**
	 * Precedence, loosest first:
	 * assignment -> ternary -> or -> and -> equality -> comparison -> additive
	 * -> multiplicative -> unary -> call -> primary
	 */
	private Expression expression() throws SyntaxError
	{
		return assignment();
	}

	private Expression assignment() throws SyntaxError
	{
		Expression expr = ternary();

		if (match(TokenType.EQUAL, TokenType.PLUS_EQUAL))
		{
			Token operator = previous;
			Expression value = assignment(); // Right-associative

			if (expr instanceof IdentifierExpression)
			{
				return new AssignmentExpression(((IdentifierExpression) expr).getName(), operator, value);
			}
			// Reported but not thrown: the statement still parses to the end.
			reportWithoutPanic(operator, "Invalid assignment target");
		}
		return expr;
	}

	/**
	 * {@code cond ? a : b} becomes {@code Binary(?, cond, Binary(:, a, b))}.
	 */
	private Expression ternary() throws SyntaxError
	{
		Expression expr = or();

		if (match(TokenType.QUESTION))
		{
			Token question = previous;
			Expression thenBranch = expression();
			Token colon = consume(TokenType.COLON, "Expect ':' in ternary expression");
			Expression elseBranch = ternary();
			return new BinaryExpression(expr, question, new BinaryExpression(thenBranch, colon, elseBranch));
		}
		return expr;
	}

	private Expression or() throws SyntaxError
	{
		Expression expr = and();

		while (match(TokenType.OR_OR))
		{
			Token operator = previous;
			Expression right = and();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression and() throws SyntaxError
	{
		Expression expr = equality();

		while (match(TokenType.AND_AND))
		{
			Token operator = previous;
			Expression right = equality();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression equality() throws SyntaxError
	{
		Expression expr = comparison();

		while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL))
		{
			Token operator = previous;
			Expression right = comparison();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression comparison() throws SyntaxError
	{
		Expression expr = additive();

		while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL))
		{
			Token operator = previous;
			Expression right = additive();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression additive() throws SyntaxError
	{
		Expression expr = multiplicative();

		while (match(TokenType.PLUS, TokenType.MINUS))
		{
			Token operator = previous;
			Expression right = multiplicative();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression multiplicative() throws SyntaxError
	{
		Expression expr = unary();

		while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT))
		{
			Token operator = previous;
			Expression right = unary();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Parses prefix operators: {@code !x}, {@code -x}, {@code ++x}.
	 */
	private Expression unary() throws SyntaxError
	{
		if (match(TokenType.BANG, TokenType.MINUS, TokenType.PLUS_PLUS))
		{
			Token operator = previous;
			Expression operand = unary();
			if (operator.getType() == TokenType.PLUS_PLUS && !(operand instanceof IdentifierExpression))
			{
				reportWithoutPanic(operator, "Invalid increment target");
			}
			return new UnaryExpression(operator, operand);
		}
		return call();
	}

	/**
	 * Parses calls and the postfix increment.
	 * Grammar: {@code PRIMARY ( '(' ARGUMENTS? ')' | '++' )*}
	 */
	private Expression call() throws SyntaxError
	{
		Expression expr = primary();

		while (true)
		{
			if (match(TokenType.LEFT_PAREN))
			{
				List<Expression> arguments = new ArrayList<>();
				if (!check(TokenType.RIGHT_PAREN))
				{
					do
					{
						arguments.add(expression());
					}
					while (match(TokenType.COMMA));
				}
				Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments");
				expr = new CallExpression(expr, paren, arguments);
			}
			else if (match(TokenType.PLUS_PLUS))
			{
				Token operator = previous;
				if (!(expr instanceof IdentifierExpression))
				{
					reportWithoutPanic(operator, "Invalid increment target");
				}
				expr = new UnaryExpression(operator, expr, true);
			}
			else
			{
				break;
			}
		}
		return expr;
	}

	private Expression primary() throws SyntaxError
	{
		if (match(TokenType.TRUE, TokenType.FALSE, TokenType.INT_LITERAL, TokenType.FLOAT_LITERAL,
				TokenType.STRING_LITERAL, TokenType.CHAR_LITERAL))
		{
			return new LiteralExpression(previous);
		}
		if (match(TokenType.IDENTIFIER))
		{
			return new IdentifierExpression(previous);
		}
		if (match(TokenType.LEFT_PAREN))
		{
			Token paren = previous;
			Expression expr = expression();
			consume(TokenType.RIGHT_PAREN, "Expect ')' after expression");
			return new GroupingExpression(paren, expr);
		}

		throw error(current, "Expect expression");
	}

	// --- Token stream helpers ---

	/**
	 * Consumes the current token and returns it.
	 */
	private Token advance()
	{
		previous = current;
		if (!isAtEnd())
		{
			pullNext();
		}
		return previous;
	}

	/**
	 * Fetches the next token from the lexer. ERROR tokens are reported here and then
	 * left as the current token so the grammar fails on them and recovers.
	 */
	private void pullNext()
	{
		current = lexer.scanToken();
		if (current.getType() == TokenType.ERROR)
		{
			error(current, current.getLexeme());
		}
	}

	private boolean match(TokenType... types)
	{
		for (TokenType type : types)
		{
			if (check(type))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes the current token if it has the expected type, otherwise reports and throws.
	 *
	 * @throws SyntaxError if the current token's type does not match the expected type.
	 */
	private Token consume(TokenType type, String message) throws SyntaxError
	{
		if (check(type))
		{
			return advance();
		}
		throw error(current, message);
	}

	private boolean check(TokenType type)
	{
		if (isAtEnd())
		{
			return false;
		}
		return current.getType() == type;
	}

	private boolean isAtEnd()
	{
		return current.getType() == TokenType.END_OF_FILE;
	}

	/**
	 * Reports a syntax error unless the parser is already in panic mode, and returns a
	 * SyntaxError the caller may throw to unwind to {@link #declaration()}.
	 */
	private SyntaxError error(Token token, String message)
	{
		if (!panicMode)
		{
			panicMode = true;
			errorCount++;
			String where = token.getType() == TokenType.END_OF_FILE ? " at end" : "";
			errorReporter.report(token.getLine(), token.getColumn(), message + where);
		}
		return new SyntaxError();
	}

	/**
	 * Reports an error the grammar recovers from in place. Suppressed in panic mode like
	 * {@link #error(Token, String)}, but parsing continues without entering it.
	 */
	private void reportWithoutPanic(Token token, String message)
	{
		if (!panicMode)
		{
			errorCount++;
			errorReporter.report(token.getLine(), token.getColumn(), message);
		}
	}

	/**
	 * Discards tokens until a statement boundary: just past a ';' or in front of a
	 * restart keyword. Always makes progress unless already at a restart keyword.
	 */
	private void synchronize()
	{
		panicMode = false;

		if (!RESTART_KEYWORDS.contains(current.getType()))
		{
			advance();
		}

		while (!isAtEnd())
		{
			if (previous.getType() == TokenType.SEMICOLON || RESTART_KEYWORDS.contains(current.getType()))
			{
				break;
			}
			advance();
		}

		// A lexical error token skipped on the way was reported on its own. One left as the
		// current token keeps panic mode so the grammar failing on it stays silent.
		panicMode = current.getType() == TokenType.ERROR;
	}

	/**
	 * Raised to unwind to the nearest declaration after a syntax error.
	 */
	private static class SyntaxError extends Exception
	{
	}
}
