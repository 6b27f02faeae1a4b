package org.lokray.sleaf.ast;

import org.junit.jupiter.api.Test;
import org.lokray.sleaf.ast.expressions.Expression;
import org.lokray.sleaf.ast.statements.ExpressionStatement;
import org.lokray.sleaf.lexer.Lexer;
import org.lokray.sleaf.lexer.TokenType;
import org.lokray.sleaf.parser.SleafParser;
import org.lokray.sleaf.util.ErrorReporter;

import static org.assertj.core.api.Assertions.assertThat;

class ExpressionResultTypeTest
{
	private static TokenType typeOf(String expression)
	{
		SleafParser parser = new SleafParser(new Lexer(expression + ";"), new ErrorReporter());
		Expression parsed = ((ExpressionStatement) parser.parse().get(0)).getExpression();
		return parsed.getResultType();
	}

	@Test
	void literalsKnowTheirType()
	{
		assertThat(typeOf("1")).isEqualTo(TokenType.I32);
		assertThat(typeOf("1.5")).isEqualTo(TokenType.F64);
		assertThat(typeOf("true")).isEqualTo(TokenType.BOOL);
		assertThat(typeOf("\"s\"")).isEqualTo(TokenType.STRING);
		assertThat(typeOf("'c'")).isEqualTo(TokenType.CHAR);
	}

	@Test
	void binaryPromotesToDoubleWhenEitherSideIsFloating()
	{
		assertThat(typeOf("1 + 2")).isEqualTo(TokenType.I32);
		assertThat(typeOf("1 + 2.0")).isEqualTo(TokenType.F64);
		assertThat(typeOf("(2.0 * 3) - 1")).isEqualTo(TokenType.F64);
	}

	@Test
	void unaryAndAssignmentPropagateChildType()
	{
		assertThat(typeOf("-2.5")).isEqualTo(TokenType.F64);
		assertThat(typeOf("x = 1.0")).isEqualTo(TokenType.F64);
	}

	@Test
	void identifiersAndCallsDefaultToInt()
	{
		assertThat(typeOf("x")).isEqualTo(TokenType.I32);
		assertThat(typeOf("f(1.0)")).isEqualTo(TokenType.I32);
	}
}
