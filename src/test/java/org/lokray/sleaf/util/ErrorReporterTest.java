package org.lokray.sleaf.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorReporterTest
{
	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;
	private ErrorReporter reporter;

	@BeforeEach
	void setUp()
	{
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
		reporter = new ErrorReporter(new PrintStream(out, true), new PrintStream(err, true));
	}

	@Test
	void formatsPositionedErrors()
	{
		reporter.report(3, 7, "Expect ';' after expression");

		assertThat(err.toString(StandardCharsets.UTF_8))
				.isEqualTo("[SLEAFLLVM :: ERROR] Line 3, Column 7: Expect ';' after expression" + System.lineSeparator());
		assertThat(reporter.hasErrors()).isTrue();
		assertThat(reporter.getErrorCount()).isEqualTo(1);
	}

	@Test
	void routesLevelsToStreams()
	{
		reporter.info("hello");
		reporter.warning("careful");

		assertThat(out.toString(StandardCharsets.UTF_8)).contains("[SLEAFLLVM :: INFO] hello");
		assertThat(err.toString(StandardCharsets.UTF_8)).contains("[SLEAFLLVM :: WARNING] careful");
		assertThat(reporter.hasErrors()).isFalse();
	}

	@Test
	void noteAndDebugNeedVerbose()
	{
		reporter.note("hidden");
		reporter.debug("hidden too");
		assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();

		reporter.setVerbose(true);
		reporter.debug("shown");
		assertThat(out.toString(StandardCharsets.UTF_8)).contains("[SLEAFLLVM :: DEBUG] shown");
	}

	@Test
	void expressionHistoryIsCapped()
	{
		for (int i = 0; i < ErrorReporter.MAX_STACK_SIZE + 20; i++)
		{
			reporter.pushExpression("binary", "e" + i);
		}

		assertThat(reporter.getExpressionStackSize()).isEqualTo(ErrorReporter.MAX_STACK_SIZE);
		List<String> traceback = reporter.getTraceback();
		assertThat(traceback).hasSize(ErrorReporter.TRACEBACK_LIMIT);
		assertThat(traceback.get(0)).endsWith("e105");
		assertThat(traceback.get(traceback.size() - 1)).endsWith("e119");
	}

	@Test
	void criticalPrintsTracebackAndExits()
	{
		List<Integer> exitCodes = new ArrayList<>();
		reporter.setExitHandler(exitCodes::add);
		reporter.pushExpression("call", "f(1)");

		reporter.critical("Internal compiler error");

		String errors = err.toString(StandardCharsets.UTF_8);
		assertThat(errors).contains("[SLEAFLLVM :: CRITICAL] Internal compiler error");
		assertThat(errors).contains("Expressions traceback:");
		assertThat(errors).contains("call     f(1)");
		assertThat(exitCodes).containsExactly(1);
	}

	@Test
	void resetClearsState()
	{
		reporter.error("boom");
		reporter.pushExpression("unary", "-x");
		reporter.reset();

		assertThat(reporter.hasErrors()).isFalse();
		assertThat(reporter.getExpressionStackSize()).isZero();
	}
}
