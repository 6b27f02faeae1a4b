package org.lokray.sleaf.util;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Diagnostics context shared by the parser, code generator and backend.
 * One instance is created per compilation by the driver and injected into every pass.
 * <p>
 * Besides leveled output it keeps a bounded history of the expressions being processed,
 * which is printed as a traceback when a critical error ends the process.
 */
public class ErrorReporter
{
	public enum Level
	{
		NOTE, DEBUG, INFO, WARNING, ERROR, CRITICAL
	}

	static final int MAX_STACK_SIZE = 100;
	static final int TRACEBACK_LIMIT = 15;

	private final PrintStream out;
	private final PrintStream err;
	private final Deque<String[]> expressionStack = new ArrayDeque<>();
	private IntConsumer exitHandler = System::exit;
	private boolean verbose = false;
	private int errorCount = 0; // Number of errors reported so far

	public ErrorReporter()
	{
		this(System.out, System.err);
	}

	public ErrorReporter(PrintStream out, PrintStream err)
	{
		this.out = out;
		this.err = err;
	}

	/**
	 * Enables NOTE and DEBUG output.
	 */
	public void setVerbose(boolean verbose)
	{
		this.verbose = verbose;
	}

	/**
	 * Replaces the action run after a critical error. Defaults to {@code System.exit}.
	 */
	public void setExitHandler(IntConsumer exitHandler)
	{
		this.exitHandler = exitHandler;
	}

	/**
	 * Reports a positioned compilation error.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		error("Line " + line + ", Column " + column + ": " + message);
	}

	public void note(String message)
	{
		log(Level.NOTE, message);
	}

	public void debug(String message)
	{
		log(Level.DEBUG, message);
	}

	public void info(String message)
	{
		log(Level.INFO, message);
	}

	public void warning(String message)
	{
		log(Level.WARNING, message);
	}

	public void error(String message)
	{
		errorCount++;
		log(Level.ERROR, message);
	}

	/**
	 * Prints the message and the expression traceback, then terminates through the exit handler.
	 */
	public void critical(String message)
	{
		errorCount++;
		log(Level.CRITICAL, message);
		printTraceback();
		exitHandler.accept(1);
	}

	/**
	 * Records the expression currently being processed. Only the latest
	 * {@value #MAX_STACK_SIZE} entries are kept.
	 *
	 * @param context    A short label for the pass or construct (e.g. "call").
	 * @param expression The rendered expression.
	 */
	public void pushExpression(String context, String expression)
	{
		expressionStack.addLast(new String[]{context, expression});
		if (expressionStack.size() > MAX_STACK_SIZE)
		{
			expressionStack.removeFirst();
		}
	}

	/**
	 * @return The entries a traceback would print, oldest first, as "context expression".
	 */
	public List<String> getTraceback()
	{
		List<String> entries = new ArrayList<>();
		int skip = Math.max(0, expressionStack.size() - TRACEBACK_LIMIT);
		for (String[] entry : expressionStack)
		{
			if (skip > 0)
			{
				skip--;
				continue;
			}
			entries.add(String.format("%-8s %s", entry[0], entry[1]));
		}
		return entries;
	}

	public int getExpressionStackSize()
	{
		return expressionStack.size();
	}

	private void printTraceback()
	{
		if (expressionStack.isEmpty())
		{
			return;
		}
		err.println("Expressions traceback:");
		for (String entry : getTraceback())
		{
			err.println("    " + entry);
		}
		err.flush();
	}

	private void log(Level level, String message)
	{
		if ((level == Level.NOTE || level == Level.DEBUG) && !verbose)
		{
			return;
		}
		PrintStream stream = level.compareTo(Level.WARNING) >= 0 ? err : out;
		stream.println("[SLEAFLLVM :: " + level + "] " + message);
		stream.flush();
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	/**
	 * Resets the error count and clears the expression history.
	 */
	public void reset()
	{
		errorCount = 0;
		expressionStack.clear();
	}
}
