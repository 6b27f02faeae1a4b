package org.lokray.sleaf.util;

/**
 * Tracing logger for the compiler passes. Parser productions and generator visits
 * log their entry here and nest their output with {@link #indent()}/{@link #dedent()}.
 */
public class Debug
{
	/**
	 * Master switch for all trace output. Off unless --trace or debug.trace is set.
	 */
	private static boolean enabled = false;

	private static int indentLevel = 0;

	public static void setEnabled(boolean value)
	{
		enabled = value;
		indentLevel = 0;
	}

	public static boolean isEnabled()
	{
		return enabled;
	}

	/**
	 * Logs a formatted message if tracing is enabled.
	 *
	 * @param format The message format string (e.g., "Declaring function '%s'").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (enabled)
		{
			String indent = "  ".repeat(indentLevel);
			System.out.println("[DEBUG] " + indent + String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public static void indent()
	{
		if (enabled)
		{
			indentLevel++;
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public static void dedent()
	{
		if (enabled)
		{
			indentLevel = Math.max(0, indentLevel - 1);
		}
	}
}
