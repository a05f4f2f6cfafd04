package org.lokray.calc.util;

import java.io.PrintStream;

public class Debug
{
	/**
	 * Master switch for all debug logging. Off unless {@code -Dcalc.debug=true}
	 * is given or the configuration turns it on.
	 */
	private static boolean enabled = Boolean.getBoolean("calc.debug");

	private static int indentLevel = 0;

	private static PrintStream out = System.err;

	public static boolean isEnabled()
	{
		return enabled;
	}

	public static void setEnabled(boolean value)
	{
		enabled = value;
		indentLevel = 0;
	}

	/**
	 * Redirects debug output. Must not be the stream that carries the IR.
	 */
	public static void setOutput(PrintStream stream)
	{
		out = stream;
	}

	/**
	 * Logs a formatted message if debugging is enabled.
	 * Goes to stderr unless redirected: stdout carries the generated IR.
	 *
	 * @param format The message format string (e.g., "Found var: %s").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (enabled)
		{
			String indent = "  ".repeat(indentLevel);
			out.println("[DEBUG] " + indent + String.format(format, args));
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
