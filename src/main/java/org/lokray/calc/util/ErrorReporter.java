package org.lokray.calc.util;

import java.io.PrintStream;

/**
 * Collects diagnostics for one compilation run.
 * Shared by the parser and the semantic analyzer so the driver can ask a single
 * question after each phase: did anything go wrong?
 */
public class ErrorReporter
{
	private final PrintStream out;
	private boolean hasErrors = false; // Flag to indicate if any errors have been reported

	public ErrorReporter()
	{
		this(System.err);
	}

	public ErrorReporter(PrintStream out)
	{
		this.out = out;
	}

	/**
	 * Reports a compilation error.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		out.println("[Error] Line " + line + ", Column " + column + ": " + message);
		hasErrors = true;
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	/**
	 * Resets the error flag.
	 */
	public void reset()
	{
		hasErrors = false;
	}
}
