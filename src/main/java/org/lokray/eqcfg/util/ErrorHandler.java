package org.lokray.eqcfg.util;

import org.lokray.eqcfg.error.CompilationException;

public class ErrorHandler
{
	private int errorCount = 0;

	/**
	 * Logs a fatal compilation error as "[label] message" followed by its source trace.
	 *
	 * @param source Name of the source the error came from, may be null.
	 */
	public void report(String source, CompilationException e)
	{
		String err = String.format("[%s] %s%s", e.getKindLabel(), source != null ? source + ": " : "", e.getMessage());
		Debug.logError(err);
		if (e.hasTrace())
		{
			Debug.logError(e.getTrace());
		}
		errorCount++;
	}

	public void logError(String msg)
	{
		Debug.logError(msg);
		errorCount++;
	}

	public boolean hasErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}
}
