package org.lokray.eqcfg.error;

/**
 * Root of every fatal error raised while lexing, parsing or elaborating a source.
 * Compilation is fail-fast: the first error aborts the whole run and no instances
 * are produced.
 */
public abstract class CompilationException extends RuntimeException
{
	private String trace;

	protected CompilationException(String message)
	{
		this(message, null);
	}

	protected CompilationException(String message, String trace)
	{
		super(message);
		this.trace = trace;
	}

	/**
	 * @return The label printed in front of the message, e.g. "Syntax Error".
	 */
	public abstract String getKindLabel();

	/**
	 * @return The rendered source trace (line, caret, line number), or null when
	 * the error was raised away from any source position.
	 */
	public String getTrace()
	{
		return trace;
	}

	public boolean hasTrace()
	{
		return trace != null;
	}

	/**
	 * Attaches a trace unless one is already present.
	 */
	public CompilationException withTrace(String trace)
	{
		if (this.trace == null)
		{
			this.trace = trace;
		}
		return this;
	}

	@Override
	public String toString()
	{
		String base = "[" + getKindLabel() + "] " + getMessage();
		return trace == null ? base : base + "\n" + trace;
	}
}
