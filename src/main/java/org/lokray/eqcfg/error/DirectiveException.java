package org.lokray.eqcfg.error;

/**
 * A put, use or bind directive whose target or source cannot be resolved, or a data row whose arity does not match its context.
 */
public class DirectiveException extends CompilationException
{
	public DirectiveException(String message)
	{
		super(message);
	}

	public DirectiveException(String message, String trace)
	{
		super(message, trace);
	}

	@Override
	public String getKindLabel()
	{
		return "Directive Error";
	}
}
