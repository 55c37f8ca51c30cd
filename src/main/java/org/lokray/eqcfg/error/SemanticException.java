package org.lokray.eqcfg.error;

/**
 * Duplicate symbol or context, unresolved name, or redefinition of a one-shot binding.
 */
public class SemanticException extends CompilationException
{
	public SemanticException(String message)
	{
		super(message);
	}

	public SemanticException(String message, String trace)
	{
		super(message, trace);
	}

	@Override
	public String getKindLabel()
	{
		return "Runtime Error";
	}
}
