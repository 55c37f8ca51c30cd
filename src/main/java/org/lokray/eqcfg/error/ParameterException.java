package org.lokray.eqcfg.error;

/**
 * A parameter or option that is not valid for the scope kind or parameter family.
 */
public class ParameterException extends CompilationException
{
	public ParameterException(String message)
	{
		super(message);
	}

	public ParameterException(String message, String trace)
	{
		super(message, trace);
	}

	@Override
	public String getKindLabel()
	{
		return "Parameter Error";
	}
}
