package org.lokray.eqcfg.error;

/**
 * A value does not match the declared type it is assigned to.
 */
public class TypeMismatchException extends CompilationException
{
	public TypeMismatchException(String message)
	{
		super(message);
	}

	public TypeMismatchException(String message, String trace)
	{
		super(message, trace);
	}

	@Override
	public String getKindLabel()
	{
		return "Type Error";
	}
}
