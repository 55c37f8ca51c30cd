package org.lokray.eqcfg.error;

/**
 * Lexing or parsing failure: unexpected symbol or token, unterminated literal or comment.
 */
public class SyntaxException extends CompilationException
{
	public SyntaxException(String message)
	{
		super(message);
	}

	public SyntaxException(String message, String trace)
	{
		super(message, trace);
	}

	@Override
	public String getKindLabel()
	{
		return "Syntax Error";
	}
}
