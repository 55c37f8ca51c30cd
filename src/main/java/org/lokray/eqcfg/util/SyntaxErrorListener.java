package org.lokray.eqcfg.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.lokray.eqcfg.error.SyntaxException;
import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.parser.SourceText;

/**
 * Error listener for the ANTLR lexer and parser. The first syntax error is turned into a
 * {@link SyntaxException} carrying the caret trace of the offending symbol.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final SourceText source;

	public SyntaxErrorListener(SourceText source)
	{
		this.source = source;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		SourcePosition position = new SourcePosition(line, charPositionInLine, source.getLine(line));
		String message;
		if (recognizer instanceof Lexer)
		{
			message = describeLexerError(position);
		}
		else if (recognizer instanceof Parser parser)
		{
			message = "expected " + parser.getExpectedTokens().toString(parser.getVocabulary())
					+ " but found " + describe(offendingSymbol);
		}
		else
		{
			message = msg;
		}
		Debug.logDebug(String.format("[Syntax Error] line %d:%d - %s", line, charPositionInLine + 1, msg));
		throw new SyntaxException(message, position.renderTrace());
	}

	/**
	 * The lexer stops at the first character of the token it could not finish: an opening
	 * quote or comment slash means the span was never closed.
	 */
	private static String describeLexerError(SourcePosition position)
	{
		String text = position.getLineText();
		if (position.getColumn() < text.length())
		{
			char c = text.charAt(position.getColumn());
			if (c == '/' || c == '\'' || c == '"')
			{
				return "symbol <" + c + "> is not closed";
			}
		}
		return "unexpected symbol";
	}

	private static String describe(Object offendingSymbol)
	{
		if (offendingSymbol instanceof Token token)
		{
			return token.getType() == Token.EOF ? "end of input" : "'" + token.getText() + "'";
		}
		return String.valueOf(offendingSymbol);
	}
}
