package org.lokray.eqcfg.parser;

/**
 * A point in the source: 1-based line number, 0-based column and the text of the line,
 * kept so diagnostics can be rendered without going back to the source.
 */
public class SourcePosition
{
	public static final SourcePosition UNKNOWN = new SourcePosition(0, 0, "");

	private final int line;
	private final int column;
	private final String lineText;

	public SourcePosition(int line, int column, String lineText)
	{
		this.line = line;
		this.column = column;
		this.lineText = lineText == null ? "" : lineText;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public String getLineText()
	{
		return lineText;
	}

	public boolean isKnown()
	{
		return line > 0;
	}

	/**
	 * Renders the offending line, a caret under the column and the line number.
	 */
	public String renderTrace()
	{
		if (!isKnown())
		{
			return "no trace";
		}
		return renderTrace(lineText, column, line);
	}

	public static String renderTrace(String lineText, int column, int line)
	{
		String symbol = column < lineText.length() ? "'" + lineText.charAt(column) + "'" : "<end of line>";
		return lineText + "\n"
				+ "-".repeat(Math.max(column, 0)) + "^\n"
				+ String.format("(pos=<%d>, symbol=<%s>, line=<%d>)", column, symbol, line);
	}

	@Override
	public String toString()
	{
		return "line " + line + ":" + (column + 1);
	}
}
