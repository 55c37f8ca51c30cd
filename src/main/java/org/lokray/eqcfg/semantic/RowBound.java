package org.lokray.eqcfg.semantic;

import java.util.List;

/**
 * One data row just written into a context: its index in the source array and the values
 * assigned to the context variables, in column order.
 */
public final class RowBound
{
	private final int index;
	private final List<Object> values;

	public RowBound(int index, List<Object> values)
	{
		this.index = index;
		this.values = List.copyOf(values);
	}

	public int getIndex()
	{
		return index;
	}

	public List<Object> getValues()
	{
		return values;
	}

	@Override
	public String toString()
	{
		return "RowBound(" + index + ", " + values + ")";
	}
}
