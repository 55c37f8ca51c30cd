package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.semantic.type.Type;
import org.lokray.eqcfg.semantic.type.ValueTag;

/**
 * Stands in for a variable that had no value when a parameter referenced it, typically a
 * context variable filled row by row. The parameter looks the name up again when read.
 */
public class NotInitializedSymbol implements Symbol
{
	private final String name;
	private final Type type;

	public NotInitializedSymbol(String name, Type type)
	{
		this.name = name;
		this.type = type;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return type;
	}

	public ValueTag getValueTag()
	{
		return type.getValueTag();
	}

	@Override
	public String toString()
	{
		return "NOT_INIT(" + name + ":" + type.getName() + ")";
	}
}
