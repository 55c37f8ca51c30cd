package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.semantic.type.Type;

/**
 * Reserves a directive keyword in the module scope.
 */
public class DirectiveSymbol implements Symbol
{
	private final String name;

	public DirectiveSymbol(String name)
	{
		this.name = name;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return null;
	}

	@Override
	public String toString()
	{
		return "DirectiveSymbol(" + name + ")";
	}
}
