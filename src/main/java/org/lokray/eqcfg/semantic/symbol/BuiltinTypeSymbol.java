package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.semantic.type.Type;

/**
 * Names a builtin type (int, float, str, bool, arr) in the module scope.
 */
public class BuiltinTypeSymbol implements Symbol
{
	private final String name;
	private final Type type;

	public BuiltinTypeSymbol(String name, Type type)
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

	@Override
	public String toString()
	{
		return "BuiltinTypeSymbol(" + name + ")";
	}
}
