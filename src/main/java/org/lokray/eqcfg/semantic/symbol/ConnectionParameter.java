package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.semantic.type.Type;

public abstract class ConnectionParameter extends ParameterSymbol
{
	protected ConnectionParameter(String name, Type type)
	{
		super(name, type, OptionFamily.CONNECTION, true);
	}
}
