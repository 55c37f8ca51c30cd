package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.semantic.type.Type;

public abstract class SignalParameter extends ParameterSymbol
{
	protected SignalParameter(String name, Type type)
	{
		super(name, type, OptionFamily.SIGNAL, true);
	}
}
