package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

public class FormatParameter extends SignalParameter
{
	public static final String NAME = "Формат";

	public FormatParameter(Type type)
	{
		super(NAME, type);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitFormat(this);
	}
}
