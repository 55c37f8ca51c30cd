package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

public class SignalIdParameter extends SignalParameter
{
	public static final String NAME = "Идентификатор";

	public SignalIdParameter(Type type)
	{
		super(NAME, type);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitSignalId(this);
	}
}
