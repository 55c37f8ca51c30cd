package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

/**
 * 'Значение': the value description of a signal. The only parameter that may be a range.
 */
public class SignalValueParameter extends SignalParameter
{
	public static final String NAME = "Значение";

	public SignalValueParameter(Type type)
	{
		super(NAME, type);
	}

	@Override
	public boolean acceptsRange()
	{
		return true;
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitSignalValue(this);
	}
}
