package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

/**
 * 'Квитируемый': whether the signal has to be acknowledged.
 */
public class AckParameter extends SignalParameter
{
	public static final String NAME = "Квитируемый";

	public AckParameter(Type type)
	{
		super(NAME, type);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitAck(this);
	}
}
