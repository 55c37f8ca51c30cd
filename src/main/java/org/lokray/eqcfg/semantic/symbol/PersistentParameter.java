package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

/**
 * 'Журналируемый': whether changes are written to the log.
 */
public class PersistentParameter extends SignalParameter
{
	public static final String NAME = "Журналируемый";

	public PersistentParameter(Type type)
	{
		super(NAME, type);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitPersistent(this);
	}
}
