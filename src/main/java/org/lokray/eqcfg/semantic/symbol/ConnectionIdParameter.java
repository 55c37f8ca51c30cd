package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

public class ConnectionIdParameter extends ConnectionParameter
{
	public static final String NAME = "Идентификатор";

	public ConnectionIdParameter(Type type)
	{
		super(NAME, type);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitConnectionId(this);
	}
}
