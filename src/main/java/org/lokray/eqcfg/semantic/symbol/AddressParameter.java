package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

public class AddressParameter extends ConnectionParameter
{
	public static final String NAME = "Адрес";

	public AddressParameter(Type type)
	{
		super(NAME, type);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitAddress(this);
	}
}
