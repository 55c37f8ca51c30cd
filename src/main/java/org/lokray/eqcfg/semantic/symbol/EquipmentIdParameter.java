package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

public class EquipmentIdParameter extends EquipmentParameter
{
	public static final String NAME = "Идентификатор";

	public EquipmentIdParameter(Type type, boolean strictOptions)
	{
		super(NAME, type, strictOptions);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitEquipmentId(this);
	}
}
