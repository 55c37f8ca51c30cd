package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

/**
 * 'Оборудование': the equipment a signal belongs to.
 */
public class EquipmentLinkParameter extends SignalParameter
{
	public static final String NAME = "Оборудование";

	public EquipmentLinkParameter(Type type)
	{
		super(NAME, type);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitEquipmentLink(this);
	}
}
