package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

import java.util.List;

/**
 * 'Описание0' to 'Описание3'.
 */
public class DescriptionParameter extends SignalParameter
{
	public static final List<String> NAMES = List.of("Описание0", "Описание1", "Описание2", "Описание3");

	public DescriptionParameter(String name, Type type)
	{
		super(name, type);
	}

	/**
	 * @return The description level, 0 to 3.
	 */
	public int getLevel()
	{
		return NAMES.indexOf(getName());
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitDescription(this);
	}
}
