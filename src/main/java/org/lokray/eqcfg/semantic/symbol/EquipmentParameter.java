package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.semantic.type.Type;

/**
 * Equipment parameters take connection options. Repeated options are accepted unless the
 * compiler runs with strict equipment options.
 */
public abstract class EquipmentParameter extends ParameterSymbol
{
	protected EquipmentParameter(String name, Type type, boolean strictOptions)
	{
		super(name, type, OptionFamily.CONNECTION, strictOptions);
	}
}
