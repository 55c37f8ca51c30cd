package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.semantic.scope.ScopeKind;
import org.lokray.eqcfg.semantic.type.Type;

import java.util.Optional;

/**
 * Picks the parameter symbol class for a parameter name in a given kind of scope.
 */
public final class ParameterFactory
{
	private ParameterFactory()
	{
	}

	/**
	 * @return The parameter symbol, or empty when the scope kind has no parameter of that name.
	 */
	public static Optional<ParameterSymbol> create(ScopeKind kind, String name, Type type, boolean strictEquipmentOptions)
	{
		switch (kind)
		{
			case SIGNAL:
				return Optional.ofNullable(createSignalParameter(name, type));
			case CONNECTION:
				return Optional.ofNullable(createConnectionParameter(name, type));
			case EQUIPMENT:
				if (EquipmentIdParameter.NAME.equals(name))
				{
					return Optional.of(new EquipmentIdParameter(type, strictEquipmentOptions));
				}
				return Optional.empty();
			default:
				return Optional.empty();
		}
	}

	private static ParameterSymbol createSignalParameter(String name, Type type)
	{
		if (DescriptionParameter.NAMES.contains(name))
		{
			return new DescriptionParameter(name, type);
		}
		switch (name)
		{
			case SignalIdParameter.NAME:
				return new SignalIdParameter(type);
			case EquipmentLinkParameter.NAME:
				return new EquipmentLinkParameter(type);
			case SignalValueParameter.NAME:
				return new SignalValueParameter(type);
			case FormulaParameter.NAME:
				return new FormulaParameter(type);
			case FormatParameter.NAME:
				return new FormatParameter(type);
			case AckParameter.NAME:
				return new AckParameter(type);
			case PersistentParameter.NAME:
				return new PersistentParameter(type);
			case UnitsParameter.NAME:
				return new UnitsParameter(type);
			default:
				return null;
		}
	}

	private static ParameterSymbol createConnectionParameter(String name, Type type)
	{
		switch (name)
		{
			case ConnectionIdParameter.NAME:
				return new ConnectionIdParameter(type);
			case AddressParameter.NAME:
				return new AddressParameter(type);
			default:
				return null;
		}
	}
}
