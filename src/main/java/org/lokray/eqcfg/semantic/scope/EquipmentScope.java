package org.lokray.eqcfg.semantic.scope;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.symbol.EquipmentIdParameter;

import java.util.Set;

public class EquipmentScope extends Scope
{
	private static final Set<String> ALLOWED_PARAMETERS = Set.of(EquipmentIdParameter.NAME);

	private final String equipmentType;

	public EquipmentScope(String name, String baseName, String equipmentType, Scope enclosingScope)
	{
		super(name, baseName, enclosingScope);
		this.equipmentType = equipmentType;
	}

	/**
	 * @return "аналог" or "цифра".
	 */
	public String getEquipmentType()
	{
		return equipmentType;
	}

	@Override
	public ScopeKind getKind()
	{
		return ScopeKind.EQUIPMENT;
	}

	@Override
	public Set<String> getAllowedParameters()
	{
		return ALLOWED_PARAMETERS;
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitEquipment(this);
	}
}
