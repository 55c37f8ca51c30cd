package org.lokray.eqcfg.semantic.scope;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.semantic.symbol.AckParameter;
import org.lokray.eqcfg.semantic.symbol.DescriptionParameter;
import org.lokray.eqcfg.semantic.symbol.EquipmentLinkParameter;
import org.lokray.eqcfg.semantic.symbol.FormatParameter;
import org.lokray.eqcfg.semantic.symbol.FormulaParameter;
import org.lokray.eqcfg.semantic.symbol.PersistentParameter;
import org.lokray.eqcfg.semantic.symbol.SignalIdParameter;
import org.lokray.eqcfg.semantic.symbol.SignalValueParameter;
import org.lokray.eqcfg.semantic.symbol.UnitsParameter;

import java.util.HashSet;
import java.util.Set;

public class SignalScope extends Scope
{
	private static final Set<String> ALLOWED_PARAMETERS;

	static
	{
		Set<String> allowed = new HashSet<>();
		allowed.add(SignalIdParameter.NAME);
		allowed.add(UnitsParameter.NAME);
		allowed.add(SignalValueParameter.NAME);
		allowed.addAll(DescriptionParameter.NAMES);
		allowed.add(FormulaParameter.NAME);
		allowed.add(FormatParameter.NAME);
		allowed.add(AckParameter.NAME);
		allowed.add(PersistentParameter.NAME);
		allowed.add(EquipmentLinkParameter.NAME);
		ALLOWED_PARAMETERS = Set.copyOf(allowed);
	}

	private final String direction;
	private final String signalType;
	private ConnectionLink link;

	public SignalScope(String name, String baseName, String direction, String signalType, Scope enclosingScope)
	{
		super(name, baseName, enclosingScope);
		this.direction = direction;
		this.signalType = signalType;
	}

	public String getDirection()
	{
		return direction;
	}

	public String getSignalType()
	{
		return signalType;
	}

	public ConnectionLink getLink()
	{
		return link;
	}

	/**
	 * Links this signal to a connection. Binding the same connection again is a no-op; a
	 * different one is an error.
	 */
	public void bindTo(ConnectionScope connection)
	{
		if (link == null)
		{
			link = new ConnectionLink(connection.getName(), connection);
			return;
		}
		if (link.getTarget() != connection)
		{
			throw new SemanticException("signal '" + getName() + "' is already bound to connection '" + link.getName()
					+ "', cannot bind '" + connection.getName() + "'");
		}
	}

	@Override
	public ScopeKind getKind()
	{
		return ScopeKind.SIGNAL;
	}

	@Override
	public Set<String> getAllowedParameters()
	{
		return ALLOWED_PARAMETERS;
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitSignal(this);
	}
}
