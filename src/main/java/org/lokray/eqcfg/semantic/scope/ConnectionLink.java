package org.lokray.eqcfg.semantic.scope;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.symbol.Symbol;
import org.lokray.eqcfg.semantic.type.Type;

/**
 * The link a bind directive leaves on a signal. The target stays reachable after the
 * connection has been replayed and dropped from the registry.
 */
public class ConnectionLink implements Symbol
{
	private final String name;
	private final ConnectionScope target;

	public ConnectionLink(String name, ConnectionScope target)
	{
		this.name = name;
		this.target = target;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return null;
	}

	public ConnectionScope getTarget()
	{
		return target;
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitConnectionLink(this);
	}

	@Override
	public String toString()
	{
		return "ConnectionLink(" + name + ")";
	}
}
