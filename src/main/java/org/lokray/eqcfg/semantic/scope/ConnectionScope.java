package org.lokray.eqcfg.semantic.scope;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.symbol.AddressParameter;
import org.lokray.eqcfg.semantic.symbol.ConnectionIdParameter;

import java.util.Set;

/**
 * A connection is named by its fully resolved name and declared under that name in the
 * scope that encloses it, which is how bind directives find it.
 */
public class ConnectionScope extends Scope
{
	private static final Set<String> ALLOWED_PARAMETERS = Set.of(ConnectionIdParameter.NAME, AddressParameter.NAME);

	public ConnectionScope(String name, String baseName, Scope enclosingScope)
	{
		super(name, baseName, enclosingScope);
	}

	@Override
	public ScopeKind getKind()
	{
		return ScopeKind.CONNECTION;
	}

	@Override
	public Set<String> getAllowedParameters()
	{
		return ALLOWED_PARAMETERS;
	}

	/**
	 * The name is already fully resolved.
	 */
	@Override
	public String resolveFullName()
	{
		return getName();
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitConnection(this);
	}
}
