package org.lokray.eqcfg.semantic.scope;

import org.lokray.eqcfg.emit.Finalizer;

import java.util.Set;

public class ModuleScope extends Scope
{
	public ModuleScope(String name)
	{
		super(name, name, null);
	}

	@Override
	public ScopeKind getKind()
	{
		return ScopeKind.MODULE;
	}

	@Override
	public Set<String> getAllowedParameters()
	{
		return Set.of();
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitModule(this);
	}
}
