package org.lokray.eqcfg.semantic.scope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every scope created during a compilation, keyed by resolved name and kept in
 * registration order.
 */
public class ScopeRegistry
{
	private final Map<String, Scope> scopes = new LinkedHashMap<>();

	public Optional<Scope> get(String name)
	{
		return Optional.ofNullable(scopes.get(name));
	}

	public boolean contains(String name)
	{
		return scopes.containsKey(name);
	}

	public void register(Scope scope)
	{
		scopes.put(scope.getName(), scope);
	}

	/**
	 * @return A snapshot of the registered scopes in registration order.
	 */
	public List<Scope> getScopes()
	{
		return new ArrayList<>(scopes.values());
	}

	public int size()
	{
		return scopes.size();
	}
}
