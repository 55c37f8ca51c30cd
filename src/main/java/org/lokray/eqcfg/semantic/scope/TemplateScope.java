package org.lokray.eqcfg.semantic.scope;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.semantic.symbol.Symbol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A template owns the contexts declared in it. Their variables are visible to every block
 * of the template; their values change row by row when a put directive feeds them.
 */
public class TemplateScope extends Scope
{
	private final Map<String, ContextScope> contexts = new LinkedHashMap<>();

	public TemplateScope(String name, Scope enclosingScope)
	{
		super(name, name, enclosingScope);
	}

	public void addContext(ContextScope context)
	{
		if (contexts.containsKey(context.getName()))
		{
			throw new SemanticException("redefine declared context '" + context.getName() + "' not allowed");
		}
		contexts.put(context.getName(), context);
	}

	public List<ContextScope> getContexts()
	{
		return new ArrayList<>(contexts.values());
	}

	/**
	 * Searches the own table, then every owned context in declaration order, then the
	 * enclosing scopes.
	 */
	@Override
	public Optional<Symbol> lookup(String symbolName, boolean onlyCurrent)
	{
		Symbol symbol = getSymbols().get(symbolName);
		if (symbol == null)
		{
			for (ContextScope context : contexts.values())
			{
				Optional<? extends Symbol> found = context.lookup(symbolName);
				if (found.isPresent())
				{
					symbol = found.get();
					break;
				}
			}
		}
		if (symbol != null || onlyCurrent)
		{
			return Optional.ofNullable(symbol);
		}
		if (getEnclosingScope() != null)
		{
			return getEnclosingScope().lookup(symbolName);
		}
		return Optional.empty();
	}

	/**
	 * Contexts never cross a template boundary: only owned contexts are found.
	 */
	@Override
	public Optional<ContextScope> lookupContext(String contextName)
	{
		return Optional.ofNullable(contexts.get(contextName));
	}

	@Override
	public ScopeKind getKind()
	{
		return ScopeKind.TEMPLATE;
	}

	@Override
	public Set<String> getAllowedParameters()
	{
		return Set.of();
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitTemplate(this);
	}
}
