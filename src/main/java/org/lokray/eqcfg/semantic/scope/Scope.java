package org.lokray.eqcfg.semantic.scope;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.error.ParameterException;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.semantic.symbol.ParameterSymbol;
import org.lokray.eqcfg.semantic.symbol.Symbol;
import org.lokray.eqcfg.semantic.symbol.ValueEvaluator;
import org.lokray.eqcfg.semantic.symbol.VariableSymbol;
import org.lokray.eqcfg.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Symbol table of one block. Scopes are chained through their enclosing scope; lookups walk
 * the chain outwards. A scope may have a context bound to it by a use directive, whose
 * variables are then visible as if declared here.
 */
public abstract class Scope implements Symbol
{
	private final String name;
	private final String baseName;
	private final Scope enclosingScope;
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();
	private final Map<String, List<ParameterSymbol>> parameters = new LinkedHashMap<>();
	private final List<String> nameExtensions = new ArrayList<>();
	private ContextScope context;

	/**
	 * @param name      The registry key: the base name followed by every extension value known
	 *                  when the scope is created.
	 * @param baseName  The name as written in the source.
	 * @param enclosingScope The scope the block is nested in, or null for the module.
	 */
	protected Scope(String name, String baseName, Scope enclosingScope)
	{
		this.name = name;
		this.baseName = baseName;
		this.enclosingScope = enclosingScope;
	}

	public abstract ScopeKind getKind();

	/**
	 * @return The parameter names this kind of scope accepts.
	 */
	public abstract Set<String> getAllowedParameters();

	@Override
	public abstract void accept(Finalizer finalizer);

	@Override
	public String getName()
	{
		return name;
	}

	public String getBaseName()
	{
		return baseName;
	}

	@Override
	public Type getType()
	{
		return null;
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	public void declare(String symbolName, Symbol symbol)
	{
		if (symbols.containsKey(symbolName))
		{
			throw new SemanticException("attempt to redefine symbol '" + symbolName + "' in scope '" + name + "'");
		}
		symbols.put(symbolName, symbol);
	}

	public void declareParameter(String parameterName, ParameterSymbol parameter)
	{
		if (!getAllowedParameters().contains(parameterName))
		{
			throw new ParameterException("impossible parameter '" + parameterName + "' for " + getKind().getLabel() + " scope '" + name + "'");
		}
		parameters.computeIfAbsent(parameterName, k -> new ArrayList<>()).add(parameter);
	}

	public Optional<Symbol> lookup(String symbolName)
	{
		return lookup(symbolName, false);
	}

	/**
	 * Searches the own table, then the bound context, then (unless {@code onlyCurrent}) the
	 * enclosing scopes.
	 */
	public Optional<Symbol> lookup(String symbolName, boolean onlyCurrent)
	{
		Symbol symbol = symbols.get(symbolName);
		if (symbol == null && context != null)
		{
			symbol = context.lookup(symbolName).orElse(null);
		}
		if (symbol != null || onlyCurrent)
		{
			return Optional.ofNullable(symbol);
		}
		if (enclosingScope != null)
		{
			return enclosingScope.lookup(symbolName);
		}
		return Optional.empty();
	}

	/**
	 * @return Every parameter declared here under {@code parameterName}, in declaration order.
	 */
	public List<ParameterSymbol> lookupParameter(String parameterName)
	{
		List<ParameterSymbol> declared = parameters.get(parameterName);
		return declared == null ? List.of() : Collections.unmodifiableList(declared);
	}

	public List<ParameterSymbol> getParameters()
	{
		List<ParameterSymbol> all = new ArrayList<>();
		parameters.values().forEach(all::addAll);
		return all;
	}

	public Map<String, Symbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	public List<VariableSymbol> getVariables()
	{
		List<VariableSymbol> variables = new ArrayList<>();
		for (Symbol symbol : symbols.values())
		{
			if (symbol instanceof VariableSymbol variable)
			{
				variables.add(variable);
			}
		}
		return variables;
	}

	public Optional<ContextScope> lookupContext(String contextName)
	{
		if (context != null && context.getName().equals(contextName))
		{
			return Optional.of(context);
		}
		if (enclosingScope != null)
		{
			return enclosingScope.lookupContext(contextName);
		}
		return Optional.empty();
	}

	public ContextScope getContext()
	{
		return context;
	}

	/**
	 * Binds a context once; a second binding is an error.
	 */
	public void bindContext(ContextScope context)
	{
		if (this.context != null)
		{
			throw new SemanticException("attempt to redefine context: " + context.getName());
		}
		this.context = context;
	}

	public void setNameExtensions(List<String> extensions)
	{
		nameExtensions.clear();
		nameExtensions.addAll(extensions);
	}

	public List<String> getNameExtensions()
	{
		return Collections.unmodifiableList(nameExtensions);
	}

	/**
	 * Renders the base name followed by the current value of every name extension. Context
	 * variables contribute the value of the row being replayed.
	 */
	public String resolveFullName()
	{
		StringBuilder builder = new StringBuilder(baseName);
		for (String extension : nameExtensions)
		{
			VariableSymbol variable = ValueEvaluator.resolveVariable(extension, this);
			Object value = variable.getValue();
			if (value == null)
			{
				throw new SemanticException("name extension '$" + extension + "' of '" + baseName + "' has no value");
			}
			builder.append(ValueEvaluator.format(value));
		}
		return builder.toString();
	}

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "(" + name + ", " + getKind().getLabel()
				+ ", symbs=" + symbols.keySet() + ", params=" + parameters.keySet()
				+ ", ctx=" + (context == null ? null : context.getName()) + ")";
	}
}
