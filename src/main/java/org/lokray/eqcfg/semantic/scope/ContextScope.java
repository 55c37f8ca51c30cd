package org.lokray.eqcfg.semantic.scope;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.semantic.symbol.Symbol;
import org.lokray.eqcfg.semantic.symbol.VariableSymbol;
import org.lokray.eqcfg.semantic.type.Type;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flat table of variables owned by a template. A put directive rewrites the values once
 * per data row; the order of declaration is the order of the row's columns.
 */
public class ContextScope implements Symbol
{
	private final String name;
	private final TemplateScope owner;
	private final Map<String, VariableSymbol> symbols = new LinkedHashMap<>();

	public ContextScope(String name, TemplateScope owner)
	{
		this.name = name;
		this.owner = owner;
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

	public TemplateScope getOwner()
	{
		return owner;
	}

	public void declare(VariableSymbol symbol)
	{
		if (symbols.containsKey(symbol.getName()))
		{
			throw new SemanticException("attempt to redefine context symbol '" + symbol.getName() + "'");
		}
		symbols.put(symbol.getName(), symbol);
	}

	public List<String> getSymbolKeys()
	{
		return new ArrayList<>(symbols.keySet());
	}

	public List<VariableSymbol> getVariables()
	{
		return new ArrayList<>(symbols.values());
	}

	public void setValue(String symbolName, ValueNode value, Scope valueScope)
	{
		VariableSymbol variable = symbols.get(symbolName);
		if (variable == null)
		{
			throw new SemanticException("var '" + symbolName + "' not declared in context '" + name + "'");
		}
		variable.setValue(value, valueScope);
	}

	public Optional<VariableSymbol> lookup(String symbolName)
	{
		return Optional.ofNullable(symbols.get(symbolName));
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitContext(this);
	}

	@Override
	public String toString()
	{
		return "ContextScope(" + name + ", " + symbols.keySet() + ")";
	}
}
