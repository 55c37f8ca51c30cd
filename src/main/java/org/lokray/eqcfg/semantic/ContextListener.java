package org.lokray.eqcfg.semantic;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.semantic.symbol.ValueEvaluator;

import java.util.ArrayList;
import java.util.List;

/**
 * A scope registered by a use directive, replayed for every row of the context it listens
 * to. With 'кроме X' a row is skipped when any of its values equals X, or any element of X
 * when X is an array.
 */
public class ContextListener
{
	private final Scope scope;
	private final String method;
	private final ValueNode excluded;

	public ContextListener(Scope scope, String method, ValueNode excluded)
	{
		this.scope = scope;
		this.method = method;
		this.excluded = excluded;
	}

	public Scope getScope()
	{
		return scope;
	}

	public String getMethod()
	{
		return method;
	}

	public boolean admits(RowBound row)
	{
		if (excluded == null)
		{
			return true;
		}

		Object value = ValueEvaluator.evaluate(excluded, scope);
		List<Object> rejected = new ArrayList<>();
		if (value instanceof List<?> items)
		{
			rejected.addAll(items);
		}
		else
		{
			rejected.add(value);
		}

		for (Object cell : row.getValues())
		{
			for (Object candidate : rejected)
			{
				if (ValueEvaluator.sameValue(cell, candidate))
				{
					return false;
				}
			}
		}
		return true;
	}

	@Override
	public String toString()
	{
		return "ContextListener(" + scope.getName() + ", " + method + (excluded == null ? ", все" : ", кроме " + excluded) + ")";
	}
}
