package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.semantic.type.Type;
import org.lokray.eqcfg.semantic.type.ValueTag;

/**
 * A declared variable. The value is kept as the AST node it was assigned from, together
 * with the scope that node is evaluated in, so references inside it are read when the
 * value is read. A variable initialized from another variable aliases it and follows its
 * value.
 */
public class VariableSymbol implements Symbol
{
	private final String name;
	private final Type type;
	private ValueNode value;
	private Scope valueScope;
	private VariableSymbol alias;

	public VariableSymbol(String name, Type type)
	{
		this.name = name;
		this.type = type;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return type;
	}

	public ValueTag getValueTag()
	{
		return type.getValueTag();
	}

	public void setValue(ValueNode value, Scope valueScope)
	{
		this.value = value;
		this.valueScope = valueScope;
		this.alias = null;
	}

	public void aliasTo(VariableSymbol target)
	{
		this.alias = target;
		this.value = null;
		this.valueScope = null;
	}

	public VariableSymbol getAlias()
	{
		return alias;
	}

	/**
	 * @return The variable at the end of the alias chain, this one when it is no alias.
	 */
	public VariableSymbol resolveTarget()
	{
		VariableSymbol target = this;
		while (target.alias != null)
		{
			target = target.alias;
		}
		return target;
	}

	public boolean hasValue()
	{
		return resolveTarget().value != null;
	}

	public ValueNode getValueNode()
	{
		return resolveTarget().value;
	}

	public Scope getValueScope()
	{
		return resolveTarget().valueScope;
	}

	/**
	 * @return The evaluated value, or null when nothing has been assigned yet.
	 */
	public Object getValue()
	{
		VariableSymbol target = resolveTarget();
		if (target.value == null)
		{
			return null;
		}
		return ValueEvaluator.evaluate(target.value, target.valueScope);
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitVariable(this);
	}

	@Override
	public String toString()
	{
		return "VariableSymbol(" + name + ": " + type.getName() + ")";
	}
}
