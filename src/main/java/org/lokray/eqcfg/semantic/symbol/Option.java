package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.error.ParameterException;
import org.lokray.eqcfg.semantic.scope.Scope;

/**
 * An option attached to a parameter, e.g. {@code статус = норма}. A value given as a
 * variable is read from that variable every time the option is read.
 */
public abstract class Option
{
	private final String name;
	private final ValueNode value;
	private final VariableSymbol variable;
	private final Scope scope;

	protected Option(String name, ValueNode value, VariableSymbol variable, Scope scope)
	{
		this.name = name;
		this.value = value;
		this.variable = variable;
		this.scope = scope;
	}

	/**
	 * Builds the option kind registered under {@code name}.
	 *
	 * @throws ParameterException if no option of that name exists.
	 */
	public static Option create(String name, ValueNode value, VariableSymbol variable, Scope scope)
	{
		switch (name)
		{
			case StatusOption.NAME:
				return new StatusOption(value, variable, scope);
			case RepresentationOption.NAME:
				return new RepresentationOption(value, variable, scope);
			case SeverityOption.NAME:
				return new SeverityOption(value, variable, scope);
			case LabelOption.NAME:
				return new LabelOption(value, variable, scope);
			case DriverOption.NAME:
				return new DriverOption(value, variable, scope);
			default:
				throw new ParameterException("unexpected parameter option '" + name + "'");
		}
	}

	public String getName()
	{
		return name;
	}

	public abstract OptionFamily getFamily();

	/**
	 * @return The option value, or null for an option written without '='.
	 */
	public Object getValue()
	{
		if (variable != null)
		{
			return variable.getValue();
		}
		if (value == null)
		{
			return null;
		}
		return ValueEvaluator.evaluate(value, scope);
	}

	public abstract void accept(Finalizer finalizer);

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "(name=" + name + ", value=" + (variable != null ? "$" + variable.getName() : value) + ")";
	}
}
