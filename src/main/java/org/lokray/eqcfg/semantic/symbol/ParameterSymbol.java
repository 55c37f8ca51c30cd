package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.error.ParameterException;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A parameter assigned in an equipment, signal or connection body. There is one subclass per
 * parameter name the scope kinds allow; each accepts options of a single family.
 * <p>
 * The value is either a value node evaluated in the declaring scope, a variable read live, or
 * a {@link NotInitializedSymbol} looked up again by name when the parameter is read.
 */
public abstract class ParameterSymbol implements Symbol
{
	private final String name;
	private final Type type;
	private final OptionFamily allowedFamily;
	private final boolean rejectDuplicateOptions;

	private ValueNode value;
	private Symbol reference;
	private Scope scope;

	private final List<Option> options = new ArrayList<>();
	private final Set<String> registered = new HashSet<>();

	protected ParameterSymbol(String name, Type type, OptionFamily allowedFamily, boolean rejectDuplicateOptions)
	{
		this.name = name;
		this.type = type;
		this.allowedFamily = allowedFamily;
		this.rejectDuplicateOptions = rejectDuplicateOptions;
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

	public OptionFamily getAllowedFamily()
	{
		return allowedFamily;
	}

	public boolean rejectsDuplicateOptions()
	{
		return rejectDuplicateOptions;
	}

	/**
	 * Only the signal value may hold a range.
	 */
	public boolean acceptsRange()
	{
		return false;
	}

	public boolean hasValue()
	{
		return value != null || reference != null;
	}

	public void setValue(ValueNode value, Scope scope)
	{
		this.value = value;
		this.reference = null;
		this.scope = scope;
	}

	/**
	 * @param reference A {@link VariableSymbol} or a {@link NotInitializedSymbol}.
	 */
	public void setReference(Symbol reference, Scope scope)
	{
		this.reference = reference;
		this.value = null;
		this.scope = scope;
	}

	public Symbol getReference()
	{
		return reference;
	}

	public ValueNode getValueNode()
	{
		return value;
	}

	/**
	 * @return The current value of the parameter, or null when it has none yet.
	 */
	public Object resolveValue()
	{
		if (reference instanceof VariableSymbol variable)
		{
			return variable.getValue();
		}
		if (reference instanceof NotInitializedSymbol placeholder)
		{
			Optional<Symbol> symbol = scope.lookup(placeholder.getName());
			if (symbol.isPresent() && symbol.get() instanceof VariableSymbol variable)
			{
				return variable.getValue();
			}
			return null;
		}
		if (value != null)
		{
			return ValueEvaluator.evaluate(value, scope);
		}
		return null;
	}

	/**
	 * Checks the family, builds the option kind for {@code optionName} and records it.
	 *
	 * @throws ParameterException if the family is not accepted here or the option is unknown.
	 * @throws SemanticException  if the option was already registered and duplicates are rejected.
	 */
	public Option registerOption(String optionName, OptionFamily family, ValueNode optionValue, VariableSymbol variable, Scope optionScope)
	{
		if (family != allowedFamily)
		{
			throw new ParameterException("invalid option '" + optionName + "' for " + allowedFamily.getLabel() + " parameter '" + name + "'");
		}

		Option option = Option.create(optionName, optionValue, variable, optionScope);
		if (option.getFamily() != allowedFamily)
		{
			throw new ParameterException("invalid option '" + optionName + "' for " + allowedFamily.getLabel() + " parameter '" + name + "'");
		}
		if (rejectDuplicateOptions && registered.contains(optionName))
		{
			throw new SemanticException("option '" + optionName + "' should be registered once");
		}

		registered.add(optionName);
		options.add(option);
		return option;
	}

	public List<Option> getOptions()
	{
		return Collections.unmodifiableList(options);
	}

	@Override
	public abstract void accept(Finalizer finalizer);

	@Override
	public String toString()
	{
		Object shown = reference != null ? reference : value;
		return getClass().getSimpleName() + "(name=" + name + ", type=" + type.getName() + ", val=" + shown + ", opts=" + options + ")";
	}
}
