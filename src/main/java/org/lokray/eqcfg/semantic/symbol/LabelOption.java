package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.scope.Scope;

/**
 * 'метка': display label of a value.
 */
public class LabelOption extends Option
{
	public static final String NAME = "метка";

	public LabelOption(ValueNode value, VariableSymbol variable, Scope scope)
	{
		super(NAME, value, variable, scope);
	}

	@Override
	public OptionFamily getFamily()
	{
		return OptionFamily.SIGNAL;
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitLabelOption(this);
	}
}
