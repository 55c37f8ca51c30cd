package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.scope.Scope;

public class RepresentationOption extends Option
{
	public static final String NAME = "отображать";

	public RepresentationOption(ValueNode value, VariableSymbol variable, Scope scope)
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
		finalizer.visitRepresentationOption(this);
	}
}
