package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.scope.Scope;

public class SeverityOption extends Option
{
	public static final String NAME = "важность";

	public SeverityOption(ValueNode value, VariableSymbol variable, Scope scope)
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
		finalizer.visitSeverityOption(this);
	}
}
