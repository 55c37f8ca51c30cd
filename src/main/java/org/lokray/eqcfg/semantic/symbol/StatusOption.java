package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.scope.Scope;

/**
 * 'статус': the system state the value stands for, usually one of норма, авария, тревога.
 */
public class StatusOption extends Option
{
	public static final String NAME = "статус";

	public StatusOption(ValueNode value, VariableSymbol variable, Scope scope)
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
		finalizer.visitStatusOption(this);
	}
}
