package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.scope.Scope;

/**
 * 'обработчик': name of the driver serving a connection address.
 */
public class DriverOption extends Option
{
	public static final String NAME = "обработчик";

	public DriverOption(ValueNode value, VariableSymbol variable, Scope scope)
	{
		super(NAME, value, variable, scope);
	}

	@Override
	public OptionFamily getFamily()
	{
		return OptionFamily.CONNECTION;
	}

	@Override
	public void accept(Finalizer finalizer)
	{
		finalizer.visitDriverOption(this);
	}
}
