package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

public class OptionNode extends AbstractNode
{
	private final boolean connectionOption;
	private final ValueNode value;

	public OptionNode(String name, boolean connectionOption, ValueNode value, SourcePosition position)
	{
		super(name, position);
		this.connectionOption = connectionOption;
		this.value = value;
	}

	/**
	 * @return True for options introduced by a connection keyword such as 'обработчик'.
	 */
	public boolean isConnectionOption()
	{
		return connectionOption;
	}

	/**
	 * @return The value after '=', or null for a bare option.
	 */
	public ValueNode getValue()
	{
		return value;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.OPTION;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitOption(this);
	}
}
