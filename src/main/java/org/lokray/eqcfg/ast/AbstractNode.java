package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

public abstract class AbstractNode implements AstNode
{
	private final String name;
	private final SourcePosition position;

	protected AbstractNode(String name, SourcePosition position)
	{
		this.name = name;
		this.position = position == null ? SourcePosition.UNKNOWN : position;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public SourcePosition getPosition()
	{
		return position;
	}

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "(" + name + ")";
	}
}
