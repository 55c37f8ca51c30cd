package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

/**
 * 'все' or 'кроме X'.
 */
public class UseFilterNode extends AbstractNode
{
	private final ValueNode excluded;

	public UseFilterNode(ValueNode excluded, SourcePosition position)
	{
		super(excluded == null ? "все" : "кроме", position);
		this.excluded = excluded;
	}

	public boolean isExcluding()
	{
		return excluded != null;
	}

	public ValueNode getExcluded()
	{
		return excluded;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.USE_FILTER;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitUseFilter(this);
	}
}
