package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

/**
 * Either a slice {@code [from:to] <- [i]} or a variable holding the row indices.
 */
public class PutRuleNode extends AbstractNode
{
	private final long from;
	private final long to;
	private final VarRefNode indices;

	public PutRuleNode(long from, long to, SourcePosition position)
	{
		super("правило", position);
		this.from = from;
		this.to = to;
		this.indices = null;
	}

	public PutRuleNode(VarRefNode indices, SourcePosition position)
	{
		super("правило", position);
		this.from = -1;
		this.to = -1;
		this.indices = indices;
	}

	public boolean isSlice()
	{
		return indices == null;
	}

	public long getFrom()
	{
		return from;
	}

	public long getTo()
	{
		return to;
	}

	public VarRefNode getIndices()
	{
		return indices;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.PUT_RULE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitPutRule(this);
	}
}
