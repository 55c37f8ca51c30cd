package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.type.ValueTag;

/**
 * {@code диапазон[min, max]} Either bound may be a literal, a variable reference or '~'.
 */
public class RangeNode extends AbstractNode implements ValueNode
{
	private final ValueNode min;
	private final ValueNode max;

	public RangeNode(ValueNode min, ValueNode max, SourcePosition position)
	{
		super("диапазон", position);
		this.min = min;
		this.max = max;
	}

	public ValueNode getMin()
	{
		return min;
	}

	public ValueNode getMax()
	{
		return max;
	}

	@Override
	public ValueTag getValueTag()
	{
		return ValueTag.RANGE;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.RANGE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitRange(this);
	}

	@Override
	public String toString()
	{
		return "[" + min + ", " + max + "]";
	}
}
