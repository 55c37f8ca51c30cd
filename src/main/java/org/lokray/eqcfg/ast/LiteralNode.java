package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.type.ValueTag;

/**
 * Scalar literal. The leading minus of a numeric literal is kept as a flag and applied
 * when the value is read.
 */
public class LiteralNode extends AbstractNode implements ValueNode
{
	private final ValueTag tag;
	private final Object value;
	private final boolean negative;

	public LiteralNode(ValueTag tag, Object value, boolean negative, SourcePosition position)
	{
		super(String.valueOf(value), position);
		this.tag = tag;
		this.value = value;
		this.negative = negative;
	}

	public LiteralNode(ValueTag tag, Object value, SourcePosition position)
	{
		this(tag, value, false, position);
	}

	/**
	 * @return The value with the sign applied: a Long, Double, String or Boolean.
	 */
	public Object getValue()
	{
		if (!negative)
		{
			return value;
		}
		if (value instanceof Long)
		{
			return -(Long) value;
		}
		if (value instanceof Double)
		{
			return -(Double) value;
		}
		return value;
	}

	public boolean isNegative()
	{
		return negative;
	}

	@Override
	public ValueTag getValueTag()
	{
		return tag;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.LITERAL;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitLiteral(this);
	}

	@Override
	public String toString()
	{
		return String.valueOf(getValue());
	}
}
