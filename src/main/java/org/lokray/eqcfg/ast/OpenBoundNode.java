package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.type.ValueTag;

/**
 * The '~' bound of a range: negative infinity as a minimum, positive infinity as a maximum.
 */
public class OpenBoundNode extends AbstractNode implements ValueNode
{
	private final boolean upper;

	public OpenBoundNode(boolean upper, SourcePosition position)
	{
		super("~", position);
		this.upper = upper;
	}

	public boolean isUpper()
	{
		return upper;
	}

	public double getValue()
	{
		return upper ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
	}

	@Override
	public ValueTag getValueTag()
	{
		return ValueTag.FLOAT_LITERAL;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.OPEN_BOUND;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitOpenBound(this);
	}

	@Override
	public String toString()
	{
		return upper ? "+inf" : "-inf";
	}
}
