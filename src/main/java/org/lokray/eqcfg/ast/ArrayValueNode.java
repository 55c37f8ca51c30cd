package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.type.ValueTag;

import java.util.List;

/**
 * {@code [1, 'a', [$x, 2]]}
 */
public class ArrayValueNode extends AbstractNode implements ValueNode
{
	private final List<ValueNode> items;

	public ArrayValueNode(List<ValueNode> items, SourcePosition position)
	{
		super("[]", position);
		this.items = List.copyOf(items);
	}

	public List<ValueNode> getItems()
	{
		return items;
	}

	public int size()
	{
		return items.size();
	}

	@Override
	public ValueTag getValueTag()
	{
		return ValueTag.ARRAY_LITERAL;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.ARRAY;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitArrayValue(this);
	}

	@Override
	public String toString()
	{
		return items.toString();
	}
}
