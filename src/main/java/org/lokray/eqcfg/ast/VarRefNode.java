package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.type.ValueTag;

/**
 * {@code $name} The name is stored without the sigil.
 */
public class VarRefNode extends AbstractNode implements ValueNode
{
	public VarRefNode(String name, SourcePosition position)
	{
		super(name, position);
	}

	@Override
	public ValueTag getValueTag()
	{
		return ValueTag.VARIABLE;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.VARIABLE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitVarRef(this);
	}

	@Override
	public String toString()
	{
		return "$" + getName();
	}
}
