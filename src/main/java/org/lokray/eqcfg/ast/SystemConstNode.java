package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.type.ValueTag;

/**
 * One of the system constants 'норма', 'авария' or 'тревога'. Its value is its text.
 */
public class SystemConstNode extends AbstractNode implements ValueNode
{
	public SystemConstNode(String name, SourcePosition position)
	{
		super(name, position);
	}

	@Override
	public ValueTag getValueTag()
	{
		return ValueTag.SYSTEM_CONST;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.SYSTEM_CONST;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitSystemConst(this);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
