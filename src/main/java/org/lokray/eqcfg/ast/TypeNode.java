package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

/**
 * A builtin type name as written: int, float, str, bool or a bare arr.
 */
public class TypeNode extends AbstractNode
{
	public TypeNode(String name, SourcePosition position)
	{
		super(name, position);
	}

	public boolean isArray()
	{
		return "arr".equals(getName());
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.TYPE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitType(this);
	}
}
