package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.List;

public class ConnectionNode extends ParameterizedBlockNode
{
	public ConnectionNode(String name, List<VarRefNode> nameExtensions, SourcePosition position)
	{
		super(name, nameExtensions, position);
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.CONNECTION;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitConnection(this);
	}
}
