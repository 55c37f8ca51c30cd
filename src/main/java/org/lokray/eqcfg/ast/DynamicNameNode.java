package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.type.ValueTag;

import java.util.List;

/**
 * {@code (base + $a + $b)} A name built from a base and the values of variables, evaluated
 * to a string.
 */
public class DynamicNameNode extends AbstractNode implements ValueNode
{
	private final List<VarRefNode> extensions;

	public DynamicNameNode(String base, List<VarRefNode> extensions, SourcePosition position)
	{
		super(base, position);
		this.extensions = List.copyOf(extensions);
	}

	public List<VarRefNode> getExtensions()
	{
		return extensions;
	}

	@Override
	public ValueTag getValueTag()
	{
		return ValueTag.DYNAMIC_NAME;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.DYNAMIC_NAME;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitDynamicName(this);
	}
}
