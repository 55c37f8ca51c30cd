package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.List;

/**
 * {@code .привязать Связь + $n;} The name is the base name of the target connection.
 */
public class BindDirectiveNode extends AbstractNode
{
	private final List<VarRefNode> extensions;

	public BindDirectiveNode(String baseName, List<VarRefNode> extensions, SourcePosition position)
	{
		super(baseName, position);
		this.extensions = List.copyOf(extensions);
	}

	public List<VarRefNode> getExtensions()
	{
		return extensions;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.BIND_DIRECTIVE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitBindDirective(this);
	}
}
