package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TemplateNode extends BlockNode
{
	private final List<ContextNode> contexts = new ArrayList<>();
	private final List<ConnectionNode> connections = new ArrayList<>();
	private final List<AstNode> blocks = new ArrayList<>();

	public TemplateNode(String name, SourcePosition position)
	{
		super(name, position);
	}

	public void addContext(ContextNode context)
	{
		contexts.add(context);
	}

	public void addConnection(ConnectionNode connection)
	{
		connections.add(connection);
	}

	public void addBlock(AstNode block)
	{
		blocks.add(block);
	}

	public List<ContextNode> getContexts()
	{
		return Collections.unmodifiableList(contexts);
	}

	public List<ConnectionNode> getConnections()
	{
		return Collections.unmodifiableList(connections);
	}

	public List<AstNode> getBlocks()
	{
		return Collections.unmodifiableList(blocks);
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.TEMPLATE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitTemplate(this);
	}
}
