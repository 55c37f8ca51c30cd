package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code оборудование класс_а Имя { ... };} An equipment object. Its type is the keyword
 * value of the class, "аналог" or "цифра".
 */
public class ObjectNode extends ParameterizedBlockNode
{
	private final String objectType;
	private final List<ConnectionNode> connections = new ArrayList<>();
	private final List<AstNode> blocks = new ArrayList<>();

	public ObjectNode(String name, String objectType, List<VarRefNode> nameExtensions, SourcePosition position)
	{
		super(name, nameExtensions, position);
		this.objectType = objectType;
	}

	public String getObjectType()
	{
		return objectType;
	}

	public void addConnection(ConnectionNode connection)
	{
		connections.add(connection);
	}

	public void addBlock(AstNode block)
	{
		blocks.add(block);
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
		return NodeKind.OBJECT;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitObject(this);
	}
}
