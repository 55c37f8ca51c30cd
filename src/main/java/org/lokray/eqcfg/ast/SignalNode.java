package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.parser.SourcePosition;

import java.util.List;

/**
 * {@code сигнал входной аналог Имя { ... };}
 */
public class SignalNode extends ParameterizedBlockNode
{
	private final String direction;
	private final String signalType;
	private ConnectionNode connection;

	public SignalNode(String name, String direction, String signalType, List<VarRefNode> nameExtensions, SourcePosition position)
	{
		super(name, nameExtensions, position);
		this.direction = direction;
		this.signalType = signalType;
	}

	public String getDirection()
	{
		return direction;
	}

	public String getSignalType()
	{
		return signalType;
	}

	public ConnectionNode getConnection()
	{
		return connection;
	}

	/**
	 * A signal owns at most one nested connection.
	 */
	public void setConnection(ConnectionNode connection)
	{
		if (this.connection != null)
		{
			throw new SemanticException("signal '" + getName() + "' already has a connection '" + this.connection.getName() + "'",
					connection.getPosition().renderTrace());
		}
		this.connection = connection;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.SIGNAL;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitSignal(this);
	}
}
