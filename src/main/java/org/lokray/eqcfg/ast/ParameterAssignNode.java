package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.List;

/**
 * {@code Значение: float = диапазон[0, 10] статус = норма;}
 */
public class ParameterAssignNode extends AbstractNode
{
	private final TypeNode type;
	private final ValueNode value;
	private final List<OptionNode> options;

	public ParameterAssignNode(String name, TypeNode type, ValueNode value, List<OptionNode> options, SourcePosition position)
	{
		super(name, position);
		this.type = type;
		this.value = value;
		this.options = List.copyOf(options);
	}

	public TypeNode getType()
	{
		return type;
	}

	public ValueNode getValue()
	{
		return value;
	}

	public List<OptionNode> getOptions()
	{
		return options;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.PARAM_ASSIGN;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitParameterAssign(this);
	}
}
