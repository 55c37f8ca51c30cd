package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A block that accepts parameter assignments and whose name may be extended with
 * variables: {@code сигнал входной аналог T + $n}.
 */
public abstract class ParameterizedBlockNode extends BlockNode
{
	private final List<ParameterAssignNode> parameters = new ArrayList<>();
	private final List<VarRefNode> nameExtensions;

	protected ParameterizedBlockNode(String name, List<VarRefNode> nameExtensions, SourcePosition position)
	{
		super(name, position);
		this.nameExtensions = nameExtensions == null ? List.of() : List.copyOf(nameExtensions);
	}

	public void addParameter(ParameterAssignNode parameter)
	{
		parameters.add(parameter);
	}

	public List<ParameterAssignNode> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public List<VarRefNode> getNameExtensions()
	{
		return nameExtensions;
	}
}
