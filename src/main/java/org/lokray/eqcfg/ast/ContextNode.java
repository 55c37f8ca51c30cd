package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code контекст Имя { $a, $b: int; };} The variables are the columns a put directive
 * fills row by row.
 */
public class ContextNode extends AbstractNode
{
	private final List<VarDeclarationNode> variables = new ArrayList<>();

	public ContextNode(String name, SourcePosition position)
	{
		super(name, position);
	}

	public void addVariable(VarDeclarationNode variable)
	{
		variables.add(variable);
	}

	public List<VarDeclarationNode> getVariables()
	{
		return Collections.unmodifiableList(variables);
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.CONTEXT;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitContext(this);
	}
}
