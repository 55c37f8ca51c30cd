package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Common body of every braced block: variable declarations and directives in source order.
 * Subclasses add the members their block kind accepts.
 */
public abstract class BlockNode extends AbstractNode
{
	private final List<VarDeclarationNode> variables = new ArrayList<>();
	private final List<AstNode> directives = new ArrayList<>();

	protected BlockNode(String name, SourcePosition position)
	{
		super(name, position);
	}

	public void addVariable(VarDeclarationNode variable)
	{
		variables.add(variable);
	}

	public void addDirective(AstNode directive)
	{
		directives.add(directive);
	}

	public List<VarDeclarationNode> getVariables()
	{
		return Collections.unmodifiableList(variables);
	}

	public List<AstNode> getDirectives()
	{
		return Collections.unmodifiableList(directives);
	}
}
