package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

/**
 * {@code .использовать Контекст линейно значения все;} The name is the context name.
 */
public class UseDirectiveNode extends AbstractNode
{
	private final String method;
	private final UseFilterNode filter;

	public UseDirectiveNode(String contextName, String method, UseFilterNode filter, SourcePosition position)
	{
		super(contextName, position);
		this.method = method;
		this.filter = filter;
	}

	public String getMethod()
	{
		return method;
	}

	public UseFilterNode getFilter()
	{
		return filter;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.USE_DIRECTIVE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitUseDirective(this);
	}
}
