package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

/**
 * {@code .подстановка в Контекст из $rows правило [0:2] <- [i];} The name is the context name.
 */
public class PutDirectiveNode extends AbstractNode
{
	private final VarRefNode source;
	private final PutRuleNode rule;

	public PutDirectiveNode(String contextName, VarRefNode source, PutRuleNode rule, SourcePosition position)
	{
		super(contextName, position);
		this.source = source;
		this.rule = rule;
	}

	public VarRefNode getSource()
	{
		return source;
	}

	/**
	 * @return The row selection rule, or null when every row is used.
	 */
	public PutRuleNode getRule()
	{
		return rule;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.PUT_DIRECTIVE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitPutDirective(this);
	}
}
