package org.lokray.eqcfg.ast;

/**
 * Visitor that walks every child and returns {@link #defaultResult()}. Override only the
 * nodes of interest.
 */
public abstract class AstBaseVisitor<T> implements AstVisitor<T>
{
	protected T defaultResult()
	{
		return null;
	}

	protected void visitAll(Iterable<? extends AstNode> nodes)
	{
		for (AstNode node : nodes)
		{
			node.accept(this);
		}
	}

	@Override
	public T visitModule(ModuleNode node)
	{
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getBlocks());
		return defaultResult();
	}

	@Override
	public T visitTemplate(TemplateNode node)
	{
		visitAll(node.getContexts());
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getConnections());
		visitAll(node.getBlocks());
		return defaultResult();
	}

	@Override
	public T visitContext(ContextNode node)
	{
		visitAll(node.getVariables());
		return defaultResult();
	}

	@Override
	public T visitObject(ObjectNode node)
	{
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getParameters());
		visitAll(node.getConnections());
		visitAll(node.getBlocks());
		return defaultResult();
	}

	@Override
	public T visitSignal(SignalNode node)
	{
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getParameters());
		if (node.getConnection() != null)
		{
			node.getConnection().accept(this);
		}
		return defaultResult();
	}

	@Override
	public T visitConnection(ConnectionNode node)
	{
		visitAll(node.getVariables());
		visitAll(node.getDirectives());
		visitAll(node.getParameters());
		return defaultResult();
	}

	@Override
	public T visitVarDeclaration(VarDeclarationNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitParameterAssign(ParameterAssignNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitOption(OptionNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitType(TypeNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitArrayType(ArrayTypeNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitLiteral(LiteralNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitArrayValue(ArrayValueNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitRange(RangeNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitOpenBound(OpenBoundNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitSystemConst(SystemConstNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitVarRef(VarRefNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitDynamicName(DynamicNameNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitUseDirective(UseDirectiveNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitUseFilter(UseFilterNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitPutDirective(PutDirectiveNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitPutRule(PutRuleNode node)
	{
		return defaultResult();
	}

	@Override
	public T visitBindDirective(BindDirectiveNode node)
	{
		return defaultResult();
	}
}
