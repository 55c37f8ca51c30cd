package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.List;

/**
 * {@code $a, $b: int = 5;} One declaration may introduce several names sharing the type and
 * initializer.
 */
public class VarDeclarationNode extends AbstractNode
{
	private final List<String> names;
	private final TypeNode type;
	private final ValueNode initializer;

	public VarDeclarationNode(List<String> names, TypeNode type, ValueNode initializer, SourcePosition position)
	{
		super(String.join(", ", names), position);
		this.names = List.copyOf(names);
		this.type = type;
		this.initializer = initializer;
	}

	public List<String> getNames()
	{
		return names;
	}

	public TypeNode getType()
	{
		return type;
	}

	/**
	 * @return The initializer, or null for a declaration without one.
	 */
	public ValueNode getInitializer()
	{
		return initializer;
	}

	public boolean hasInitializer()
	{
		return initializer != null;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.VAR_DECLARATION;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitVarDeclaration(this);
	}
}
