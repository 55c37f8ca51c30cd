package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of one source file.
 */
public class ModuleNode extends BlockNode
{
	private final List<AstNode> blocks = new ArrayList<>();

	public ModuleNode(String name)
	{
		super(name, SourcePosition.UNKNOWN);
	}

	public void addBlock(AstNode block)
	{
		blocks.add(block);
	}

	public List<AstNode> getBlocks()
	{
		return Collections.unmodifiableList(blocks);
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.MODULE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitModule(this);
	}
}
