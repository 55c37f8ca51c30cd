package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

public interface AstNode
{
	NodeKind getKind();

	String getName();

	SourcePosition getPosition();

	<T> T accept(AstVisitor<T> visitor);
}
