package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.semantic.type.ValueTag;

/**
 * Anything that may appear on the right of '=': literals, arrays, ranges, range bounds,
 * system constants, variable references and dynamic names.
 */
public interface ValueNode extends AstNode
{
	ValueTag getValueTag();
}
