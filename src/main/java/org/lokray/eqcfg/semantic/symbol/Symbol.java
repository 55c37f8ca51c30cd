package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.emit.Finalizer;
import org.lokray.eqcfg.semantic.type.Type;

public interface Symbol
{
	String getName();

	/**
	 * @return The declared type, or null for symbols that carry none (scopes, directives).
	 */
	Type getType();

	/**
	 * Hands this symbol to the matching {@link Finalizer} method. Symbols with nothing to
	 * export ignore the call.
	 */
	default void accept(Finalizer finalizer)
	{
	}
}
