package org.lokray.eqcfg.semantic;

import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.semantic.symbol.BuiltinTypeSymbol;
import org.lokray.eqcfg.semantic.symbol.DirectiveSymbol;
import org.lokray.eqcfg.semantic.type.ArrayType;
import org.lokray.eqcfg.semantic.type.PrimitiveType;

import java.util.List;

/**
 * Defines the builtin types and directive keywords in the module scope.
 */
public class BuiltInTypeLoader
{
	public static final List<String> DIRECTIVES = List.of("использовать", "подстановка", "привязать");

	/**
	 * Defines int, float, str, bool and arr as type symbols in the given scope, taking the
	 * primitives from {@link PrimitiveType} as the single source of truth.
	 *
	 * @param scope The module scope.
	 */
	public static void definePrimitives(Scope scope)
	{
		PrimitiveType.getAllPrimitiveKeywords().forEach((name, type) ->
		{
			scope.declare(name, new BuiltinTypeSymbol(name, type));
		});

		scope.declare(ArrayType.UNSHAPED.getName(), new BuiltinTypeSymbol(ArrayType.UNSHAPED.getName(), ArrayType.UNSHAPED));
	}

	public static void defineDirectives(Scope scope)
	{
		for (String directive : DIRECTIVES)
		{
			scope.declare(directive, new DirectiveSymbol(directive));
		}
	}
}
