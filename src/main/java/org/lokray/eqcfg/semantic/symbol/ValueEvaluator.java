package org.lokray.eqcfg.semantic.symbol;

import org.lokray.eqcfg.ast.ArrayValueNode;
import org.lokray.eqcfg.ast.DynamicNameNode;
import org.lokray.eqcfg.ast.LiteralNode;
import org.lokray.eqcfg.ast.OpenBoundNode;
import org.lokray.eqcfg.ast.RangeNode;
import org.lokray.eqcfg.ast.SystemConstNode;
import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.ast.VarRefNode;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.semantic.type.ValueTag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Turns value nodes into plain Java values: Long, Double, String, Boolean, {@code List<Object>}
 * for arrays and {@link RangeValue} for ranges. Variable references are looked up in the
 * given scope at the time of the call.
 */
public final class ValueEvaluator
{
	private ValueEvaluator()
	{
	}

	public static Object evaluate(ValueNode node, Scope scope)
	{
		if (node instanceof LiteralNode literal)
		{
			return literal.getValue();
		}
		if (node instanceof ArrayValueNode array)
		{
			List<Object> items = new ArrayList<>(array.size());
			for (ValueNode item : array.getItems())
			{
				items.add(evaluate(item, scope));
			}
			return Collections.unmodifiableList(items);
		}
		if (node instanceof RangeNode range)
		{
			return new RangeValue(evaluate(range.getMin(), scope), evaluate(range.getMax(), scope));
		}
		if (node instanceof OpenBoundNode bound)
		{
			return bound.getValue();
		}
		if (node instanceof SystemConstNode constant)
		{
			return constant.getName();
		}
		if (node instanceof VarRefNode ref)
		{
			return resolveVariable(ref.getName(), scope).getValue();
		}
		if (node instanceof DynamicNameNode name)
		{
			StringBuilder builder = new StringBuilder(name.getName());
			for (VarRefNode extension : name.getExtensions())
			{
				builder.append(format(resolveVariable(extension.getName(), scope).getValue()));
			}
			return builder.toString();
		}
		throw new IllegalArgumentException("not a value node: " + node);
	}

	/**
	 * The tag used for type matching: a reference carries the declared type of the variable
	 * it names, a dynamic name is a string.
	 */
	public static ValueTag tagOf(ValueNode node, Scope scope)
	{
		if (node instanceof VarRefNode ref)
		{
			return resolveVariable(ref.getName(), scope).getValueTag();
		}
		if (node instanceof DynamicNameNode)
		{
			return ValueTag.STR_LITERAL;
		}
		return node.getValueTag();
	}

	public static VariableSymbol resolveVariable(String name, Scope scope)
	{
		Optional<Symbol> symbol = scope.lookup(name);
		if (symbol.isEmpty())
		{
			throw new SemanticException("symbol '" + name + "' not resolved");
		}
		if (!(symbol.get() instanceof VariableSymbol variable))
		{
			throw new SemanticException("symbol '" + name + "' is not a variable");
		}
		return variable;
	}

	/**
	 * Renders a value as it appears inside a composed name.
	 */
	public static String format(Object value)
	{
		if (value == null)
		{
			return "";
		}
		if (value instanceof Boolean flag)
		{
			return flag ? "Да" : "Нет";
		}
		if (value instanceof List<?> items)
		{
			StringBuilder builder = new StringBuilder();
			for (Object item : items)
			{
				builder.append(format(item));
			}
			return builder.toString();
		}
		return String.valueOf(value);
	}

	/**
	 * Equality used by value filters: numbers compare by magnitude so 1 equals 1.0.
	 */
	public static boolean sameValue(Object a, Object b)
	{
		if (a instanceof Number x && b instanceof Number y)
		{
			return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
		}
		return a == null ? b == null : a.equals(b);
	}
}
