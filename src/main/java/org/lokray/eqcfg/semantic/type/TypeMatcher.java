package org.lokray.eqcfg.semantic.type;

import java.util.EnumSet;
import java.util.Set;

/**
 * Decides whether a value with a given tag may be assigned to a declared type.
 *
 * <ul>
 *     <li>float: float literal, float symbol or range</li>
 *     <li>int: int literal, int symbol or range</li>
 *     <li>str: string literal or string symbol</li>
 *     <li>bool: bool literal or bool symbol</li>
 *     <li>arr: anything; array shapes are not checked against values</li>
 * </ul>
 * Range bounds are not checked against the numeric kind.
 */
public final class TypeMatcher
{
	private static final Set<ValueTag> FLOAT = EnumSet.of(ValueTag.FLOAT_TYPE, ValueTag.FLOAT_LITERAL, ValueTag.RANGE);
	private static final Set<ValueTag> INT = EnumSet.of(ValueTag.INT_TYPE, ValueTag.INT_LITERAL, ValueTag.RANGE);
	private static final Set<ValueTag> STRING = EnumSet.of(ValueTag.STR_TYPE, ValueTag.STR_LITERAL);
	private static final Set<ValueTag> BOOLEAN = EnumSet.of(ValueTag.BOOL_TYPE, ValueTag.BOOL_LITERAL);

	private TypeMatcher()
	{
	}

	public static boolean matches(Type declared, ValueTag value)
	{
		if (declared == null || value == null)
		{
			return false;
		}
		if (declared.isArray())
		{
			return matchArray((ArrayType) declared, value);
		}
		if (declared == PrimitiveType.FLOAT)
		{
			return FLOAT.contains(value);
		}
		if (declared == PrimitiveType.INT)
		{
			return INT.contains(value);
		}
		if (declared == PrimitiveType.STRING)
		{
			return STRING.contains(value);
		}
		if (declared == PrimitiveType.BOOLEAN)
		{
			return BOOLEAN.contains(value);
		}
		return false;
	}

	// TODO: match array literal items against the element types of a shaped ArrayType
	private static boolean matchArray(ArrayType declared, ValueTag value)
	{
		return true;
	}
}
