package org.lokray.eqcfg.semantic.type;

/**
 * Type tag of something that can be assigned: a literal, a range, an array, or a symbol
 * carrying a declared type. Type matching compares a declared {@link Type} with one of these.
 */
public enum ValueTag
{
	INT_LITERAL,
	FLOAT_LITERAL,
	STR_LITERAL,
	BOOL_LITERAL,
	ARRAY_LITERAL,
	RANGE,
	SYSTEM_CONST,

	INT_TYPE,
	FLOAT_TYPE,
	STR_TYPE,
	BOOL_TYPE,
	ARRAY_TYPE,

	// Unresolved references; the compiler replaces them before matching
	VARIABLE,
	DYNAMIC_NAME
}
