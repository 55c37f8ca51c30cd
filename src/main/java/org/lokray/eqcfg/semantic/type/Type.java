package org.lokray.eqcfg.semantic.type;

public interface Type
{
	String getName();

	/**
	 * @return The tag a symbol declared with this type carries during type matching.
	 */
	ValueTag getValueTag();

	default boolean isNumeric()
	{
		return false;
	}

	default boolean isArray()
	{
		return false;
	}
}
