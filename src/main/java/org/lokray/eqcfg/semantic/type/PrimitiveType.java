package org.lokray.eqcfg.semantic.type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class PrimitiveType implements Type
{
	public static final PrimitiveType INT = new PrimitiveType("int", ValueTag.INT_TYPE);
	public static final PrimitiveType FLOAT = new PrimitiveType("float", ValueTag.FLOAT_TYPE);
	public static final PrimitiveType STRING = new PrimitiveType("str", ValueTag.STR_TYPE);
	public static final PrimitiveType BOOLEAN = new PrimitiveType("bool", ValueTag.BOOL_TYPE);

	private static final Map<String, PrimitiveType> KEYWORD_TO_TYPE_MAP;

	static
	{
		Map<String, PrimitiveType> map = new LinkedHashMap<>();
		map.put(INT.getName(), INT);
		map.put(FLOAT.getName(), FLOAT);
		map.put(STRING.getName(), STRING);
		map.put(BOOLEAN.getName(), BOOLEAN);
		KEYWORD_TO_TYPE_MAP = Collections.unmodifiableMap(map);
	}

	private final String name;
	private final ValueTag tag;

	private PrimitiveType(String name, ValueTag tag)
	{
		this.name = name;
		this.tag = tag;
	}

	public static Map<String, PrimitiveType> getAllPrimitiveKeywords()
	{
		return KEYWORD_TO_TYPE_MAP;
	}

	public static Optional<PrimitiveType> fromKeyword(String keyword)
	{
		return Optional.ofNullable(KEYWORD_TO_TYPE_MAP.get(keyword));
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public ValueTag getValueTag()
	{
		return tag;
	}

	@Override
	public boolean isNumeric()
	{
		return this == INT || this == FLOAT;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
