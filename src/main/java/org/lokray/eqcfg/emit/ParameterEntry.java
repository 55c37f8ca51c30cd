package org.lokray.eqcfg.emit;

import java.util.List;

/**
 * A parameter of a replayed scope with its value resolved at the time of the replay.
 */
public final class ParameterEntry
{
	private final String kind;
	private final String name;
	private final String type;
	private final Object value;
	private final List<OptionEntry> options;

	public ParameterEntry(String kind, String name, String type, Object value, List<OptionEntry> options)
	{
		this.kind = kind;
		this.name = name;
		this.type = type;
		this.value = value;
		this.options = List.copyOf(options);
	}

	public String getKind()
	{
		return kind;
	}

	public String getName()
	{
		return name;
	}

	public String getType()
	{
		return type;
	}

	public Object getValue()
	{
		return value;
	}

	public List<OptionEntry> getOptions()
	{
		return options;
	}

	@Override
	public String toString()
	{
		return kind + "(" + name + ": " + type + " = " + value + (options.isEmpty() ? "" : ", " + options) + ")";
	}
}
