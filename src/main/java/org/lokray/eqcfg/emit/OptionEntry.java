package org.lokray.eqcfg.emit;

/**
 * An option of a parameter as it was read during replay.
 */
public final class OptionEntry
{
	private final String kind;
	private final String name;
	private final Object value;

	public OptionEntry(String kind, String name, Object value)
	{
		this.kind = kind;
		this.name = name;
		this.value = value;
	}

	/**
	 * @return "status", "representation", "severity", "label" or "driver".
	 */
	public String getKind()
	{
		return kind;
	}

	public String getName()
	{
		return name;
	}

	public Object getValue()
	{
		return value;
	}

	@Override
	public String toString()
	{
		return kind + "(" + name + "=" + value + ")";
	}
}
