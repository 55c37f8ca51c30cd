package org.lokray.eqcfg.semantic;

/**
 * Settings of one compilation, built from the command line.
 */
public final class CompilerOptions
{
	private static final CompilerOptions DEFAULTS = new CompilerOptions(false);

	private final boolean strictEquipmentOptions;

	public CompilerOptions(boolean strictEquipmentOptions)
	{
		this.strictEquipmentOptions = strictEquipmentOptions;
	}

	public static CompilerOptions defaults()
	{
		return DEFAULTS;
	}

	/**
	 * When set, an option repeated on an equipment parameter is an error, as it always is on
	 * signal and connection parameters. Off by default.
	 */
	public boolean isStrictEquipmentOptions()
	{
		return strictEquipmentOptions;
	}

	@Override
	public String toString()
	{
		return "CompilerOptions(strictEquipmentOptions=" + strictEquipmentOptions + ")";
	}
}
