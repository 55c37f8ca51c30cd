package org.lokray.eqcfg.semantic.symbol;

/**
 * Options come in two families, told apart by their keyword: signal options ('статус',
 * 'важность', 'отображать', 'метка') and connection options ('обработчик').
 */
public enum OptionFamily
{
	SIGNAL("signal"),
	CONNECTION("connection");

	private final String label;

	OptionFamily(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}
}
