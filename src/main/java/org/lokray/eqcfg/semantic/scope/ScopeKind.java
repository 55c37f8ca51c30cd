package org.lokray.eqcfg.semantic.scope;

public enum ScopeKind
{
	MODULE("module"),
	TEMPLATE("template"),
	EQUIPMENT("equipment"),
	SIGNAL("signal"),
	CONNECTION("connection");

	private final String label;

	ScopeKind(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}
}
