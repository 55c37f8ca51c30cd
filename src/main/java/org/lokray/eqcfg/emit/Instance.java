package org.lokray.eqcfg.emit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of one replayed scope. Values are copied when the scope is replayed, so two
 * replays of the same signal for two context rows give two independent instances.
 */
public final class Instance
{
	private final String kind;
	private final String name;
	private final String baseName;
	private final Map<String, String> attributes;
	private final List<ParameterEntry> parameters;
	private final Map<String, Object> variables;
	private final Map<String, Map<String, Object>> contexts;
	private final String link;

	public Instance(String kind, String name, String baseName, Map<String, String> attributes, List<ParameterEntry> parameters,
					Map<String, Object> variables, Map<String, Map<String, Object>> contexts, String link)
	{
		this.kind = kind;
		this.name = name;
		this.baseName = baseName;
		this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
		this.parameters = List.copyOf(parameters);
		this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
		Map<String, Map<String, Object>> copied = new LinkedHashMap<>();
		contexts.forEach((context, values) -> copied.put(context, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
		this.contexts = Collections.unmodifiableMap(copied);
		this.link = link;
	}

	/**
	 * @return "module", "template", "equipment", "signal" or "connection".
	 */
	public String getKind()
	{
		return kind;
	}

	/**
	 * @return The full name, extensions resolved.
	 */
	public String getName()
	{
		return name;
	}

	public String getBaseName()
	{
		return baseName;
	}

	public Map<String, String> getAttributes()
	{
		return attributes;
	}

	public List<ParameterEntry> getParameters()
	{
		return parameters;
	}

	public Optional<ParameterEntry> getParameter(String parameterName)
	{
		return parameters.stream().filter(p -> p.getName().equals(parameterName)).findFirst();
	}

	/**
	 * @return The value of the first parameter named {@code parameterName}, or null.
	 */
	public Object getParameterValue(String parameterName)
	{
		return getParameter(parameterName).map(ParameterEntry::getValue).orElse(null);
	}

	public Map<String, Object> getVariables()
	{
		return variables;
	}

	/**
	 * @return Values of every visible context, by context name then variable name.
	 */
	public Map<String, Map<String, Object>> getContexts()
	{
		return contexts;
	}

	/**
	 * @return The name of the linked connection, or null.
	 */
	public String getLink()
	{
		return link;
	}

	@Override
	public String toString()
	{
		return "Instance(" + kind + " " + name + ", attrs=" + attributes + ", params=" + parameters + ", link=" + link + ")";
	}
}
