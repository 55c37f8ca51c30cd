package org.lokray.eqcfg.emit;

import org.lokray.eqcfg.dto.InstanceDTO;
import org.lokray.eqcfg.dto.OptionDTO;
import org.lokray.eqcfg.dto.ParameterDTO;
import org.lokray.eqcfg.semantic.symbol.RangeValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InstanceDTOConverter
{
	public static List<InstanceDTO> toDTOs(List<Instance> instances)
	{
		List<InstanceDTO> out = new ArrayList<>();
		for (Instance instance : instances)
		{
			out.add(instanceToDTO(instance));
		}
		return out;
	}

	public static InstanceDTO instanceToDTO(Instance instance)
	{
		InstanceDTO dto = new InstanceDTO();
		dto.kind = instance.getKind();
		dto.name = instance.getName();
		dto.baseName = instance.getBaseName();
		dto.attributes.putAll(instance.getAttributes());
		dto.link = instance.getLink();

		for (ParameterEntry parameter : instance.getParameters())
		{
			ParameterDTO pd = new ParameterDTO();
			pd.kind = parameter.getKind();
			pd.name = parameter.getName();
			pd.type = parameter.getType();
			pd.value = toJsonValue(parameter.getValue());
			for (OptionEntry option : parameter.getOptions())
			{
				OptionDTO od = new OptionDTO();
				od.kind = option.getKind();
				od.name = option.getName();
				od.value = toJsonValue(option.getValue());
				pd.options.add(od);
			}
			dto.parameters.add(pd);
		}

		instance.getVariables().forEach((name, value) -> dto.variables.put(name, toJsonValue(value)));
		instance.getContexts().forEach((context, values) ->
		{
			Map<String, Object> converted = new LinkedHashMap<>();
			values.forEach((name, value) -> converted.put(name, toJsonValue(value)));
			dto.contexts.put(context, converted);
		});
		return dto;
	}

	/**
	 * Ranges become {min, max} objects; JSON has no infinity, so open bounds become null.
	 */
	static Object toJsonValue(Object value)
	{
		if (value instanceof RangeValue range)
		{
			Map<String, Object> bounds = new LinkedHashMap<>();
			bounds.put("min", toJsonValue(range.getMin()));
			bounds.put("max", toJsonValue(range.getMax()));
			return bounds;
		}
		if (value instanceof Double number && number.isInfinite())
		{
			return null;
		}
		if (value instanceof List<?> items)
		{
			List<Object> converted = new ArrayList<>(items.size());
			for (Object item : items)
			{
				converted.add(toJsonValue(item));
			}
			return converted;
		}
		return value;
	}
}
