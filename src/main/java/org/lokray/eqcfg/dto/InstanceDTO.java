package org.lokray.eqcfg.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InstanceDTO
{
	public String kind;
	public String name;
	public String baseName;
	public Map<String, String> attributes = new LinkedHashMap<>();
	public List<ParameterDTO> parameters = new ArrayList<>();
	public Map<String, Object> variables = new LinkedHashMap<>();
	public Map<String, Map<String, Object>> contexts = new LinkedHashMap<>();
	public String link;
}
