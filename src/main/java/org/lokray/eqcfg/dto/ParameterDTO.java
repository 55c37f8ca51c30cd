package org.lokray.eqcfg.dto;

import java.util.ArrayList;
import java.util.List;

public class ParameterDTO
{
	public String kind;
	public String name;
	public String type;
	public Object value;
	public List<OptionDTO> options = new ArrayList<>();
}
