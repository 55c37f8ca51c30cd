package org.lokray.eqcfg.dto;

public class OptionDTO
{
	public String kind;
	public String name;
	public Object value;
}
