package org.lokray.eqcfg.semantic.symbol;

import java.util.Objects;

/**
 * Evaluated {@code диапазон[min, max]}. An open bound is an infinite Double.
 */
public final class RangeValue
{
	private final Object min;
	private final Object max;

	public RangeValue(Object min, Object max)
	{
		this.min = min;
		this.max = max;
	}

	public Object getMin()
	{
		return min;
	}

	public Object getMax()
	{
		return max;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof RangeValue other))
		{
			return false;
		}
		return Objects.equals(min, other.min) && Objects.equals(max, other.max);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(min, max);
	}

	@Override
	public String toString()
	{
		return "[" + min + ", " + max + "]";
	}
}
