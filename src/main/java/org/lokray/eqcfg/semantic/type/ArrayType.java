package org.lokray.eqcfg.semantic.type;

import java.util.List;
import java.util.Objects;

/**
 * The 'arr' type, optionally with a shape such as {@code arr[str:6, int..]}. The shape is
 * kept for diagnostics and output only; values are not matched against it.
 */
public class ArrayType implements Type
{
	public static final ArrayType UNSHAPED = new ArrayType(List.of());

	private final List<Element> elements;

	public ArrayType(List<Element> elements)
	{
		this.elements = List.copyOf(elements);
	}

	public List<Element> getElements()
	{
		return elements;
	}

	public boolean hasShape()
	{
		return !elements.isEmpty();
	}

	@Override
	public String getName()
	{
		if (!hasShape())
		{
			return "arr";
		}
		StringBuilder builder = new StringBuilder("arr");
		appendShape(builder);
		return builder.toString();
	}

	private void appendShape(StringBuilder builder)
	{
		builder.append('[');
		for (int i = 0; i < elements.size(); i++)
		{
			if (i > 0)
			{
				builder.append(", ");
			}
			Element element = elements.get(i);
			if (element.getType() instanceof ArrayType nested)
			{
				nested.appendShape(builder);
			}
			else
			{
				builder.append(element.getType().getName());
			}
			if (element.getSize() >= 0)
			{
				builder.append(':').append(element.getSize());
			}
			if (element.isRepeated())
			{
				builder.append("..");
			}
		}
		builder.append(']');
	}

	@Override
	public ValueTag getValueTag()
	{
		return ValueTag.ARRAY_TYPE;
	}

	@Override
	public boolean isArray()
	{
		return true;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		return elements.equals(((ArrayType) o).elements);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(elements);
	}

	@Override
	public String toString()
	{
		return getName();
	}

	public static final class Element
	{
		private final Type type;
		private final int size;
		private final boolean repeated;

		public Element(Type type, int size, boolean repeated)
		{
			this.type = type;
			this.size = size;
			this.repeated = repeated;
		}

		public Type getType()
		{
			return type;
		}

		public int getSize()
		{
			return size;
		}

		public boolean isRepeated()
		{
			return repeated;
		}

		@Override
		public boolean equals(Object o)
		{
			if (this == o)
			{
				return true;
			}
			if (!(o instanceof Element other))
			{
				return false;
			}
			return size == other.size && repeated == other.repeated && type.getName().equals(other.type.getName());
		}

		@Override
		public int hashCode()
		{
			return Objects.hash(type.getName(), size, repeated);
		}
	}
}
