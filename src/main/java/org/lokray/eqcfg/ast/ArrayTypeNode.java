package org.lokray.eqcfg.ast;

import org.lokray.eqcfg.parser.SourcePosition;

import java.util.List;

/**
 * {@code arr[int:3, [str, bool]..]} An array type with an explicit shape. Elements are either
 * scalar {@link TypeNode}s or nested shapes.
 */
public class ArrayTypeNode extends TypeNode
{
	private final List<Element> elements;

	public ArrayTypeNode(List<Element> elements, SourcePosition position)
	{
		super("arr", position);
		this.elements = List.copyOf(elements);
	}

	public List<Element> getElements()
	{
		return elements;
	}

	@Override
	public NodeKind getKind()
	{
		return NodeKind.ARRAY_TYPE;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor)
	{
		return visitor.visitArrayType(this);
	}

	@Override
	public String toString()
	{
		StringBuilder builder = new StringBuilder("arr[");
		for (int i = 0; i < elements.size(); i++)
		{
			if (i > 0)
			{
				builder.append(", ");
			}
			builder.append(elements.get(i));
		}
		return builder.append(']').toString();
	}

	public static final class Element
	{
		private final TypeNode type;
		private final int size;
		private final boolean repeated;

		public Element(TypeNode type, int size, boolean repeated)
		{
			this.type = type;
			this.size = size;
			this.repeated = repeated;
		}

		public TypeNode getType()
		{
			return type;
		}

		/**
		 * @return The ':N' size, or -1 when none was written.
		 */
		public int getSize()
		{
			return size;
		}

		/**
		 * @return True when the element ends with '..' and may repeat.
		 */
		public boolean isRepeated()
		{
			return repeated;
		}

		@Override
		public String toString()
		{
			String text = type instanceof ArrayTypeNode ? type.toString().substring(3) : type.getName();
			if (size >= 0)
			{
				text += ":" + size;
			}
			return repeated ? text + ".." : text;
		}
	}
}
