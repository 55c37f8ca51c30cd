package org.lokray.eqcfg.semantic;

import org.lokray.eqcfg.ast.ArrayValueNode;
import org.lokray.eqcfg.ast.PutRuleNode;
import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.error.DirectiveException;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.error.TypeMismatchException;
import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.scope.ContextScope;
import org.lokray.eqcfg.semantic.scope.Scope;
import org.lokray.eqcfg.semantic.symbol.ValueEvaluator;
import org.lokray.eqcfg.semantic.symbol.VariableSymbol;
import org.lokray.eqcfg.semantic.type.TypeMatcher;
import org.lokray.eqcfg.semantic.type.ValueTag;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cursor feeding the rows of an array variable into a context, one row per call to
 * {@link #next()}. A row must have one element per context variable; each element is type
 * checked and assigned in column order, so a failing element leaves the earlier ones of the
 * same row assigned.
 */
public class ContextResolver
{
	private final ContextScope context;
	private final List<String> keys;
	private final String sourceName;
	private final List<ValueNode> rows;
	private final Scope sourceScope;
	private final List<Integer> selection;
	private final SourcePosition position;
	private int cursor = 0;

	/**
	 * @param rule      Row selection, or null for every row in order.
	 * @param ruleScope Scope the index variable of a rule is looked up in.
	 * @param position  Position of the put directive, used for diagnostics.
	 */
	public ContextResolver(ContextScope context, VariableSymbol source, PutRuleNode rule, Scope ruleScope, SourcePosition position)
	{
		this.context = context;
		this.keys = context.getSymbolKeys();
		this.sourceName = source.getName();
		this.position = position;

		VariableSymbol target = source.resolveTarget();
		if (!(target.getValueNode() instanceof ArrayValueNode array))
		{
			throw new DirectiveException("symbol '" + sourceName + "' has no array value");
		}
		this.rows = array.getItems();
		this.sourceScope = target.getValueScope();
		this.selection = selectRows(rule, ruleScope);
	}

	public ContextScope getContext()
	{
		return context;
	}

	public SourcePosition getPosition()
	{
		return position;
	}

	/**
	 * @return The number of rows this resolver will produce in total.
	 */
	public int getRowCount()
	{
		return selection.size();
	}

	/**
	 * Moves the cursor back before the first selected row.
	 */
	public void rewind()
	{
		cursor = 0;
	}

	/**
	 * Writes the next selected row into the context.
	 *
	 * @return The row just written, or empty when every selected row has been consumed.
	 */
	public Optional<RowBound> next()
	{
		if (cursor >= selection.size())
		{
			return Optional.empty();
		}

		int index = selection.get(cursor++);
		if (!(rows.get(index) instanceof ArrayValueNode row))
		{
			throw new DirectiveException("row " + index + " of '" + sourceName + "' is not an array");
		}
		if (row.size() != keys.size())
		{
			throw new DirectiveException("array symbols count not match to context " + context.getName()
					+ ": expected " + keys.size() + ", got " + row.size() + " in row " + index);
		}

		List<Object> assigned = new ArrayList<>(keys.size());
		for (int i = 0; i < keys.size(); i++)
		{
			String key = keys.get(i);
			VariableSymbol declared = context.lookup(key)
					.orElseThrow(() -> new SemanticException("context symbol '" + key + "' not resolved"));

			ValueNode element = row.getItems().get(i);
			ValueTag tag = ValueEvaluator.tagOf(element, sourceScope);
			if (!TypeMatcher.matches(declared.getType(), tag))
			{
				throw new TypeMismatchException("declared " + declared.getType().getName() + " got " + element
						+ " for context symbol '" + key + "' in row " + index);
			}
			context.setValue(key, element, sourceScope);
			assigned.add(declared.getValue());
		}
		return Optional.of(new RowBound(index, assigned));
	}

	private List<Integer> selectRows(PutRuleNode rule, Scope ruleScope)
	{
		List<Integer> selected = new ArrayList<>();
		if (rule == null)
		{
			for (int i = 0; i < rows.size(); i++)
			{
				selected.add(i);
			}
			return selected;
		}

		if (rule.isSlice())
		{
			if (rule.getFrom() > rule.getTo())
			{
				throw new DirectiveException("invalid rule [" + rule.getFrom() + ":" + rule.getTo() + "]: start is after end");
			}
			long end = Math.min(rule.getTo(), rows.size());
			for (long i = Math.min(rule.getFrom(), rows.size()); i < end; i++)
			{
				selected.add((int) i);
			}
			return selected;
		}

		String indexName = rule.getIndices().getName();
		Object indices = ValueEvaluator.resolveVariable(indexName, ruleScope).getValue();
		if (indices instanceof List<?> items)
		{
			for (Object item : items)
			{
				selected.add(checkIndex(item, indexName));
			}
		}
		else
		{
			selected.add(checkIndex(indices, indexName));
		}
		return selected;
	}

	private int checkIndex(Object value, String indexName)
	{
		if (!(value instanceof Long index))
		{
			throw new DirectiveException("rule variable '" + indexName + "' must hold an int or an array of ints, got " + value);
		}
		if (index < 0 || index >= rows.size())
		{
			throw new DirectiveException("row index " + index + " out of range for '" + sourceName + "' (" + rows.size() + " rows)");
		}
		return index.intValue();
	}

	@Override
	public String toString()
	{
		return "ContextResolver(ctx=" + context.getName() + ", keys=" + keys + ", source=" + sourceName + ")";
	}
}
