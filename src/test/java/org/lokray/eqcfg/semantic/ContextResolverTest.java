package org.lokray.eqcfg.semantic;

import org.lokray.eqcfg.ast.ArrayValueNode;
import org.lokray.eqcfg.ast.LiteralNode;
import org.lokray.eqcfg.ast.PutRuleNode;
import org.lokray.eqcfg.ast.ValueNode;
import org.lokray.eqcfg.ast.VarRefNode;
import org.lokray.eqcfg.error.DirectiveException;
import org.lokray.eqcfg.error.TypeMismatchException;
import org.lokray.eqcfg.parser.SourcePosition;
import org.lokray.eqcfg.semantic.scope.ContextScope;
import org.lokray.eqcfg.semantic.scope.ModuleScope;
import org.lokray.eqcfg.semantic.scope.TemplateScope;
import org.lokray.eqcfg.semantic.symbol.VariableSymbol;
import org.lokray.eqcfg.semantic.type.ArrayType;
import org.lokray.eqcfg.semantic.type.PrimitiveType;
import org.lokray.eqcfg.semantic.type.ValueTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContextResolverTest
{
	private static final SourcePosition POS = SourcePosition.UNKNOWN;

	private ModuleScope module;
	private ContextScope context;

	@BeforeEach
	void setUp()
	{
		module = new ModuleScope("m");
		TemplateScope template = new TemplateScope("T", module);
		context = new ContextScope("K", template);
		context.declare(new VariableSymbol("k1", PrimitiveType.INT));
		context.declare(new VariableSymbol("k2", PrimitiveType.INT));
		template.addContext(context);
	}

	private static ValueNode num(long value)
	{
		return new LiteralNode(ValueTag.INT_LITERAL, value, POS);
	}

	private static ValueNode str(String value)
	{
		return new LiteralNode(ValueTag.STR_LITERAL, value, POS);
	}

	private static ArrayValueNode array(ValueNode... items)
	{
		return new ArrayValueNode(List.of(items), POS);
	}

	private VariableSymbol source(String name, ArrayValueNode rows)
	{
		VariableSymbol variable = new VariableSymbol(name, ArrayType.UNSHAPED);
		variable.setValue(rows, module);
		module.declare(name, variable);
		return variable;
	}

	private Object valueOf(String key)
	{
		return context.lookup(key).orElseThrow().getValue();
	}

	@Test
	void threeRowsAdvanceThreeTimes()
	{
		VariableSymbol data = source("data", array(array(num(1), num(2)), array(num(3), num(4)), array(num(5), num(6))));
		ContextResolver resolver = new ContextResolver(context, data, null, module, POS);
		assertEquals(3, resolver.getRowCount());

		List<List<Object>> seen = new ArrayList<>();
		Optional<RowBound> row = resolver.next();
		while (row.isPresent())
		{
			seen.add(List.of(valueOf("k1"), valueOf("k2")));
			assertEquals(row.get().getValues(), seen.get(seen.size() - 1));
			row = resolver.next();
		}

		assertEquals(List.of(List.of(1L, 2L), List.of(3L, 4L), List.of(5L, 6L)), seen);
		assertTrue(resolver.next().isEmpty());
	}

	@Test
	void arityMismatchIsDirectiveError()
	{
		VariableSymbol data = source("data", array(array(num(1))));
		ContextResolver resolver = new ContextResolver(context, data, null, module, POS);
		DirectiveException e = assertThrows(DirectiveException.class, resolver::next);
		assertEquals("Directive Error", e.getKindLabel());
	}

	@Test
	void typeErrorLeavesEarlierElementsAssigned()
	{
		VariableSymbol data = source("data", array(array(num(7), str("x"))));
		ContextResolver resolver = new ContextResolver(context, data, null, module, POS);

		assertThrows(TypeMismatchException.class, resolver::next);
		assertEquals(7L, valueOf("k1"));
		assertNull(valueOf("k2"));
	}

	@Test
	void rowThatIsNotAnArrayFails()
	{
		VariableSymbol data = source("data", array(num(1)));
		ContextResolver resolver = new ContextResolver(context, data, null, module, POS);
		assertThrows(DirectiveException.class, resolver::next);
	}

	@Test
	void sourceWithoutArrayValueFails()
	{
		VariableSymbol empty = new VariableSymbol("empty", ArrayType.UNSHAPED);
		assertThrows(DirectiveException.class, () -> new ContextResolver(context, empty, null, module, POS));
	}

	@Test
	void sliceRuleIsHalfOpenAndClamped()
	{
		VariableSymbol data = source("data", array(array(num(1), num(2)), array(num(3), num(4)), array(num(5), num(6))));
		ContextResolver resolver = new ContextResolver(context, data, new PutRuleNode(1, 10, POS), module, POS);

		assertEquals(2, resolver.getRowCount());
		assertEquals(1, resolver.next().orElseThrow().getIndex());
		assertEquals(2, resolver.next().orElseThrow().getIndex());
		assertTrue(resolver.next().isEmpty());
	}

	@Test
	void sliceWithStartAfterEndFails()
	{
		VariableSymbol data = source("data", array(array(num(1), num(2))));
		assertThrows(DirectiveException.class, () -> new ContextResolver(context, data, new PutRuleNode(2, 1, POS), module, POS));
	}

	@Test
	void indexRuleTakesRowsInGivenOrder()
	{
		VariableSymbol data = source("data", array(array(num(1), num(2)), array(num(3), num(4)), array(num(5), num(6))));
		source("idx", array(num(2), num(0)));
		PutRuleNode rule = new PutRuleNode(new VarRefNode("idx", POS), POS);
		ContextResolver resolver = new ContextResolver(context, data, rule, module, POS);

		assertEquals(List.of(5L, 6L), resolver.next().orElseThrow().getValues());
		assertEquals(List.of(1L, 2L), resolver.next().orElseThrow().getValues());
		assertTrue(resolver.next().isEmpty());
	}

	@Test
	void indexOutOfRangeFails()
	{
		VariableSymbol data = source("data", array(array(num(1), num(2))));
		VariableSymbol index = new VariableSymbol("one", PrimitiveType.INT);
		index.setValue(num(3), module);
		module.declare("one", index);
		PutRuleNode rule = new PutRuleNode(new VarRefNode("one", POS), POS);
		assertThrows(DirectiveException.class, () -> new ContextResolver(context, data, rule, module, POS));
	}

	@Test
	void excludingListenerSkipsRowsHoldingTheValue()
	{
		ContextListener all = new ContextListener(module, "линейно", null);
		ContextListener exceptThree = new ContextListener(module, "линейно", num(3));
		ContextListener exceptList = new ContextListener(module, "линейно", array(num(9), num(2)));

		RowBound first = new RowBound(0, List.of(1L, 2L));
		RowBound second = new RowBound(1, List.of(3L, 4L));

		assertTrue(all.admits(first));
		assertTrue(all.admits(second));
		assertTrue(exceptThree.admits(first));
		assertFalse(exceptThree.admits(second));
		assertFalse(exceptList.admits(first));
		assertTrue(exceptList.admits(second));
	}
}
