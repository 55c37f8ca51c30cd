package org.lokray.eqcfg.parser;

import org.lokray.eqcfg.ast.ArrayTypeNode;
import org.lokray.eqcfg.ast.ArrayValueNode;
import org.lokray.eqcfg.ast.BindDirectiveNode;
import org.lokray.eqcfg.ast.ConnectionNode;
import org.lokray.eqcfg.ast.DynamicNameNode;
import org.lokray.eqcfg.ast.LiteralNode;
import org.lokray.eqcfg.ast.ModuleNode;
import org.lokray.eqcfg.ast.ObjectNode;
import org.lokray.eqcfg.ast.OpenBoundNode;
import org.lokray.eqcfg.ast.OptionNode;
import org.lokray.eqcfg.ast.ParameterAssignNode;
import org.lokray.eqcfg.ast.PutDirectiveNode;
import org.lokray.eqcfg.ast.RangeNode;
import org.lokray.eqcfg.ast.SignalNode;
import org.lokray.eqcfg.ast.SystemConstNode;
import org.lokray.eqcfg.ast.TemplateNode;
import org.lokray.eqcfg.ast.UseDirectiveNode;
import org.lokray.eqcfg.ast.VarDeclarationNode;
import org.lokray.eqcfg.ast.VarRefNode;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.error.SyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest
{
	private static ModuleNode parse(String text)
	{
		return new SourceParser(SourceText.of("test", text)).parse();
	}

	@Test
	void moduleIsNamedAfterSource()
	{
		assertEquals("test", parse("").getName());
	}

	@Test
	void variableDeclarationWithSeveralNames()
	{
		ModuleNode module = parse("$a, $b : float = -1.5;");
		VarDeclarationNode declaration = module.getVariables().get(0);
		assertEquals(2, declaration.getNames().size());
		assertEquals("float", declaration.getType().getName());
		LiteralNode value = (LiteralNode) declaration.getInitializer();
		assertEquals(-1.5, value.getValue());
	}

	@Test
	void dynamicNameInitializer()
	{
		ModuleNode module = parse("$n : int = 1;\n$s : str = (name + $n);");
		DynamicNameNode name = (DynamicNameNode) module.getVariables().get(1).getInitializer();
		assertEquals("name", name.getName());
		assertEquals("n", name.getExtensions().get(0).getName());
	}

	@Test
	void shapedArrayType()
	{
		ModuleNode module = parse("$rows : arr[[int, str]..] = [[1, 'a'], [2, 'b']];");
		VarDeclarationNode declaration = module.getVariables().get(0);
		ArrayTypeNode shape = (ArrayTypeNode) declaration.getType();
		assertEquals(1, shape.getElements().size());
		assertTrue(shape.getElements().get(0).isRepeated());
		assertTrue(shape.getElements().get(0).getType() instanceof ArrayTypeNode);
		ArrayValueNode rows = (ArrayValueNode) declaration.getInitializer();
		assertEquals(2, rows.size());
	}

	@Test
	void objectWithParameterAndNestedSignal()
	{
		ModuleNode module = parse(
				"оборудование класс_ц Шкаф + $n {\n"
						+ "  Идентификатор : int = 7 обработчик = 'drv';\n"
						+ "  сигнал выходной дискрет Клапан {\n"
						+ "    Значение : float = диапазон[~, 10] статус = норма метка;\n"
						+ "  };\n"
						+ "};");
		ObjectNode object = (ObjectNode) module.getBlocks().get(0);
		assertEquals("Шкаф", object.getName());
		assertEquals("цифра", object.getObjectType());
		assertEquals("n", object.getNameExtensions().get(0).getName());

		ParameterAssignNode id = object.getParameters().get(0);
		assertEquals("Идентификатор", id.getName());
		OptionNode driver = id.getOptions().get(0);
		assertTrue(driver.isConnectionOption());

		SignalNode signal = (SignalNode) object.getBlocks().get(0);
		assertEquals("выходной", signal.getDirection());
		assertEquals("дискрет", signal.getSignalType());

		ParameterAssignNode value = signal.getParameters().get(0);
		RangeNode range = (RangeNode) value.getValue();
		assertTrue(range.getMin() instanceof OpenBoundNode);
		assertEquals(2, value.getOptions().size());
		assertTrue(value.getOptions().get(0).getValue() instanceof SystemConstNode);
		assertNull(value.getOptions().get(1).getValue());
	}

	@Test
	void templateWithContextAndDirectives()
	{
		ModuleNode module = parse(
				"шаблон T {\n"
						+ "  контекст K { $a : int; $b : str; };\n"
						+ "  $data : arr = [[1, 'x']];\n"
						+ "  $idx : arr = [0];\n"
						+ "  .подстановка в K из $data правило [0:1] <- [i];\n"
						+ "  соединение C { Адрес : str = 'a'; };\n"
						+ "  сигнал входной аналог S + $a {\n"
						+ "    .использовать K линейно значения кроме 3;\n"
						+ "    .привязать (C);\n"
						+ "  };\n"
						+ "};");
		TemplateNode template = (TemplateNode) module.getBlocks().get(0);
		assertEquals(1, template.getContexts().size());
		assertEquals(2, template.getContexts().get(0).getVariables().size());
		assertEquals(1, template.getConnections().size());

		PutDirectiveNode put = (PutDirectiveNode) template.getDirectives().get(0);
		assertEquals("K", put.getName());
		assertEquals("data", put.getSource().getName());
		assertTrue(put.getRule().isSlice());
		assertEquals(0, put.getRule().getFrom());
		assertEquals(1, put.getRule().getTo());

		SignalNode signal = (SignalNode) template.getBlocks().get(0);
		UseDirectiveNode use = (UseDirectiveNode) signal.getDirectives().get(0);
		assertEquals("линейно", use.getMethod());
		assertTrue(use.getFilter().isExcluding());
		BindDirectiveNode bind = (BindDirectiveNode) signal.getDirectives().get(1);
		assertEquals("C", bind.getName());
		assertTrue(bind.getExtensions().isEmpty());
	}

	@Test
	void putRuleFromVariable()
	{
		ModuleNode module = parse("шаблон T { контекст K { $a : int; }; .подстановка в K из $d правило $idx; };");
		TemplateNode template = (TemplateNode) module.getBlocks().get(0);
		PutDirectiveNode put = (PutDirectiveNode) template.getDirectives().get(0);
		assertFalse(put.getRule().isSlice());
		VarRefNode indices = put.getRule().getIndices();
		assertEquals("idx", indices.getName());
	}

	@Test
	void signalOwnsAtMostOneConnection()
	{
		String text = "сигнал входной аналог S {\n"
				+ "  соединение A { };\n"
				+ "  соединение B { };\n"
				+ "};";
		assertThrows(SemanticException.class, () -> parse(text));
	}

	@Test
	void connectionInsideSignal()
	{
		ModuleNode module = parse("сигнал входной аналог S { соединение C { Идентификатор : int = 1; }; };");
		SignalNode signal = (SignalNode) module.getBlocks().get(0);
		ConnectionNode connection = signal.getConnection();
		assertEquals("C", connection.getName());
		assertEquals(1, connection.getParameters().size());
	}

	@Test
	void contextOutsideTemplateIsSyntaxError()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> parse("контекст K { $a : int; };"));
		assertTrue(e.getMessage().contains("only allowed in a template"));
	}

	@Test
	void parameterAtModuleLevelIsSyntaxError()
	{
		assertThrows(SyntaxException.class, () -> parse("Идентификатор : int = 1;"));
	}

	@Test
	void missingSemicolonReportsFoundToken()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> parse("$a : int = 1\n$b : int;"));
		assertTrue(e.getMessage().contains("but found '$'"), e.getMessage());
		assertTrue(e.getTrace().contains("line=<2>"), e.getTrace());
	}

	@Test
	void unclosedBlockFails()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> parse("шаблон T {"));
		assertTrue(e.getMessage().contains("end of input"));
	}

	@Test
	void literalValues()
	{
		ModuleNode module = parse("$f : float = 3.25;\n$b : bool = Да;\n$s : str = 'a \"b\" c';\n$i : int = 42;");
		assertEquals(3.25, ((LiteralNode) module.getVariables().get(0).getInitializer()).getValue());
		assertEquals(Boolean.TRUE, ((LiteralNode) module.getVariables().get(1).getInitializer()).getValue());
		assertEquals("a \"b\" c", ((LiteralNode) module.getVariables().get(2).getInitializer()).getValue());
		assertEquals(42L, ((LiteralNode) module.getVariables().get(3).getInitializer()).getValue());
	}

	@Test
	void plainArrTypeTakesArrayValue()
	{
		ModuleNode module = parse("$a : arr = [1, 2];");
		VarDeclarationNode declaration = module.getVariables().get(0);
		assertFalse(declaration.getType() instanceof ArrayTypeNode);
		assertEquals("arr", declaration.getType().getName());
	}

	@Test
	void sizedShapeElements()
	{
		ModuleNode module = parse("$a : arr[int:3, str..] = [1, 2, 3, 'x'];");
		ArrayTypeNode shape = (ArrayTypeNode) module.getVariables().get(0).getType();
		assertEquals(3, shape.getElements().get(0).getSize());
		assertFalse(shape.getElements().get(0).isRepeated());
		assertEquals(-1, shape.getElements().get(1).getSize());
		assertTrue(shape.getElements().get(1).isRepeated());
	}

	@Test
	void arrayValueAfterArrIsNotAShape()
	{
		assertThrows(SyntaxException.class, () -> parse("$a : arr [1, 2];"));
	}

	@Test
	void shapeElementSizeOutOfRangeIsSyntaxError()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> parse("$x : arr[int:99999999999] = [1];"));
		assertTrue(e.getMessage().contains("element size out of range"), e.getMessage());
		assertTrue(e.getTrace().contains("pos=<13>"), e.getTrace());
	}

	@Test
	void ellipsisMustFollowElementDirectly()
	{
		assertThrows(SyntaxException.class, () -> parse("$x : arr[int ..] = [1];"));
	}

	@Test
	void integerLiteralOutOfRangeIsSyntaxError()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> parse("$x : int = 99999999999999999999;"));
		assertTrue(e.getMessage().contains("out of range"), e.getMessage());
	}

	@Test
	void nestedSignalInSignalIsSyntaxError()
	{
		SyntaxException e = assertThrows(SyntaxException.class,
				() -> parse("сигнал входной аналог S { сигнал входной аналог T { }; };"));
		assertTrue(e.getMessage().contains("nested block is not allowed in signal 'S'"), e.getMessage());
	}
}
