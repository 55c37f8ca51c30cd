package org.lokray.eqcfg.semantic;

import org.lokray.eqcfg.emit.Instance;
import org.lokray.eqcfg.emit.InstanceCollector;
import org.lokray.eqcfg.emit.OptionEntry;
import org.lokray.eqcfg.emit.ParameterEntry;
import org.lokray.eqcfg.error.CompilationException;
import org.lokray.eqcfg.error.DirectiveException;
import org.lokray.eqcfg.error.ParameterException;
import org.lokray.eqcfg.error.SemanticException;
import org.lokray.eqcfg.error.TypeMismatchException;
import org.lokray.eqcfg.parser.SourceText;
import org.lokray.eqcfg.semantic.scope.SignalScope;
import org.lokray.eqcfg.semantic.symbol.RangeValue;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CompilerTest
{
	private static final String TEMPLATE_HEAD =
			"шаблон T {\n"
					+ "  контекст K { $a : int; $b : int; };\n"
					+ "  $data : arr = [[1, 2], [3, 4]];\n";

	private static List<Instance> compile(String text)
	{
		return new Compiler(SourceText.of("test", text)).compile();
	}

	private static List<Instance> ofKind(List<Instance> instances, String kind)
	{
		return instances.stream().filter(i -> i.getKind().equals(kind)).collect(Collectors.toList());
	}

	private static Instance named(List<Instance> instances, String name)
	{
		return instances.stream().filter(i -> i.getName().equals(name)).findFirst()
				.orElseThrow(() -> new AssertionError("no instance " + name + " in " + instances));
	}

	@Test
	void emptySourceYieldsOnlyTheModule()
	{
		List<Instance> instances = compile("");
		assertEquals(1, instances.size());
		assertEquals("module", instances.get(0).getKind());
		assertEquals("test", instances.get(0).getName());
	}

	@Test
	void moduleVariablesAreCollected()
	{
		List<Instance> instances = compile("$a : int = 5;\n$b : int = $a;\n$n : str = (Насос + $a);");
		Instance module = instances.get(0);
		assertEquals(5L, module.getVariables().get("a"));
		assertEquals(5L, module.getVariables().get("b"));
		assertEquals("Насос5", module.getVariables().get("n"));
	}

	@Test
	void twoSignalsBindingOneConnectionShareIt()
	{
		Compiler compiler = new Compiler(SourceText.of("test",
				"соединение C { Идентификатор : int = 1; };\n"
						+ "сигнал входной аналог S1 { .привязать C; };\n"
						+ "сигнал входной аналог S2 { .привязать C; };\n"));
		List<Instance> instances = compiler.compile();

		SignalScope s1 = (SignalScope) compiler.getBuilder().getRegistry().get("S1").orElseThrow();
		SignalScope s2 = (SignalScope) compiler.getBuilder().getRegistry().get("S2").orElseThrow();
		assertSame(s1.getLink().getTarget(), s2.getLink().getTarget());

		assertEquals("C", named(instances, "S1").getLink());
		assertEquals("C", named(instances, "S2").getLink());
		assertEquals(1, ofKind(instances, "connection").size());
	}

	@Test
	void templateReplaysListeningSignalOncePerRow()
	{
		List<Instance> instances = compile(TEMPLATE_HEAD
				+ "  .подстановка в K из $data;\n"
				+ "  сигнал входной аналог S + $a {\n"
				+ "    .использовать K линейно значения все;\n"
				+ "    Идентификатор : int = $b;\n"
				+ "  };\n"
				+ "};");

		List<Instance> signals = ofKind(instances, "signal");
		assertEquals(2, signals.size());
		assertEquals("S1", signals.get(0).getName());
		assertEquals(2L, signals.get(0).getParameterValue("Идентификатор"));
		assertEquals("S3", signals.get(1).getName());
		assertEquals(4L, signals.get(1).getParameterValue("Идентификатор"));
		assertEquals(1L, signals.get(0).getContexts().get("K").get("a"));

		// Listeners are replayed per row only, the module and template once
		assertEquals(1, ofKind(instances, "template").size());
		assertEquals(1, ofKind(instances, "module").size());
	}

	@Test
	void excludingFilterSkipsMatchingRows()
	{
		List<Instance> instances = compile(TEMPLATE_HEAD
				+ "  .подстановка в K из $data;\n"
				+ "  сигнал входной аналог S + $a {\n"
				+ "    .использовать K линейно значения кроме 3;\n"
				+ "  };\n"
				+ "};");
		List<Instance> signals = ofKind(instances, "signal");
		assertEquals(1, signals.size());
		assertEquals("S1", signals.get(0).getName());
	}

	@Test
	void sliceRuleLimitsRows()
	{
		List<Instance> instances = compile(TEMPLATE_HEAD
				+ "  .подстановка в K из $data правило [1:2] <- [i];\n"
				+ "  сигнал входной аналог S + $a {\n"
				+ "    .использовать K линейно значения все;\n"
				+ "  };\n"
				+ "};");
		List<Instance> signals = ofKind(instances, "signal");
		assertEquals(1, signals.size());
		assertEquals("S3", signals.get(0).getName());
	}

	@Test
	void signalValueAcceptsOpenRange()
	{
		List<Instance> instances = compile("сигнал входной аналог S { Значение : float = диапазон[~, 10]; };");
		RangeValue range = (RangeValue) named(instances, "S").getParameterValue("Значение");
		assertEquals(Double.NEGATIVE_INFINITY, range.getMin());
		assertEquals(10L, range.getMax());
	}

	@Test
	void rangeOnOtherParameterIsTypeError()
	{
		TypeMismatchException e = assertThrows(TypeMismatchException.class,
				() -> compile("сигнал входной аналог S { Идентификатор : int = диапазон[1, 2]; };"));
		assertTrue(e.getMessage().contains("range is not supported"));
	}

	@Test
	void mismatchedInitializerIsTypeError()
	{
		TypeMismatchException e = assertThrows(TypeMismatchException.class, () -> compile("$a : int = 'x';"));
		assertEquals("Type Error", e.getKindLabel());
	}

	@Test
	void redeclarationInNestedBlockFailsWithTrace()
	{
		SemanticException e = assertThrows(SemanticException.class,
				() -> compile("$a : int = 1;\nсигнал входной аналог S { $a : int = 2; };"));
		assertTrue(e.getMessage().contains("attempt to redefine registered var name"));
		assertTrue(e.hasTrace());
		assertTrue(e.getTrace().contains("line=<2>"), e.getTrace());
	}

	@Test
	void unknownVariableIsRuntimeError()
	{
		SemanticException e = assertThrows(SemanticException.class,
				() -> compile("сигнал входной аналог S { Идентификатор : int = $missing; };"));
		assertTrue(e.getMessage().contains("missing"));
	}

	@Test
	void parameterNotAllowedForScopeKind()
	{
		assertThrows(ParameterException.class, () -> compile("соединение C { Единицы : str = 'V'; };"));
	}

	@Test
	void optionOfWrongFamilyIsParameterError()
	{
		ParameterException e = assertThrows(ParameterException.class,
				() -> compile("сигнал входной аналог S { Идентификатор : int = 1 обработчик = 'x'; };"));
		assertTrue(e.getMessage().contains("invalid option"));
	}

	@Test
	void unknownOptionIsParameterError()
	{
		ParameterException e = assertThrows(ParameterException.class,
				() -> compile("сигнал входной аналог S { Идентификатор : int = 1 параметр = 2; };"));
		assertTrue(e.getMessage().contains("unexpected parameter option"));
	}

	@Test
	void duplicateSignalOptionIsRuntimeError()
	{
		assertThrows(SemanticException.class,
				() -> compile("сигнал входной аналог S { Идентификатор : int = 1 статус = норма статус = авария; };"));
	}

	@Test
	void equipmentOptionDuplicatesDependOnStrictness()
	{
		String text = "оборудование класс_а E { Идентификатор : int = 1 обработчик = 'a' обработчик = 'b'; };";

		List<Instance> instances = compile(text);
		ParameterEntry id = named(instances, "E").getParameter("Идентификатор").orElseThrow();
		assertEquals(2, id.getOptions().size());
		assertEquals("аналог", named(instances, "E").getAttributes().get("type"));

		Compiler strict = new Compiler(SourceText.of("test", text), new CompilerOptions(true));
		assertThrows(SemanticException.class, strict::compile);
	}

	@Test
	void optionReadsVariableAndSystemConstant()
	{
		List<Instance> instances = compile("$lbl : str = 'насос';\n"
				+ "сигнал входной аналог S { Идентификатор : int = 1 метка = $lbl статус = авария; };");
		List<OptionEntry> options = named(instances, "S").getParameter("Идентификатор").orElseThrow().getOptions();
		assertEquals("label", options.get(0).getKind());
		assertEquals("насос", options.get(0).getValue());
		assertEquals("status", options.get(1).getKind());
		assertEquals("авария", options.get(1).getValue());
	}

	@Test
	void bindToUnknownConnectionIsDirectiveError()
	{
		DirectiveException e = assertThrows(DirectiveException.class,
				() -> compile("сигнал входной аналог S { .привязать Нет_такого; };"));
		assertEquals("Directive Error", e.getKindLabel());
	}

	@Test
	void bindWithExtensionsResolvesFullName()
	{
		List<Instance> instances = compile("$n : int = 2;\n"
				+ "соединение C + $n { Адрес : str = 'x'; };\n"
				+ "сигнал входной аналог S { .привязать (C + $n); };");
		assertEquals("C2", named(instances, "S").getLink());
		assertEquals("x", named(instances, "C2").getParameterValue("Адрес"));
	}

	@Test
	void connectionInsideSignalIsItsLink()
	{
		List<Instance> instances = compile("сигнал входной аналог S { соединение C { Идентификатор : int = 1; }; };");
		assertEquals("C", named(instances, "S").getLink());
	}

	@Test
	void repeatedConnectionKeepsFirstBody()
	{
		List<Instance> instances = compile("соединение C { Адрес : str = 'a'; };\nсоединение C { Адрес : str = 'b'; };");
		List<Instance> connections = ofKind(instances, "connection");
		assertEquals(1, connections.size());
		assertEquals("a", connections.get(0).getParameterValue("Адрес"));
	}

	@Test
	void connectionNamedFromContextIsRuntimeError()
	{
		SemanticException e = assertThrows(SemanticException.class, () -> compile(
				"шаблон T {\n  контекст K { $a : int; };\n  соединение C + $a { };\n};"));
		assertTrue(e.getMessage().contains("not allowed"));
	}

	@Test
	void putFromNonArrayIsDirectiveError()
	{
		assertThrows(DirectiveException.class, () -> compile(
				"шаблон T {\n  контекст K { $a : int; };\n  $d : int = 1;\n  .подстановка в K из $d;\n};"));
	}

	@Test
	void secondPutIntoSameContextIsDirectiveError()
	{
		assertThrows(DirectiveException.class, () -> compile(TEMPLATE_HEAD
				+ "  .подстановка в K из $data;\n"
				+ "  .подстановка в K из $data;\n"
				+ "};"));
	}

	@Test
	void rowArityMismatchCarriesPutTrace()
	{
		DirectiveException e = assertThrows(DirectiveException.class, () -> compile(
				"шаблон T {\n  контекст K { $a : int; $b : int; };\n  $d : arr = [[1]];\n  .подстановка в K из $d;\n};"));
		assertTrue(e.getTrace().contains("line=<4>"), e.getTrace());
	}

	@Test
	void everyErrorIsACompilationException()
	{
		CompilationException e = assertThrows(CompilationException.class, () -> compile("$a : bool = 1;"));
		assertTrue(e.toString().startsWith("[Type Error]"));
	}

	@Test
	void sameNamedTemplatedSignalsInTwoTemplatesStayApart()
	{
		Compiler compiler = new Compiler(SourceText.of("test",
				"шаблон T1 {\n"
						+ "  контекст K { $a : int; };\n"
						+ "  $d : arr = [[1], [2]];\n"
						+ "  .подстановка в K из $d;\n"
						+ "  сигнал входной аналог S + $a { .использовать K линейно значения все; };\n"
						+ "};\n"
						+ "шаблон T2 {\n"
						+ "  контекст K { $a : int; };\n"
						+ "  $d : arr = [[10], [20]];\n"
						+ "  .подстановка в K из $d;\n"
						+ "  сигнал входной аналог S + $a { .использовать K линейно значения все; };\n"
						+ "};"));
		List<Instance> signals = ofKind(compiler.compile(), "signal");

		List<String> names = signals.stream().map(Instance::getName).collect(Collectors.toList());
		assertEquals(List.of("S1", "S2", "S10", "S20"), names);
		assertEquals(2, compiler.getBuilder().getResolvers().size());
		for (ContextResolver resolver : compiler.getBuilder().getResolvers())
		{
			assertEquals(1, compiler.getBuilder().getListeners(resolver.getContext()).size());
		}
	}

	@Test
	void templatedSignalsWithDifferentExtensionsKeepTheirOwnParameters()
	{
		List<Instance> instances = compile(TEMPLATE_HEAD
				+ "  .подстановка в K из $data;\n"
				+ "  сигнал входной аналог S + $a {\n"
				+ "    .использовать K линейно значения все;\n"
				+ "    Идентификатор : int = $a;\n"
				+ "  };\n"
				+ "  сигнал входной аналог S + $b {\n"
				+ "    .использовать K линейно значения все;\n"
				+ "    Идентификатор : int = $b;\n"
				+ "  };\n"
				+ "};");

		List<Instance> signals = ofKind(instances, "signal");
		assertEquals(4, signals.size());
		assertEquals("S1", signals.get(0).getName());
		assertEquals(1L, signals.get(0).getParameterValue("Идентификатор"));
		assertEquals("S2", signals.get(1).getName());
		assertEquals(2L, signals.get(1).getParameterValue("Идентификатор"));
		assertEquals("S3", signals.get(2).getName());
		assertEquals(3L, signals.get(2).getParameterValue("Идентификатор"));
		assertEquals("S4", signals.get(3).getName());
		assertEquals(4L, signals.get(3).getParameterValue("Идентификатор"));
	}

	@Test
	void repeatedUseOfOneContextReplaysOncePerRow()
	{
		Compiler compiler = new Compiler(SourceText.of("test", TEMPLATE_HEAD
				+ "  .подстановка в K из $data;\n"
				+ "  сигнал входной аналог S + $a { .использовать K линейно значения все; };\n"
				+ "  сигнал входной аналог S + $a { .использовать K линейно значения все; };\n"
				+ "};"));
		List<Instance> signals = ofKind(compiler.compile(), "signal");

		assertEquals(2, signals.size());
		assertEquals("S1", signals.get(0).getName());
		assertEquals("S3", signals.get(1).getName());
		ContextResolver resolver = compiler.getBuilder().getResolvers().get(0);
		assertEquals(1, compiler.getBuilder().getListeners(resolver.getContext()).size());
	}

	@Test
	void failingLaterContextLeavesFinalizerUntouched()
	{
		Compiler compiler = new Compiler(SourceText.of("test",
				"шаблон T1 {\n"
						+ "  контекст K { $a : int; };\n"
						+ "  $d : arr = [[1], [2]];\n"
						+ "  .подстановка в K из $d;\n"
						+ "  сигнал входной аналог S + $a { .использовать K линейно значения все; };\n"
						+ "};\n"
						+ "шаблон T2 {\n"
						+ "  контекст K { $a : int; };\n"
						+ "  $d : arr = [[1], [2, 3]];\n"
						+ "  .подстановка в K из $d;\n"
						+ "  сигнал входной аналог R + $a { .использовать K линейно значения все; };\n"
						+ "};"));
		InstanceCollector collector = new InstanceCollector();

		DirectiveException e = assertThrows(DirectiveException.class, () -> compiler.run(collector));
		assertTrue(e.getTrace().contains("line=<10>"), e.getTrace());
		assertTrue(collector.getInstances().isEmpty());
	}

	@Test
	void runReplaysIntoCallerFinalizerOnce()
	{
		InstanceCollector collector = new Compiler(SourceText.of("test", TEMPLATE_HEAD
				+ "  .подстановка в K из $data;\n"
				+ "  сигнал входной аналог S + $a { .использовать K линейно значения все; };\n"
				+ "};")).run(new InstanceCollector());

		assertEquals(2, ofKind(collector.getInstances(), "signal").size());
		assertEquals(1, ofKind(collector.getInstances(), "template").size());
	}
}
