package org.lokray.eqcfg.emit;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.lokray.eqcfg.parser.SourceText;
import org.lokray.eqcfg.semantic.Compiler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonEmitterTest
{
	private static List<Instance> compile(String text)
	{
		return new Compiler(SourceText.of("plant", text)).compile();
	}

	private static JsonObject find(JsonArray array, String name)
	{
		for (int i = 0; i < array.size(); i++)
		{
			JsonObject object = array.get(i).getAsJsonObject();
			if (object.get("name").getAsString().equals(name))
			{
				return object;
			}
		}
		throw new AssertionError("no instance " + name);
	}

	@Test
	void instancesBecomeJsonObjects()
	{
		List<Instance> instances = compile("соединение C { Адрес : str = 'tcp://1'; };\n"
				+ "сигнал входной аналог Давление {\n"
				+ "  Значение : float = диапазон[0, ~] статус = норма;\n"
				+ "  Квитируемый : bool = Да;\n"
				+ "  .привязать C;\n"
				+ "};");
		String json = new JsonEmitter().toJson(instances);
		JsonArray array = JsonParser.parseString(json).getAsJsonArray();
		assertEquals(3, array.size());

		JsonObject signal = find(array, "Давление");
		assertEquals("signal", signal.get("kind").getAsString());
		assertEquals("C", signal.get("link").getAsString());
		assertEquals("входной", signal.getAsJsonObject("attributes").get("direction").getAsString());

		JsonArray parameters = signal.getAsJsonArray("parameters");
		JsonObject value = parameters.get(0).getAsJsonObject();
		assertEquals("value", value.get("kind").getAsString());
		JsonObject range = value.getAsJsonObject("value");
		assertEquals(0, range.get("min").getAsLong());
		assertTrue(range.get("max").isJsonNull());
		assertEquals("норма", value.getAsJsonArray("options").get(0).getAsJsonObject().get("value").getAsString());

		JsonObject ack = parameters.get(1).getAsJsonObject();
		assertTrue(ack.get("value").getAsBoolean());
	}

	@Test
	void linkIsNullWithoutBinding()
	{
		String json = new JsonEmitter().toJson(compile(""));
		JsonObject module = JsonParser.parseString(json).getAsJsonArray().get(0).getAsJsonObject();
		assertEquals("plant", module.get("name").getAsString());
		assertTrue(module.get("link").isJsonNull());
	}

	@Test
	void writesFile(@TempDir Path dir) throws Exception
	{
		Path out = dir.resolve("out/instances.json");
		new JsonEmitter().write(compile("$a : arr = [1, 'x', Нет];"), out);

		String json = Files.readString(out, StandardCharsets.UTF_8);
		JsonObject module = JsonParser.parseString(json).getAsJsonArray().get(0).getAsJsonObject();
		JsonArray values = module.getAsJsonObject("variables").getAsJsonArray("a");
		assertEquals(1, values.get(0).getAsLong());
		assertEquals("x", values.get(1).getAsString());
		assertFalse(values.get(2).getAsBoolean());
	}
}
