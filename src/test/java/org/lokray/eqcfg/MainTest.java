package org.lokray.eqcfg;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	@Test
	void compilesFileToJsonOutput(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("plant.cfg");
		Files.writeString(source, "сигнал входной аналог S { Идентификатор : int = 3; };\n", StandardCharsets.UTF_8);
		Path out = dir.resolve("plant.json");

		assertEquals(0, Main.run(new String[]{source.toString(), "-o", out.toString()}));
		String json = Files.readString(out, StandardCharsets.UTF_8);
		assertTrue(json.contains("\"signal_id\""));
		assertTrue(json.contains("\"plant\""));
	}

	@Test
	void checkOnlyWritesNothing(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("plant.cfg");
		Files.writeString(source, "$a : int = 1;\n", StandardCharsets.UTF_8);
		Path out = dir.resolve("plant.json");

		assertEquals(0, Main.run(new String[]{"-k", source.toString(), "-o", out.toString()}));
		assertFalse(Files.exists(out));
	}

	@Test
	void compilationErrorExitsWithOne(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("broken.cfg");
		Files.writeString(source, "$a : int = 'x';\n", StandardCharsets.UTF_8);
		assertEquals(1, Main.run(new String[]{source.toString()}));
	}

	@Test
	void missingFileExitsWithOne(@TempDir Path dir)
	{
		assertEquals(1, Main.run(new String[]{dir.resolve("absent.cfg").toString()}));
	}

	@Test
	void helpExitsWithZero()
	{
		assertEquals(0, Main.run(new String[]{"--help"}));
	}
}
