package org.lokray.eqcfg.parser;

import org.lokray.eqcfg.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Preprocessed source lines handed to the lexer. Lines are stored without
 * their terminators; line numbers are 1-based.
 */
public class SourceText
{
	private final String name;
	private final List<String> lines;

	public SourceText(String name, List<String> lines)
	{
		this.name = name;
		this.lines = new ArrayList<>(lines);
	}

	public static SourceText of(String name, String text)
	{
		String[] split = text.split("\\r?\\n", -1);
		List<String> lines = new ArrayList<>(split.length);
		Collections.addAll(lines, split);
		// A trailing line terminator does not start a new line
		if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty())
		{
			lines.remove(lines.size() - 1);
		}
		return new SourceText(name, lines);
	}

	public static SourceText fromFile(Path file) throws IOException
	{
		if (!Files.exists(file))
		{
			throw new IOException("path " + file + " does not exist");
		}
		return new SourceText(FileUtils.stripExtension(file), FileUtils.load(file));
	}

	public String getName()
	{
		return name;
	}

	public int lineCount()
	{
		return lines.size();
	}

	/**
	 * @return The lines joined with '\n', as fed to the lexer.
	 */
	public String getText()
	{
		return String.join("\n", lines);
	}

	public boolean hasLine(int lineNumber)
	{
		return lineNumber >= 1 && lineNumber <= lines.size();
	}

	public String getLine(int lineNumber)
	{
		return hasLine(lineNumber) ? lines.get(lineNumber - 1) : "";
	}
}
