package org.lokray.eqcfg.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class FileUtils
{
	public static List<String> load(Path filePath) throws IOException
	{
		// Sources are always UTF-8, keywords are Cyrillic
		return Files.readAllLines(filePath, StandardCharsets.UTF_8);
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	public static String stripExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		String extension = getFileExtension(path);
		return extension == null ? fileName : fileName.substring(0, fileName.length() - extension.length());
	}
}
