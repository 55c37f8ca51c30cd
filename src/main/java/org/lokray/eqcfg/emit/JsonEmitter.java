package org.lokray.eqcfg.emit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.eqcfg.util.Debug;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes instances as a pretty-printed JSON array.
 */
public class JsonEmitter
{
	private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

	public String toJson(List<Instance> instances)
	{
		return gson.toJson(InstanceDTOConverter.toDTOs(instances));
	}

	public void write(List<Instance> instances, Path out) throws IOException
	{
		if (out.getParent() != null)
		{
			Files.createDirectories(out.getParent());
		}
		Files.writeString(out, toJson(instances), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote " + instances.size() + " instance(s) to: " + out);
	}
}
