package org.lokray.eqcfg;

import org.lokray.eqcfg.emit.Instance;
import org.lokray.eqcfg.emit.JsonEmitter;
import org.lokray.eqcfg.error.CompilationException;
import org.lokray.eqcfg.parser.SourceText;
import org.lokray.eqcfg.semantic.Compiler;
import org.lokray.eqcfg.semantic.CompilerOptions;
import org.lokray.eqcfg.util.CompilerArguments;
import org.lokray.eqcfg.util.Debug;
import org.lokray.eqcfg.util.ErrorHandler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: compiles every input file and writes the collected instances
 * as JSON. Exits with status 1 when any file fails.
 */
public class Main
{
	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * @return The process exit status.
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("eqcfg (Equipment Configuration Compiler) version 0.1.0");
				return 0;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			ErrorHandler errorHandler = new ErrorHandler();
			List<Instance> instances = compileAll(arguments.getInputFiles(), arguments.toCompilerOptions(), errorHandler);
			if (errorHandler.hasErrors())
			{
				Debug.logError("Compilation failed with " + errorHandler.getErrorCount() + " error(s).");
				return 1;
			}

			if (arguments.isCheckOnly())
			{
				Debug.logInfo("Check passed: " + instances.size() + " instance(s).");
				return 0;
			}

			JsonEmitter emitter = new JsonEmitter();
			if (arguments.getOutputPath() != null)
			{
				emitter.write(instances, arguments.getOutputPath());
			}
			else
			{
				System.out.println(emitter.toJson(instances));
			}
			return 0;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Compiler initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error writing output: " + e.getMessage());
		}
		return 1;
	}

	/**
	 * Compiles each file on its own. A failing file contributes no instances.
	 */
	private static List<Instance> compileAll(List<Path> files, CompilerOptions options, ErrorHandler errorHandler)
	{
		List<Instance> instances = new ArrayList<>();
		for (Path file : files)
		{
			if (!Files.exists(file))
			{
				errorHandler.logError("The specified file does not exist: " + file);
				continue;
			}

			Debug.logDebug("Compiling " + file + "...");
			try
			{
				SourceText source = SourceText.fromFile(file);
				instances.addAll(new Compiler(source, options).compile());
			}
			catch (CompilationException e)
			{
				errorHandler.report(file.toString(), e);
			}
			catch (IOException e)
			{
				errorHandler.logError("Error reading file: " + e.getMessage());
			}
		}
		return instances;
	}
}
