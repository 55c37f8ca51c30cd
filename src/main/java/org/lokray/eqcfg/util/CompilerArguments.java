package org.lokray.eqcfg.util;

import org.lokray.eqcfg.semantic.CompilerOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds the command-line arguments of the compiler.
 */
public class CompilerArguments
{
	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private Path outputPath = null; // Default: stdout
	private boolean checkOnly = false;
	private boolean strictEquipmentOptions = false;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals("--strict-equipment-options"))
				{
					parsedArgs.strictEquipmentOptions = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's an input file
				parsedArgs.inputFiles.add(Paths.get(arg));
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Compiler for equipment configuration sources.");
		System.out.println("\nUSAGE: eqcfg [options] file...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                  Show this help message and exit.");
		System.out.println("  --version                   Show compiler version and exit.");
		System.out.println("  -v, --verbose               Enable verbose debug logging.");
		System.out.println("  -o, --output <file>         Write the JSON instances to a file instead of stdout.");
		System.out.println("  -k, --check                 Compile only; do not write any output.");
		System.out.println("\nFLAGS:");
		System.out.println("  --strict-equipment-options  Reject an option registered twice on an equipment parameter.");
	}

	/**
	 * @return The options the compiler runs with.
	 */
	public CompilerOptions toCompilerOptions()
	{
		return new CompilerOptions(strictEquipmentOptions);
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isStrictEquipmentOptions()
	{
		return strictEquipmentOptions;
	}
}
