package org.lokray.stanzac.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options for a checker run, parsed from command-line style arguments.
 */
public class CheckerOptions
{
	private boolean helpFlag = false;
	private boolean verboseFlag = false;
	private Path captureDumpPath = null;

	// Use parse() or defaults()
	private CheckerOptions()
	{
	}

	public static CheckerOptions defaults()
	{
		return new CheckerOptions();
	}

	public static CheckerOptions parse(String... args)
	{
		CheckerOptions parsedArgs = new CheckerOptions();

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];

			if (arg.equals("-h") || arg.equals("--help"))
			{
				parsedArgs.helpFlag = true;
				return parsedArgs; // Help flag overrides all else
			}
			if (arg.equals("-v") || arg.equals("--verbose"))
			{
				parsedArgs.verboseFlag = true;
				Debug.ENABLE_DEBUG = true;
				continue;
			}
			if (arg.equals("--dump-captures"))
			{
				parsedArgs.captureDumpPath = Paths.get(getNextArg(args, ++i, arg));
				continue;
			}

			throw new IllegalArgumentException("Unknown option: " + arg);
		}
		return parsedArgs;
	}

	private static String getNextArg(String[] args, int index, String flag)
	{
		if (index >= args.length || args[index].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing value for option: " + flag);
		}
		return args[index];
	}

	public static void printUsage()
	{
		Debug.log("Usage: stanzac [options]");
		Debug.log("  -h, --help                Show this help message.");
		Debug.log("  -v, --verbose             Log stanza and capture resolution details.");
		Debug.log("      --dump-captures <path> Write resolved captures as JSON after a successful check.");
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public Path getCaptureDumpPath()
	{
		return captureDumpPath;
	}
}
