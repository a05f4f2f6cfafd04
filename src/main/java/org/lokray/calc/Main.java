package org.lokray.calc;

import org.lokray.calc.util.CompilerConfig;
import org.lokray.calc.util.Debug;
import org.lokray.calc.util.ErrorReporter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Entry point for the calc compiler.
 * Compiles one expression given on the command line and prints the LLVM IR.
 * <p>
 * Exit codes: 0 on success, 1 on syntax or semantic errors, 2 on bad usage
 * or I/O failure.
 */
public class Main
{
	static final int EXIT_SUCCESS = 0;
	static final int EXIT_COMPILE_ERROR = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: calc [--output <file.ll>] [--config <calc.properties>] [--debug] <input expression>";

	public static void main(String[] args)
	{
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err)
	{
		Path outputFile = null;
		Path configFile = null;
		boolean debug = false;
		String input = null;

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			if (arg.equals("--output") || arg.equals("--config"))
			{
				if (i + 1 >= args.length)
				{
					err.println("Missing value for " + arg);
					err.println(USAGE);
					return EXIT_USAGE;
				}
				Path value = Paths.get(args[++i]);
				if (arg.equals("--output"))
				{
					outputFile = value;
				}
				else
				{
					configFile = value;
				}
			}
			else if (arg.equals("--debug"))
			{
				debug = true;
			}
			else if (input == null)
			{
				input = arg;
			}
			else
			{
				err.println("Unexpected argument: " + arg);
				err.println(USAGE);
				return EXIT_USAGE;
			}
		}

		if (input == null)
		{
			err.println(USAGE);
			return EXIT_USAGE;
		}

		// Trace configuration loading too when --debug is given.
		Debug.setOutput(err);
		if (debug)
		{
			Debug.setEnabled(true);
		}

		CompilerConfig config;
		try
		{
			config = CompilerConfig.load(configFile);
		}
		catch (IOException | IllegalArgumentException e)
		{
			err.println("Error: could not load configuration: " + e.getMessage());
			return EXIT_USAGE;
		}
		if (!debug && config.isDebugEnabled())
		{
			Debug.setEnabled(true);
		}

		CompilationResult result = new CalcCompiler(config, new ErrorReporter(err)).compile(input);
		if (!result.isSuccess())
		{
			err.println(result.getStatus().getMessage());
			return EXIT_COMPILE_ERROR;
		}

		String ir = result.getIr().orElseThrow();
		if (outputFile == null)
		{
			out.print(ir);
			out.flush();
			return EXIT_SUCCESS;
		}

		try
		{
			Path parent = outputFile.toAbsolutePath().getParent();
			if (parent != null)
			{
				Files.createDirectories(parent);
			}
			Files.write(outputFile, ir.getBytes(StandardCharsets.UTF_8));
			err.println("LLVM IR generated successfully at: " + outputFile);
			return EXIT_SUCCESS;
		}
		catch (IOException e)
		{
			err.println("Error writing IR to file '" + outputFile + "': " + e.getMessage());
			return EXIT_USAGE;
		}
	}
}
