package org.lokray.calc.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Holds configuration settings for the calc compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final String RESOURCE_NAME = "calc.properties";

	private final String moduleName;
	private final String readFunctionName;
	private final String writeFunctionName;
	private final boolean hostTarget;
	private final boolean debugEnabled;

	public CompilerConfig(Properties props)
	{
		this.moduleName = props.getProperty("codegen.module_name", "calc.expr").trim();
		this.readFunctionName = props.getProperty("codegen.read_function", "calc_read").trim();
		this.writeFunctionName = props.getProperty("codegen.write_function", "calc_write").trim();
		this.hostTarget = Boolean.parseBoolean(props.getProperty("codegen.host_target", "false").trim());
		this.debugEnabled = Boolean.parseBoolean(props.getProperty("debug.enabled", "false").trim());

		if (readFunctionName.isEmpty() || writeFunctionName.isEmpty())
		{
			throw new IllegalArgumentException("Runtime function names must not be empty.");
		}
		if (readFunctionName.equals(writeFunctionName) || readFunctionName.equals("main") || writeFunctionName.equals("main"))
		{
			throw new IllegalArgumentException("Runtime function names must be distinct and must not be 'main'.");
		}
	}

	/**
	 * Configuration with every key at its default.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	/**
	 * Loads {@value #RESOURCE_NAME} from the classpath, then overlays the given
	 * file when one is passed.
	 *
	 * @param overrideFile Optional properties file; may be null.
	 * @throws IOException if the override file cannot be read.
	 */
	public static CompilerConfig load(Path overrideFile) throws IOException
	{
		Properties props = new Properties();
		try (InputStream input = CompilerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
		{
			if (input != null)
			{
				props.load(input);
				Debug.log("Loaded configuration resource %s", RESOURCE_NAME);
			}
		}

		if (overrideFile != null)
		{
			try (InputStream input = Files.newInputStream(overrideFile))
			{
				props.load(input);
				Debug.log("Loaded configuration from %s", overrideFile);
			}
		}
		return new CompilerConfig(props);
	}

	public String getModuleName()
	{
		return moduleName;
	}

	public String getReadFunctionName()
	{
		return readFunctionName;
	}

	public String getWriteFunctionName()
	{
		return writeFunctionName;
	}

	public boolean isHostTarget()
	{
		return hostTarget;
	}

	public boolean isDebugEnabled()
	{
		return debugEnabled;
	}
}
