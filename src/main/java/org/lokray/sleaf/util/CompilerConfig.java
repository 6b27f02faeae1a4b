package org.lokray.sleaf.util;

import java.util.Properties;

/**
 * Holds configuration settings for the SLEAF compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	private final String optPath;
	private final String clangPath;
	private final String optimizationLevel;
	private final boolean keepIntermediates;
	private final boolean traceEnabled;

	public CompilerConfig(Properties props)
	{
		this.optPath = props.getProperty("backend.opt_path", "opt").trim();
		this.clangPath = props.getProperty("backend.clang_path", "clang++").trim();
		this.optimizationLevel = props.getProperty("backend.opt_level", "-O3").trim();
		this.keepIntermediates = Boolean.parseBoolean(props.getProperty("backend.keep_intermediates", "false").trim());
		this.traceEnabled = Boolean.parseBoolean(props.getProperty("debug.trace", "false").trim());
	}

	/**
	 * @return A configuration holding only the defaults.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	public String getOptPath()
	{
		return optPath;
	}

	public String getClangPath()
	{
		return clangPath;
	}

	public String getOptimizationLevel()
	{
		return optimizationLevel;
	}

	public boolean isKeepIntermediates()
	{
		return keepIntermediates;
	}

	public boolean isTraceEnabled()
	{
		return traceEnabled;
	}
}
