package org.lokray.sleaf.backend;

import org.lokray.sleaf.util.CompilerConfig;
import org.lokray.sleaf.util.Debug;
import org.lokray.sleaf.util.ErrorReporter;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives the external LLVM tools that turn a textual IR file into a native executable:
 * {@code opt} optimizes the IR, {@code clang++} compiles and links it.
 * <p>
 * Every stage first runs quietly. If it fails it is run a second time with its output
 * streamed through the {@link ErrorReporter} so the user sees why, and a
 * {@link BackendException} is thrown.
 */
public class BackendToolchain
{
	private static final String IR_EXTENSION = ".ll";
	private static final String OPTIMIZED_SUFFIX = "-opt.ll";

	private final CompilerConfig config;
	private final ErrorReporter errorReporter;

	public BackendToolchain(CompilerConfig config, ErrorReporter errorReporter)
	{
		this.config = config;
		this.errorReporter = errorReporter;
	}

	/**
	 * Runs the optimizer over an IR file.
	 *
	 * @param irFile The {@code <base>.ll} file written by the generator.
	 * @return The optimized {@code <base>-opt.ll} file.
	 * @throws BackendException If the optimizer fails or writes nothing.
	 */
	public Path optimize(Path irFile) throws BackendException
	{
		Path optimized = siblingOf(irFile, baseName(irFile) + OPTIMIZED_SUFFIX);
		List<String> command = List.of(
				config.getOptPath(),
				irFile.toString(),
				config.getOptimizationLevel(),
				"-S",
				"-o",
				optimized.toString()
		);
		runStage("Optimization", command, optimized);
		return optimized;
	}

	/**
	 * Compiles an (optimized) IR file into an executable next to it.
	 *
	 * @param optimizedFile The {@code <base>-opt.ll} (or plain {@code <base>.ll}) file.
	 * @return The executable {@code <base>}.
	 * @throws BackendException If the compiler fails or writes nothing.
	 */
	public Path compile(Path optimizedFile) throws BackendException
	{
		Path executable = siblingOf(optimizedFile, baseName(optimizedFile));
		List<String> command = List.of(
				config.getClangPath(),
				config.getOptimizationLevel(),
				optimizedFile.toString(),
				"-o",
				executable.toString()
		);
		runStage("Compilation", command, executable);
		return executable;
	}

	/**
	 * Checks that both configured tools can be found.
	 *
	 * @return True if the optimizer and the native compiler are both available.
	 */
	public boolean checkToolsAvailable()
	{
		boolean optFound = isOnPath(config.getOptPath());
		boolean clangFound = isOnPath(config.getClangPath());
		errorReporter.info("Optimizer '" + config.getOptPath() + "': " + (optFound ? "found" : "NOT FOUND"));
		errorReporter.info("Compiler '" + config.getClangPath() + "': " + (clangFound ? "found" : "NOT FOUND"));
		return optFound && clangFound;
	}

	/**
	 * Deletes {@code <base>.ll} and {@code <base>-opt.ll}. Missing files are ignored.
	 */
	public void cleanupIntermediates(Path irFile)
	{
		String base = baseName(irFile);
		for (Path path : List.of(siblingOf(irFile, base + IR_EXTENSION), siblingOf(irFile, base + OPTIMIZED_SUFFIX)))
		{
			try
			{
				if (Files.deleteIfExists(path))
				{
					Debug.log("Removed intermediate file %s", path);
				}
			}
			catch (IOException e)
			{
				errorReporter.warning("Could not remove intermediate file " + path + ": " + e.getMessage());
			}
		}
	}

	// --- Process handling ---

	private void runStage(String stage, List<String> command, Path artifact) throws BackendException
	{
		Debug.log("%s: %s", stage, String.join(" ", command));
		int exitCode = runQuietly(command);
		if (exitCode != 0)
		{
			errorReporter.error(stage + " failed with exit code " + exitCode + ". Re-running with output:");
			runVerbose(command);
			throw new BackendException(stage + " failed: " + String.join(" ", command));
		}

		try
		{
			if (!Files.exists(artifact) || Files.size(artifact) == 0)
			{
				throw new BackendException(stage + " reported success but " + artifact + " was not created");
			}
		}
		catch (IOException e)
		{
			throw new BackendException("Could not inspect " + artifact, e);
		}
	}

	private int runQuietly(List<String> command) throws BackendException
	{
		try
		{
			Process process = new ProcessBuilder(command)
					.redirectOutput(ProcessBuilder.Redirect.DISCARD)
					.redirectError(ProcessBuilder.Redirect.DISCARD)
					.start();
			return process.waitFor();
		}
		catch (IOException e)
		{
			throw new BackendException("Could not start '" + command.get(0) + "': " + e.getMessage(), e);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new BackendException("Interrupted while running '" + command.get(0) + "'", e);
		}
	}

	private void runVerbose(List<String> command) throws BackendException
	{
		try
		{
			Process process = new ProcessBuilder(command).start();
			Thread stdout = new Thread(new StreamGobbler(process.getInputStream(), line -> errorReporter.info("[stdout]: " + line)));
			Thread stderr = new Thread(new StreamGobbler(process.getErrorStream(), line -> errorReporter.warning("[stderr]: " + line)));
			stdout.start();
			stderr.start();
			process.waitFor();
			stdout.join();
			stderr.join();
		}
		catch (IOException e)
		{
			throw new BackendException("Could not start '" + command.get(0) + "': " + e.getMessage(), e);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new BackendException("Interrupted while running '" + command.get(0) + "'", e);
		}
	}

	// --- Paths ---

	static String baseName(Path file)
	{
		String name = file.getFileName().toString();
		if (name.endsWith(OPTIMIZED_SUFFIX))
		{
			return name.substring(0, name.length() - OPTIMIZED_SUFFIX.length());
		}
		if (name.endsWith(IR_EXTENSION))
		{
			return name.substring(0, name.length() - IR_EXTENSION.length());
		}
		return name;
	}

	private static Path siblingOf(Path file, String name)
	{
		Path parent = file.getParent();
		return parent != null ? parent.resolve(name) : Paths.get(name);
	}

	static boolean isOnPath(String tool)
	{
		if (tool.contains(File.separator))
		{
			return Files.isExecutable(Paths.get(tool));
		}
		String path = System.getenv("PATH");
		if (path == null)
		{
			return false;
		}
		for (String directory : path.split(File.pathSeparator))
		{
			if (!directory.isEmpty() && Files.isExecutable(Paths.get(directory, tool)))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Forwards a process stream line by line.
	 */
	private static class StreamGobbler implements Runnable
	{
		private final InputStream inputStream;
		private final Consumer<String> sink;

		public StreamGobbler(InputStream inputStream, Consumer<String> sink)
		{
			this.inputStream = inputStream;
			this.sink = sink;
		}

		@Override
		public void run()
		{
			try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8)))
			{
				String line;
				while ((line = reader.readLine()) != null)
				{
					sink.accept(line);
				}
			}
			catch (IOException e)
			{
				System.err.println("Error reading process stream: " + e.getMessage());
			}
		}
	}
}
