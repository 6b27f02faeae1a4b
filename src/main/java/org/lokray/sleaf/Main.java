package org.lokray.sleaf;

import org.lokray.sleaf.ast.ASTPrinter;
import org.lokray.sleaf.ast.statements.Statement;
import org.lokray.sleaf.backend.BackendException;
import org.lokray.sleaf.backend.BackendToolchain;
import org.lokray.sleaf.codegen.LLVMIRGenerator;
import org.lokray.sleaf.lexer.Lexer;
import org.lokray.sleaf.lexer.Token;
import org.lokray.sleaf.lexer.TokenType;
import org.lokray.sleaf.parser.SleafParser;
import org.lokray.sleaf.util.CompilerConfig;
import org.lokray.sleaf.util.Debug;
import org.lokray.sleaf.util.ErrorReporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;

/**
 * Entry point for the SLEAF compiler.
 * Orchestrates lexing, parsing, LLVM IR generation and the external backend.
 */
@Command(
		name = "sleaf",
		mixinStandardHelpOptions = true,
		version = "sleaf 0.1.0",
		description = "Compiles a SLEAF source file to a native executable through LLVM."
)
public class Main implements Callable<Integer>
{
	static final int MAX_DUMPED_TOKENS = 500;

	@Parameters(index = "0", arity = "0..1", description = "Source file. Reads standard input when omitted.")
	private Path sourceFile;

	@Option(names = {"-c", "--check-utils"}, description = "Check that the optimizer and compiler are on the PATH.")
	private boolean checkUtils;

	@Option(names = {"-l", "--lexer"}, description = "Dump the token stream and exit.")
	private boolean dumpTokens;

	@Option(names = {"-p", "--parser"}, description = "Parse and print the AST and exit.")
	private boolean dumpParser;

	@Option(names = {"-a", "--ast"}, description = "Print the AST and exit.")
	private boolean dumpAst;

	@Option(names = {"-o", "--output"}, paramLabel = "<name>", description = "Name of the output executable (default: ${DEFAULT-VALUE}).")
	private String output = "a.out";

	@Option(names = "--emit-llvm", description = "Write <name>.ll and stop before the backend.")
	private boolean emitLlvm;

	@Option(names = "--trace", description = "Enable compiler tracing output.")
	private boolean trace;

	private CompilerConfig config;

	public static void main(String[] args)
	{
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}

	/**
	 * Replaces the configuration that would be loaded from the user's home directory.
	 */
	Main withConfig(CompilerConfig config)
	{
		this.config = config;
		return this;
	}

	@Override
	public Integer call()
	{
		if (config == null)
		{
			config = loadConfiguration();
		}
		Debug.setEnabled(trace || config.isTraceEnabled());

		ErrorReporter errorReporter = new ErrorReporter();
		errorReporter.setVerbose(Debug.isEnabled());
		BackendToolchain toolchain = new BackendToolchain(config, errorReporter);

		if (checkUtils)
		{
			return toolchain.checkToolsAvailable() ? 0 : 1;
		}

		String source;
		try
		{
			source = readSource();
		}
		catch (IOException e)
		{
			errorReporter.error("Could not read source " + (sourceFile != null ? sourceFile : "<stdin>") + ": " + e.getMessage());
			return 1;
		}

		if (dumpTokens)
		{
			dumpTokens(source);
			return 0;
		}

		// --- Parsing ---
		SleafParser parser = new SleafParser(new Lexer(source), errorReporter);
		List<Statement> statements = parser.parse();

		if (dumpParser || dumpAst)
		{
			System.out.print(new ASTPrinter().print(statements));
			return parser.hadError() ? 1 : 0;
		}
		if (parser.hadError())
		{
			errorReporter.error("Parsing failed with " + parser.getErrorCount() + " error(s).");
			return 1;
		}

		// --- Code generation and backend ---
		LLVMIRGenerator generator = new LLVMIRGenerator(moduleName(), errorReporter);
		try
		{
			generator.generate(statements);
			if (generator.hadErrors())
			{
				errorReporter.error("Code generation failed with " + generator.getErrorCount() + " error(s).");
				return 1;
			}
			generator.verifyModule();

			Path irFile = Paths.get(output + ".ll");
			if (!generator.writeToFile(irFile))
			{
				errorReporter.error("Could not write LLVM IR to " + irFile);
				return 1;
			}
			errorReporter.info("LLVM IR written to " + irFile);
			if (emitLlvm)
			{
				return 0;
			}

			Path optimized = toolchain.optimize(irFile);
			Path executable = toolchain.compile(optimized);
			if (!config.isKeepIntermediates())
			{
				toolchain.cleanupIntermediates(irFile);
			}
			errorReporter.info("Executable written to " + executable);
			return 0;
		}
		catch (BackendException e)
		{
			errorReporter.error(e.getMessage());
			return 1;
		}
		catch (RuntimeException e)
		{
			errorReporter.critical("Internal compiler error: " + e);
			return 1;
		}
		finally
		{
			generator.dispose();
		}
	}

	private String readSource() throws IOException
	{
		if (sourceFile == null)
		{
			return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
		}
		return Files.readString(sourceFile, StandardCharsets.UTF_8);
	}

	private void dumpTokens(String source)
	{
		Lexer lexer = new Lexer(source);
		for (int i = 0; i < MAX_DUMPED_TOKENS; i++)
		{
			Token token = lexer.scanToken();
			System.out.println(token);
			if (token.getType() == TokenType.END_OF_FILE)
			{
				return;
			}
		}
	}

	private String moduleName()
	{
		return sourceFile != null ? sourceFile.getFileName().toString() : "stdin";
	}

	private static CompilerConfig loadConfiguration()
	{
		Properties props = new Properties();
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "sleaf", "sleaf.conf");

		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
			}
			catch (IOException e)
			{
				System.err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return new CompilerConfig(props);
	}
}
