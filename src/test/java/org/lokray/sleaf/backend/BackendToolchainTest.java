package org.lokray.sleaf.backend;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.sleaf.util.CompilerConfig;
import org.lokray.sleaf.util.ErrorReporter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendToolchainTest
{
	private final ErrorReporter errorReporter = new ErrorReporter(
			new PrintStream(new ByteArrayOutputStream()), new PrintStream(new ByteArrayOutputStream()));

	private BackendToolchain toolchain(String optPath, String clangPath)
	{
		Properties props = new Properties();
		props.setProperty("backend.opt_path", optPath);
		props.setProperty("backend.clang_path", clangPath);
		return new BackendToolchain(new CompilerConfig(props), errorReporter);
	}

	@Test
	void failingOptimizerRaisesBackendException(@TempDir Path tempDir) throws IOException
	{
		Path ir = Files.writeString(tempDir.resolve("prog.ll"), "; empty module\n");

		assertThatThrownBy(() -> toolchain("/bin/false", "/bin/false").optimize(ir))
				.isInstanceOf(BackendException.class)
				.hasMessageContaining("Optimization failed");
		assertThat(errorReporter.hasErrors()).isTrue();
	}

	@Test
	void successWithoutArtifactIsAFailure(@TempDir Path tempDir) throws IOException
	{
		Path ir = Files.writeString(tempDir.resolve("prog.ll"), "; empty module\n");

		assertThatThrownBy(() -> toolchain("/bin/true", "/bin/true").optimize(ir))
				.isInstanceOf(BackendException.class)
				.hasMessageContaining("was not created");
	}

	@Test
	void failingCompilerRaisesBackendException(@TempDir Path tempDir) throws IOException
	{
		Path optimized = Files.writeString(tempDir.resolve("prog-opt.ll"), "; empty module\n");

		assertThatThrownBy(() -> toolchain("/bin/true", "/bin/false").compile(optimized))
				.isInstanceOf(BackendException.class)
				.hasMessageContaining("Compilation failed");
	}

	@Test
	void missingToolCannotBeStarted(@TempDir Path tempDir) throws IOException
	{
		Path ir = Files.writeString(tempDir.resolve("prog.ll"), "; empty module\n");

		assertThatThrownBy(() -> toolchain("/nonexistent/opt", "clang++").optimize(ir))
				.isInstanceOf(BackendException.class)
				.hasMessageContaining("Could not start");
	}

	@Test
	void derivesArtifactNamesFromIrFile()
	{
		assertThat(BackendToolchain.baseName(Paths.get("build/prog.ll"))).isEqualTo("prog");
		assertThat(BackendToolchain.baseName(Paths.get("build/prog-opt.ll"))).isEqualTo("prog");
		assertThat(BackendToolchain.baseName(Paths.get("a.out"))).isEqualTo("a.out");
	}

	@Test
	void checksToolAvailability()
	{
		assertThat(BackendToolchain.isOnPath("/bin/sh")).isTrue();
		assertThat(BackendToolchain.isOnPath("sh")).isTrue();
		assertThat(BackendToolchain.isOnPath("definitely-not-a-real-tool-xyz")).isFalse();
		assertThat(toolchain("/bin/sh", "definitely-not-a-real-tool-xyz").checkToolsAvailable()).isFalse();
	}

	@Test
	void cleanupRemovesIntermediates(@TempDir Path tempDir) throws IOException
	{
		Path ir = Files.writeString(tempDir.resolve("prog.ll"), "x");
		Path optimized = Files.writeString(tempDir.resolve("prog-opt.ll"), "x");
		Path executable = Files.writeString(tempDir.resolve("prog"), "x");

		toolchain("opt", "clang++").cleanupIntermediates(ir);

		assertThat(ir).doesNotExist();
		assertThat(optimized).doesNotExist();
		assertThat(executable).exists();
	}
}
