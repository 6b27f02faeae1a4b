package org.lokray.sleaf.util;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class CompilerConfigTest
{
	@Test
	void usesDefaults()
	{
		CompilerConfig config = CompilerConfig.defaults();

		assertThat(config.getOptPath()).isEqualTo("opt");
		assertThat(config.getClangPath()).isEqualTo("clang++");
		assertThat(config.getOptimizationLevel()).isEqualTo("-O3");
		assertThat(config.isKeepIntermediates()).isFalse();
		assertThat(config.isTraceEnabled()).isFalse();
	}

	@Test
	void readsAndTrimsProperties()
	{
		Properties props = new Properties();
		props.setProperty("backend.opt_path", " /usr/lib/llvm-17/bin/opt ");
		props.setProperty("backend.clang_path", "clang++-17");
		props.setProperty("backend.opt_level", "-O1");
		props.setProperty("backend.keep_intermediates", "true");
		props.setProperty("debug.trace", "TRUE");

		CompilerConfig config = new CompilerConfig(props);

		assertThat(config.getOptPath()).isEqualTo("/usr/lib/llvm-17/bin/opt");
		assertThat(config.getClangPath()).isEqualTo("clang++-17");
		assertThat(config.getOptimizationLevel()).isEqualTo("-O1");
		assertThat(config.isKeepIntermediates()).isTrue();
		assertThat(config.isTraceEnabled()).isTrue();
	}
}
