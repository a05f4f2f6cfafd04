package org.lokray.calc.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CompilerConfigTest
{
	@TempDir
	Path tempDir;

	@Test
	void testDefaults()
	{
		CompilerConfig config = CompilerConfig.defaults();

		assertThat(config.getModuleName()).isEqualTo("calc.expr");
		assertThat(config.getReadFunctionName()).isEqualTo("calc_read");
		assertThat(config.getWriteFunctionName()).isEqualTo("calc_write");
		assertThat(config.isHostTarget()).isFalse();
		assertThat(config.isDebugEnabled()).isFalse();
	}

	@Test
	void testBundledResourceMatchesDefaults() throws IOException
	{
		CompilerConfig config = CompilerConfig.load(null);

		assertThat(config.getModuleName()).isEqualTo("calc.expr");
		assertThat(config.getReadFunctionName()).isEqualTo("calc_read");
		assertThat(config.getWriteFunctionName()).isEqualTo("calc_write");
	}

	@Test
	void testOverrideFileWinsOverResource() throws IOException
	{
		Path file = tempDir.resolve("custom.properties");
		Files.writeString(file, "codegen.write_function = print_int\ndebug.enabled = true\n", StandardCharsets.UTF_8);

		CompilerConfig config = CompilerConfig.load(file);

		assertThat(config.getWriteFunctionName()).isEqualTo("print_int");
		assertThat(config.getReadFunctionName()).isEqualTo("calc_read");
		assertThat(config.isDebugEnabled()).isTrue();
	}

	@Test
	void testMissingOverrideFile()
	{
		assertThatThrownBy(() -> CompilerConfig.load(tempDir.resolve("absent.properties")))
				.isInstanceOf(NoSuchFileException.class);
	}

	@Test
	void testInvalidFunctionNames()
	{
		Properties same = new Properties();
		same.setProperty("codegen.read_function", "io");
		same.setProperty("codegen.write_function", "io");
		assertThatThrownBy(() -> new CompilerConfig(same)).isInstanceOf(IllegalArgumentException.class);

		Properties main = new Properties();
		main.setProperty("codegen.write_function", "main");
		assertThatThrownBy(() -> new CompilerConfig(main)).isInstanceOf(IllegalArgumentException.class);

		Properties blank = new Properties();
		blank.setProperty("codegen.read_function", "  ");
		assertThatThrownBy(() -> new CompilerConfig(blank)).isInstanceOf(IllegalArgumentException.class);
	}
}
