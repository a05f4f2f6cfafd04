package org.lokray.calc.codegen;

import org.lokray.calc.util.CompilerConfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the generated {@code main} in LLVM's interpreter and checks what reaches the write function.
 */
@Tag("integration")
class GeneratedCodeExecutionTest
{
	private static IrInterpreter.Run execute(String source, Integer... inputs)
	{
		String ir = new LLVMIRGenerator(CompilerConfig.defaults()).generate(LLVMIRGeneratorTest.parse(source));
		return IrInterpreter.run(ir, List.of(inputs));
	}

	@Test
	void testConstantProgram()
	{
		IrInterpreter.Run run = execute("1+2*3");

		assertThat(run.result).isEqualTo(7);
		assertThat(run.exitCode).isZero();
		assertThat(run.reads).isZero();
		assertThat(run.writes).isEqualTo(1);
	}

	@Test
	void testReadsInput()
	{
		IrInterpreter.Run run = execute("with x: x+1", 4);

		assertThat(run.result).isEqualTo(5);
		assertThat(run.reads).isEqualTo(1);
		assertThat(run.writes).isEqualTo(1);
		assertThat(run.exitCode).isZero();
	}

	@Test
	void testInputsFollowDeclarationOrder()
	{
		IrInterpreter.Run run = execute("with b, a: a - b", 10, 3);

		assertThat(run.result).isEqualTo(-7);
		assertThat(run.reads).isEqualTo(2);
	}

	@Test
	void testUnusedVariablesAreStillRead()
	{
		IrInterpreter.Run run = execute("with x, y, z: y", 1, 2, 3);

		assertThat(run.result).isEqualTo(2);
		assertThat(run.reads).isEqualTo(3);
	}

	@Test
	void testDivisionTruncatesTowardZero()
	{
		assertThat(execute("with x: x / 2", -7).result).isEqualTo(-3);
		assertThat(execute("with x, y: x / y", 7, -2).result).isEqualTo(-3);
	}

	@Test
	void testPrecedenceAtRuntime()
	{
		assertThat(execute("with a, b, c: a + b * c", 2, 3, 4).result).isEqualTo(14);
		assertThat(execute("with a, b, c: (a + b) * c", 2, 3, 4).result).isEqualTo(20);
		assertThat(execute("with a, b, c: a - b - c", 10, 3, 2).result).isEqualTo(5);
	}
}
