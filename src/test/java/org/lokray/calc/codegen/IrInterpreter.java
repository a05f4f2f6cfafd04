package org.lokray.calc.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.*;

import java.util.List;
import java.util.stream.Collectors;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Runs generated modules in LLVM's interpreter against a small runtime written
 * in IR. {@code calc_read} hands out the given inputs in order,
 * {@code calc_write} records the last value written.
 */
final class IrInterpreter
{
	/**
	 * What one run of {@code main} observed.
	 */
	static final class Run
	{
		final int exitCode;
		final int result;
		final int reads;
		final int writes;

		Run(int exitCode, int result, int reads, int writes)
		{
			this.exitCode = exitCode;
			this.result = result;
			this.reads = reads;
			this.writes = writes;
		}
	}

	private static final String RUNTIME =
			"@calc.inputs = private constant [%1$d x i32] %2$s\n"
					+ "@calc.next = private global i32 0\n"
					+ "@calc.result = private global i32 0\n"
					+ "@calc.writes = private global i32 0\n"
					+ "\n"
					+ "define i32 @calc_read(ptr %%name) {\n"
					+ "entry:\n"
					+ "  %%index = load i32, ptr @calc.next\n"
					+ "  %%slot = getelementptr [%1$d x i32], ptr @calc.inputs, i32 0, i32 %%index\n"
					+ "  %%value = load i32, ptr %%slot\n"
					+ "  %%next = add i32 %%index, 1\n"
					+ "  store i32 %%next, ptr @calc.next\n"
					+ "  ret i32 %%value\n"
					+ "}\n"
					+ "\n"
					+ "define void @calc_write(i32 %%value) {\n"
					+ "entry:\n"
					+ "  store i32 %%value, ptr @calc.result\n"
					+ "  %%count = load i32, ptr @calc.writes\n"
					+ "  %%inc = add i32 %%count, 1\n"
					+ "  store i32 %%inc, ptr @calc.writes\n"
					+ "  ret void\n"
					+ "}\n"
					+ "\n"
					+ "define i32 @calc_result() {\n"
					+ "entry:\n"
					+ "  %%value = load i32, ptr @calc.result\n"
					+ "  ret i32 %%value\n"
					+ "}\n"
					+ "\n"
					+ "define i32 @calc_reads() {\n"
					+ "entry:\n"
					+ "  %%value = load i32, ptr @calc.next\n"
					+ "  ret i32 %%value\n"
					+ "}\n"
					+ "\n"
					+ "define i32 @calc_writes() {\n"
					+ "entry:\n"
					+ "  %%value = load i32, ptr @calc.writes\n"
					+ "  ret i32 %%value\n"
					+ "}\n";

	private IrInterpreter()
	{
	}

	static Run run(String ir, List<Integer> inputs)
	{
		LLVMLinkInInterpreter();
		LLVMContextRef context = LLVMContextCreate();
		try
		{
			LLVMModuleRef program = parse(context, ir, "program");
			LLVMModuleRef runtime = parse(context, runtime(inputs), "runtime");
			// The runtime module is consumed by the link.
			if (LLVMLinkModules2(program, runtime) != 0)
			{
				LLVMDisposeModule(program);
				throw new IllegalStateException("Could not link the test runtime");
			}

			LLVMExecutionEngineRef engine = new LLVMExecutionEngineRef();
			BytePointer error = new BytePointer((Pointer) null);
			if (LLVMCreateInterpreterForModule(engine, program, error) != 0)
			{
				String message = error.getString();
				LLVMDisposeMessage(error);
				LLVMDisposeModule(program);
				throw new IllegalStateException("Could not create interpreter: " + message);
			}

			try
			{
				LLVMTypeRef int32Type = LLVMInt32TypeInContext(context);
				LLVMGenericValueRef argc = LLVMCreateGenericValueOfInt(int32Type, 0, 0);
				LLVMGenericValueRef argv = LLVMCreateGenericValueOfPointer(new Pointer());
				PointerPointer<LLVMGenericValueRef> mainArgs = new PointerPointer<>(2);
				mainArgs.put(0, argc);
				mainArgs.put(1, argv);

				int exitCode = call(engine, program, "main", 2, mainArgs);
				int result = call(engine, program, "calc_result", 0, null);
				int reads = call(engine, program, "calc_reads", 0, null);
				int writes = call(engine, program, "calc_writes", 0, null);

				LLVMDisposeGenericValue(argc);
				LLVMDisposeGenericValue(argv);
				return new Run(exitCode, result, reads, writes);
			}
			finally
			{
				// Owns the linked module.
				LLVMDisposeExecutionEngine(engine);
			}
		}
		finally
		{
			LLVMContextDispose(context);
		}
	}

	private static int call(LLVMExecutionEngineRef engine, LLVMModuleRef module, String name, int argCount, PointerPointer<LLVMGenericValueRef> args)
	{
		LLVMValueRef function = LLVMGetNamedFunction(module, name);
		if (function == null || function.isNull())
		{
			throw new IllegalStateException("No function named " + name);
		}
		LLVMGenericValueRef value = LLVMRunFunction(engine, function, argCount, args);
		int result = (int) LLVMGenericValueToInt(value, 1);
		LLVMDisposeGenericValue(value);
		return result;
	}

	private static LLVMModuleRef parse(LLVMContextRef context, String ir, String name)
	{
		LLVMMemoryBufferRef buffer = LLVMCreateMemoryBufferWithMemoryRangeCopy(ir, ir.length(), name);
		LLVMModuleRef module = new LLVMModuleRef();
		BytePointer error = new BytePointer((Pointer) null);
		// Takes ownership of the buffer.
		if (LLVMParseIRInContext(context, buffer, module, error) != 0)
		{
			String message = error.getString();
			LLVMDisposeMessage(error);
			throw new IllegalStateException("Invalid IR in " + name + ": " + message + "\n" + ir);
		}
		return module;
	}

	private static String runtime(List<Integer> inputs)
	{
		String values = inputs.isEmpty()
				? "zeroinitializer"
				: inputs.stream().map(v -> "i32 " + v).collect(Collectors.joining(", ", "[", "]"));
		return String.format(RUNTIME, inputs.size(), values);
	}
}
