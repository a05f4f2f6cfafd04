package org.lokray.calc.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.*;
import org.lokray.calc.ast.ASTNode;
import org.lokray.calc.ast.ASTVisitor;
import org.lokray.calc.ast.BinaryOp;
import org.lokray.calc.ast.Expression;
import org.lokray.calc.ast.Factor;
import org.lokray.calc.ast.WithDecl;
import org.lokray.calc.lexer.Token;
import org.lokray.calc.util.CompilerConfig;
import org.lokray.calc.util.Debug;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Lowers a validated calc AST to an LLVM module with a single
 * {@code i32 main(i32, ptr)} function.
 * <p>
 * Declared variables are read through the external read function, in
 * declaration order, before the expression is evaluated. The final value is
 * handed to the external write function and main returns 0. Arithmetic is
 * 32-bit signed: {@code add}/{@code sub}/{@code mul} carry the {@code nsw}
 * flag, division is {@code sdiv}; neither overflow nor division by zero is
 * checked.
 * <p>
 * Precondition: the tree passed semantic analysis. Anything else ends in a
 * {@link CodeGenException}.
 */
public class LLVMIRGenerator implements ASTVisitor<LLVMValueRef>
{
	private final CompilerConfig config;

	private LLVMContextRef context;
	private LLVMModuleRef module;
	private LLVMBuilderRef builder;
	private LLVMTypeRef int32Type;

	// --- Runtime functions (defined outside the module) ---
	private LLVMTypeRef readFuncType;
	private LLVMValueRef readFunc;
	private LLVMTypeRef writeFuncType;
	private LLVMValueRef writeFunc;

	// Values are bound once, when read; there is no reassignment, so no allocas.
	private final Map<String, LLVMValueRef> namedValues = new HashMap<>();

	public LLVMIRGenerator(CompilerConfig config)
	{
		this.config = config;
	}

	/**
	 * Generates the module and returns it as LLVM IR text.
	 *
	 * @param root A tree that passed semantic analysis.
	 * @return The textual IR of the module.
	 */
	public String generate(ASTNode root)
	{
		createModule();
		try
		{
			emitMain(root);
			BytePointer irString = LLVMPrintModuleToString(module);
			String ir = irString.getString();
			LLVMDisposeMessage(irString);
			return ir;
		}
		finally
		{
			disposeModule();
		}
	}

	private void createModule()
	{
		Debug.log("Starting LLVM IR Generation...");
		Debug.indent();

		context = LLVMContextCreate();
		module = LLVMModuleCreateWithNameInContext(config.getModuleName(), context);
		builder = LLVMCreateBuilderInContext(context);
		int32Type = LLVMInt32TypeInContext(context);
		namedValues.clear();

		if (config.isHostTarget())
		{
			applyHostTarget();
		}
		declareExternalFunctions();
	}

	private void applyHostTarget()
	{
		Debug.log("Initializing LLVM target components...");
		LLVMInitializeAllTargetInfos();
		LLVMInitializeAllTargets();
		LLVMInitializeAllTargetMCs();

		BytePointer error = new BytePointer((Pointer) null);
		BytePointer triple = LLVMGetDefaultTargetTriple();
		LLVMTargetRef target = new LLVMTargetRef();
		try
		{
			if (LLVMGetTargetFromTriple(triple, target, error) != 0)
			{
				throw new CodeGenException("Error getting target from triple '" + triple.getString() + "': " + error.getString());
			}

			LLVMTargetMachineRef targetMachine = LLVMCreateTargetMachine(target, triple.getString(), "", "", LLVMCodeGenLevelDefault, LLVMRelocDefault, LLVMCodeModelDefault);
			LLVMTargetDataRef targetData = LLVMCreateTargetDataLayout(targetMachine);
			LLVMSetModuleDataLayout(module, targetData);
			LLVMSetTarget(module, triple);
			Debug.log("Target triple: %s", triple.getString());

			LLVMDisposeTargetData(targetData);
			LLVMDisposeTargetMachine(targetMachine);
		}
		finally
		{
			LLVMDisposeMessage(error);
			LLVMDisposeMessage(triple);
		}
	}

	private void declareExternalFunctions()
	{
		Debug.log("Declaring runtime functions...");
		LLVMTypeRef ptrType = LLVMPointerType(LLVMInt8TypeInContext(context), 0);

		// i32 @calc_read(ptr)
		readFuncType = LLVMFunctionType(int32Type, ptrType, 1, 0);
		readFunc = LLVMAddFunction(module, config.getReadFunctionName(), readFuncType);

		// void @calc_write(i32)
		writeFuncType = LLVMFunctionType(LLVMVoidTypeInContext(context), int32Type, 1, 0);
		writeFunc = LLVMAddFunction(module, config.getWriteFunctionName(), writeFuncType);
	}

	private void emitMain(ASTNode root)
	{
		// i32 @main(i32, ptr), the host's standard entry point
		LLVMTypeRef ptrType = LLVMPointerType(LLVMInt8TypeInContext(context), 0);
		PointerPointer<LLVMTypeRef> mainParamTypes = new PointerPointer<>(int32Type, ptrType);
		LLVMTypeRef mainFuncType = LLVMFunctionType(int32Type, mainParamTypes, 2, 0);
		LLVMValueRef mainFunc = LLVMAddFunction(module, "main", mainFuncType);
		LLVMBasicBlockRef entryBlock = LLVMAppendBasicBlockInContext(context, mainFunc, "entry");
		LLVMPositionBuilderAtEnd(builder, entryBlock);

		Debug.log("Lowering %s", root);
		LLVMValueRef result = root.accept(this);

		PointerPointer<LLVMValueRef> writeArgs = new PointerPointer<>(1);
		writeArgs.put(0, result);
		LLVMBuildCall2(builder, writeFuncType, writeFunc, writeArgs, 1, "");
		LLVMBuildRet(builder, LLVMConstInt(int32Type, 0, 0));

		verifyModule();
	}

	private void verifyModule()
	{
		BytePointer verificationError = new BytePointer((Pointer) null);
		try
		{
			if (LLVMVerifyModule(module, LLVMReturnStatusAction, verificationError) != 0)
			{
				throw new CodeGenException("LLVM Verify Error: " + verificationError.getString());
			}
			Debug.log("LLVM Module verification PASSED.");
		}
		finally
		{
			LLVMDisposeMessage(verificationError);
		}
	}

	private void disposeModule()
	{
		Debug.log("Disposing LLVM resources...");
		namedValues.clear();
		if (builder != null)
		{
			LLVMDisposeBuilder(builder);
		}
		if (module != null)
		{
			LLVMDisposeModule(module);
		}
		if (context != null)
		{
			LLVMContextDispose(context);
		}
		builder = null;
		module = null;
		context = null;
		Debug.dedent();
		Debug.log("LLVM IR Generation Finished.");
	}

	@Override
	public LLVMValueRef visitWithDecl(WithDecl withDecl)
	{
		for (Token variable : withDecl.getVariables())
		{
			String name = variable.getLexeme();
			if (namedValues.containsKey(name))
			{
				throw new CodeGenException("Variable " + name + " declared twice; the tree was not validated.");
			}

			Debug.log("Reading variable %s", name);
			LLVMValueRef nameString = LLVMBuildGlobalStringPtr(builder, name, name + ".str");
			PointerPointer<LLVMValueRef> readArgs = new PointerPointer<>(1);
			readArgs.put(0, nameString);
			LLVMValueRef value = LLVMBuildCall2(builder, readFuncType, readFunc, readArgs, 1, name);
			namedValues.put(name, value);
		}

		Expression body = withDecl.getBody()
				.orElseThrow(() -> new CodeGenException("Declaration has no expression; the tree was not validated."));
		return body.accept(this);
	}

	@Override
	public LLVMValueRef visitFactor(Factor factor)
	{
		if (factor.getKind() == Factor.Kind.IDENTIFIER)
		{
			LLVMValueRef value = namedValues.get(factor.getValue());
			if (value == null)
			{
				throw new CodeGenException("Variable " + factor.getValue() + " not declared; the tree was not validated.");
			}
			return value;
		}

		// Out-of-range literals keep their low 32 bits.
		int value = new BigInteger(factor.getValue()).intValue();
		return LLVMConstInt(int32Type, value, 1);
	}

	/**
	 * Lowers an operator tree in post order with explicit stacks, left operand
	 * first. Chains like {@code 1+1+...+1} are as deep as the input is long.
	 */
	@Override
	public LLVMValueRef visitBinaryOp(BinaryOp binaryOp)
	{
		Deque<Step> work = new ArrayDeque<>();
		Deque<LLVMValueRef> values = new ArrayDeque<>();
		work.push(new Step(binaryOp, false));

		while (!work.isEmpty())
		{
			Step step = work.pop();
			if (!(step.expression instanceof BinaryOp))
			{
				values.push(step.expression.accept(this));
				continue;
			}

			BinaryOp op = (BinaryOp) step.expression;
			if (step.operandsDone)
			{
				LLVMValueRef right = values.pop();
				LLVMValueRef left = values.pop();
				values.push(buildOperation(op.getOperator(), left, right));
				continue;
			}

			Expression leftOperand = op.getLeft()
					.orElseThrow(() -> new CodeGenException("Missing left operand for '" + op.getOperator().getSymbol() + "'; the tree was not validated."));
			Expression rightOperand = op.getRight()
					.orElseThrow(() -> new CodeGenException("Missing right operand for '" + op.getOperator().getSymbol() + "'; the tree was not validated."));
			work.push(new Step(op, true));
			work.push(new Step(rightOperand, false));
			work.push(new Step(leftOperand, false));
		}
		return values.pop();
	}

	private LLVMValueRef buildOperation(BinaryOp.Operator operator, LLVMValueRef left, LLVMValueRef right)
	{
		switch (operator)
		{
			case PLUS:
				return LLVMBuildNSWAdd(builder, left, right, "addtmp");
			case MINUS:
				return LLVMBuildNSWSub(builder, left, right, "subtmp");
			case MUL:
				return LLVMBuildNSWMul(builder, left, right, "multmp");
			case DIV:
				return LLVMBuildSDiv(builder, left, right, "sdivtmp");
			default:
				throw new CodeGenException("Unhandled operator " + operator);
		}
	}

	private static final class Step
	{
		final Expression expression;
		final boolean operandsDone; // Both operands are already on the value stack

		Step(Expression expression, boolean operandsDone)
		{
			this.expression = expression;
			this.operandsDone = operandsDone;
		}
	}
}
