package org.lokray.calc.codegen;

/**
 * Raised when the code generator is handed a tree it must not lower: one that
 * never passed semantic analysis, or one whose IR fails LLVM verification.
 * This is a broken caller contract, not a user error.
 */
public class CodeGenException extends RuntimeException
{
	public CodeGenException(String message)
	{
		super(message);
	}

	public CodeGenException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
