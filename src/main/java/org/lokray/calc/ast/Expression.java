package org.lokray.calc.ast;

/**
 * Base interface for all expression nodes. Expressions produce a 32-bit signed value.
 */
public sealed interface Expression extends ASTNode permits Factor, BinaryOp
{
}
