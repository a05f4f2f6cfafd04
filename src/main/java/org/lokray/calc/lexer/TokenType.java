package org.lokray.calc.lexer;

/**
 * Defines the types of tokens recognized by the calc Lexer.
 */
public enum TokenType
{
	// --- Special Tokens ---
	EOF, // End of input
	UNKNOWN, // Any character the language does not use

	// --- Literals ---
	IDENTIFIER,
	NUMBER,

	// --- Punctuation & Delimiters ---
	COMMA, COLON,
	LEFT_PAREN, RIGHT_PAREN,       // ( )

	// --- Operators ---
	PLUS, MINUS,                     // + -
	STAR, SLASH,                     // * /

	// --- Keywords ---
	WITH
}
