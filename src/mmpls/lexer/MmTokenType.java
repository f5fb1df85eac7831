package mmpls.lexer;

public enum MmTokenType {
	// a math symbol declared with $c
	CONSTANT,
	// a variable declared with $v that has a floating hypothesis
	THEORY_VARIABLE,
	// a placeholder such as &W1, only found in proofs under construction
	WORKING_VARIABLE,
}
