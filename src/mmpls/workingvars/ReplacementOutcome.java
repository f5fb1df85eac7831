package mmpls.workingvars;

public enum ReplacementOutcome {
	// the proof has no working variable
	EMPTY,
	// every working variable has a replacement
	RESOLVED,
	// some working variables have no replacement and stay in the proof
	PARTIALLY_RESOLVED,
}
