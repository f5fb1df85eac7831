package mmpls.diagnostics;

/**
 * Codes attached to the warnings the server reports on a proof.
 */
public enum MmpWarningCode {
	proofCompleteButWorkingVarsRemainAndNoUnusedTheoryVars,
	formulaSyntaxError,
	malformedProofStep,
}
