package mmpls.formatters;

/**
 * Message texts shared by the issue formatter and the LSP diagnostics.
 */
public final class MessageFormats {

	private MessageFormats() {}

	public static String noUnusedTheoryVar(String kind) {
		return "No unused variable of kind " + kind + " found in the theory";
	}

	public static String formulaSyntax(String describedFailure) {
		return "Syntax error: " + describedFailure;
	}

	public static String malformedProofStep() {
		return "Malformed proof step: expected <label>:<hypotheses>:<reference> <formula>";
	}
}
