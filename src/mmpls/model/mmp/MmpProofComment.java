package mmpls.model.mmp;

/**
 * A comment of a proof: a line starting with '*' and the indented lines continuing it, kept as
 * written.
 */
public class MmpProofComment implements MmpProofItem {

	private final String text;

	public MmpProofComment(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	// a blank line separates a comment from what follows
	@Override
	public String toText() {
		return text + "\n";
	}

	@Override
	public MmpProofStep getStepOrNull() {
		return null;
	}

	@Override
	public String toString() {
		return text;
	}
}
