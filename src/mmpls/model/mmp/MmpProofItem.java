package mmpls.model.mmp;

/**
 * Something the text of a proof is made of, a step or a comment, rendered back in the order it
 * was read.
 */
public interface MmpProofItem {

	String toText();

	/**
	 * @return this item as a step, or null if it is not one
	 */
	MmpProofStep getStepOrNull();
}
