package mmpls.errors;

/**
 * Accumulates the recoverable problems found while analysing a theory or a proof. Nothing
 * reported here ever interrupts the analysis.
 */
public abstract class IssueContext {

	public abstract void error(Issue err);

	public abstract boolean hasErrors();

}
