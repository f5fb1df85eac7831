package mmpls.workingvars;

import mmpls.model.mmp.FormulaToParseTreeCache;
import mmpls.model.mmp.MmpProof;

/**
 * Rewrites the steps of a proof according to a substitution of its working variables.
 */
public interface SubstitutionApplier {

	/**
	 * @param formulaToParseTreeCache if not null, receives the rewritten formulas and their trees
	 */
	void apply(WorkingVarsUnifier unifier, MmpProof proof, FormulaToParseTreeCache formulaToParseTreeCache);

}
