package mmpls.workingvars;

import mmpls.errors.IssueContext;
import mmpls.model.mmp.FormulaToParseTreeCache;
import mmpls.model.mmp.MmpProof;
import mmpls.model.parsetree.InternalNode;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replaces the working variables left in a complete proof with unused theory variables of the
 * same kind.
 *
 * A working variable for which the theory has no unused variable is not an error: each of its
 * occurrences is reported to the issue context as a {@link NoUnusedTheoryVarIssue} and the
 * variable stays in the proof, while the others are still replaced.
 *
 * Not safe for concurrent use on the same proof.
 */
public class WorkingVarReplacer {

	private static final Logger logger = Logger.getLogger(WorkingVarReplacer.class.getName());

	private final MmpProof proof;
	private final SubstitutionApplier applier;

	public WorkingVarReplacer(MmpProof proof) {
		this(proof, new WorkingVarsUnifierApplier());
	}

	public WorkingVarReplacer(MmpProof proof, SubstitutionApplier applier) {
		this.proof = proof;
		this.applier = applier;
	}

	/**
	 * Computes the substitution and reports the working variables that cannot be replaced,
	 * leaving the proof untouched. Used to decide whether a complete proof can be generated.
	 */
	public WorkingVarsUnifier addDiagnosticsForMissingUnusedVars(IssueContext ctx) {
		return buildUnifier(ctx);
	}

	/**
	 * Computes the substitution, reports the working variables that cannot be replaced and
	 * rewrites the proof with whatever could be substituted.
	 *
	 * @param formulaToParseTreeCache if not null, receives the rewritten formulas and their trees
	 */
	public WorkingVarsUnifier replaceWorkingVarsWithTheoryVars(FormulaToParseTreeCache formulaToParseTreeCache,
	                                                           IssueContext ctx) {
		WorkingVarsUnifier unifier = buildUnifier(ctx);
		if (!unifier.isEmpty()) {
			applier.apply(unifier, proof, formulaToParseTreeCache);
		}
		return unifier;
	}

	private WorkingVarsUnifier buildUnifier(IssueContext ctx) {
		Map<String, List<InternalNode>> workingVars = WorkingVarCollector.collect(proof);
		if (workingVars.isEmpty()) {
			return new WorkingVarsUnifier();
		}
		Set<String> usedVars = UsedTheoryVarsCollector.collect(proof);
		UnifierBuilder builder = new UnifierBuilder(proof.getWorkingVars(),
				new TheoryVarAllocator(proof.getOutermostScope()));
		WorkingVarsUnifier unifier = builder.build(workingVars, usedVars, ctx);
		if (logger.isLoggable(Level.FINE)) {
			logger.fine("working variables: " + workingVars.size() + " found, " + unifier.size() +
					" substituted, " + unifier.getUnresolved().size() + " unresolved");
		}
		return unifier;
	}
}
