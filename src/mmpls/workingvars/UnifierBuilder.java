package mmpls.workingvars;

import mmpls.errors.IssueContext;
import mmpls.model.mmp.WorkingVars;
import mmpls.model.parsetree.InternalNode;
import mmpls.model.parsetree.LeafNode;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pairs working variables with unused theory variables of the same kind.
 *
 * Working variables are served in the order given; each one takes the first theory variable of
 * its kind not in the used set, and that variable joins the used set. A working variable that
 * finds none gets a {@link NoUnusedTheoryVarIssue} for each of its occurrences and stays
 * unresolved, while the following ones are still served.
 */
public class UnifierBuilder {

	private final WorkingVars workingVars;
	private final TheoryVarAllocator allocator;

	public UnifierBuilder(WorkingVars workingVars, TheoryVarAllocator allocator) {
		this.workingVars = workingVars;
		this.allocator = allocator;
	}

	/**
	 * @param usedVars the theory variables that may not be used; updated with the ones allocated
	 */
	public WorkingVarsUnifier build(Map<String, List<InternalNode>> workingVarToOccurrences, Set<String> usedVars,
	                                IssueContext ctx) {
		WorkingVarsUnifier unifier = new WorkingVarsUnifier();
		workingVarToOccurrences.forEach((workingVar, occurrences) -> {
			String kind = kindOf(workingVar, occurrences);
			String unusedVar = allocator.findUnusedVar(kind, usedVars);
			InternalNode replacement = unusedVar == null ? null : allocator.createReplacementNode(unusedVar, kind);
			if (replacement == null) {
				unifier.markUnresolved(workingVar);
				for (InternalNode occurrence : occurrences) {
					ctx.error(new NoUnusedTheoryVarIssue(workingVar, kind, occurrence.getSingleLeaf().getLocation()));
				}
			} else {
				unifier.substitute(workingVar, replacement);
				usedVars.add(unusedVar);
			}
		});
		return unifier;
	}

	private String kindOf(String workingVar, List<InternalNode> occurrences) {
		String kind = workingVars.kindOf(workingVar);
		if (kind != null) {
			return kind;
		}
		// a tree lexed with another configuration still knows the kind of its leaves
		LeafNode leaf = occurrences.get(0).getSingleLeaf();
		return leaf.getKind();
	}
}
