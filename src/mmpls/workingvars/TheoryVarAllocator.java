package mmpls.workingvars;

import mmpls.model.mm.LabeledStatement;
import mmpls.model.mm.TheoryScope;
import mmpls.model.parsetree.InternalNode;
import mmpls.model.parsetree.ParseTreeBuilder;

import java.util.Set;

public class TheoryVarAllocator {

	private final TheoryScope scope;

	public TheoryVarAllocator(TheoryScope scope) {
		this.scope = scope;
	}

	/**
	 * @return the first variable of the theory, in declaration order, of the given kind and not
	 * in usedVars; null if there is none
	 */
	public String findUnusedVar(String kind, Set<String> usedVars) {
		for (String var : scope.getVariables()) {
			if (kind.equals(scope.kindOf(var)) && !usedVars.contains(var)) {
				return var;
			}
		}
		return null;
	}

	/**
	 * @return the node the floating hypothesis of var builds, null if var has none
	 */
	public InternalNode createReplacementNode(String var, String kind) {
		LabeledStatement floatingHyp = scope.getFloatingHypothesis(var);
		if (floatingHyp == null) {
			return null;
		}
		return ParseTreeBuilder.varNode(floatingHyp.getLabel(), var, kind);
	}
}
