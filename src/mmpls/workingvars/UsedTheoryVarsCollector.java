package mmpls.workingvars;

import mmpls.model.mm.TheoryScope;
import mmpls.model.mmp.MmpProof;
import mmpls.model.mmp.MmpProofStep;
import mmpls.model.parsetree.InternalNode;
import mmpls.model.parsetree.LeafNode;
import mmpls.model.parsetree.ParseTree;
import mmpls.model.parsetree.ParseTreeVisitor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the theory variables of the outermost scope that appear anywhere in a proof, whether
 * or not the proof needs them. None of them may replace a working variable.
 */
public class UsedTheoryVarsCollector extends ParseTreeVisitor<Void, RuntimeException> {

	private final TheoryScope scope;
	private final Set<String> usedVars = new LinkedHashSet<>();

	private UsedTheoryVarsCollector(TheoryScope scope) {
		this.scope = scope;
	}

	public static Set<String> collect(MmpProof proof) {
		UsedTheoryVarsCollector collector = new UsedTheoryVarsCollector(proof.getOutermostScope());
		for (MmpProofStep step : proof.getSteps()) {
			if (step.getParseTree() != null) {
				step.getParseTree().accept(collector);
			}
		}
		return collector.usedVars;
	}

	@Override
	public Void visit(InternalNode internalNode) {
		for (ParseTree child : internalNode.getChildren()) {
			child.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(LeafNode leafNode) {
		if (scope.isVariable(leafNode.getValue())) {
			usedVars.add(leafNode.getValue());
		}
		return null;
	}
}
