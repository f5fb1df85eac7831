package mmpls.workingvars;

import mmpls.model.mmp.MmpProof;
import mmpls.model.mmp.MmpProofStep;
import mmpls.model.parsetree.InternalNode;
import mmpls.model.parsetree.LeafNode;
import mmpls.model.parsetree.ParseTree;
import mmpls.model.parsetree.ParseTreeVisitor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds every occurrence of every working variable in the parse trees of a proof. Working
 * variables come out in the order they are first met, steps in proof order and each tree left to
 * right; that order decides which working variable gets a theory variable first.
 */
public class WorkingVarCollector extends ParseTreeVisitor<Void, RuntimeException> {

	private final Map<String, List<InternalNode>> workingVarToOccurrences = new LinkedHashMap<>();

	/**
	 * @return each working variable with the nodes (one per occurrence) it appears as
	 */
	public static Map<String, List<InternalNode>> collect(MmpProof proof) {
		WorkingVarCollector collector = new WorkingVarCollector();
		for (MmpProofStep step : proof.getSteps()) {
			if (step.getParseTree() != null) {
				step.getParseTree().accept(collector);
			}
		}
		return collector.workingVarToOccurrences;
	}

	@Override
	public Void visit(InternalNode internalNode) {
		LeafNode leaf = internalNode.getSingleLeaf();
		if (leaf != null && leaf.isWorkingVar()) {
			workingVarToOccurrences.computeIfAbsent(leaf.getValue(), k -> new ArrayList<>()).add(internalNode);
			return null;
		}
		for (ParseTree child : internalNode.getChildren()) {
			child.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(LeafNode leafNode) {
		return null;
	}
}
