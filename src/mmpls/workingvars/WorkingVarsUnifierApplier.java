package mmpls.workingvars;

import mmpls.model.mmp.FormulaToParseTreeCache;
import mmpls.model.mmp.MmpProof;
import mmpls.model.mmp.MmpProofStep;
import mmpls.model.parsetree.InternalNode;
import mmpls.model.parsetree.LeafNode;
import mmpls.model.parsetree.ParseTree;
import mmpls.model.parsetree.ParseTreeLeavesVisitor;
import mmpls.model.parsetree.ParseTreeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces, in every step tree, the nodes of substituted working variables by their replacement,
 * and recomputes the formula of each step that changed. Trees are rebuilt, never modified.
 */
public class WorkingVarsUnifierApplier implements SubstitutionApplier {

	@Override
	public void apply(WorkingVarsUnifier unifier, MmpProof proof, FormulaToParseTreeCache formulaToParseTreeCache) {
		SubstitutingVisitor substituting = new SubstitutingVisitor(unifier);
		for (MmpProofStep step : proof.getSteps()) {
			InternalNode parseTree = step.getParseTree();
			if (parseTree == null) {
				continue;
			}
			InternalNode substituted = substituting.substitute(parseTree);
			if (substituted != parseTree) {
				step.setParseTree(substituted);
				step.setFormula(ParseTreeLeavesVisitor.formulaOf(substituted));
				if (formulaToParseTreeCache != null) {
					formulaToParseTreeCache.add(step.getFormula(), substituted);
				}
			}
		}
	}

	// returns the very same node when nothing below it is substituted
	private static final class SubstitutingVisitor extends ParseTreeVisitor<ParseTree, RuntimeException> {
		private final WorkingVarsUnifier unifier;

		SubstitutingVisitor(WorkingVarsUnifier unifier) {
			this.unifier = unifier;
		}

		@Override
		public ParseTree visit(InternalNode internalNode) {
			return substitute(internalNode);
		}

		InternalNode substitute(InternalNode internalNode) {
			LeafNode leaf = internalNode.getSingleLeaf();
			if (leaf != null && leaf.isWorkingVar()) {
				InternalNode replacement = unifier.get(leaf.getValue());
				return replacement != null ? replacement : internalNode;
			}
			boolean changed = false;
			List<ParseTree> children = new ArrayList<>(internalNode.getChildren().size());
			for (ParseTree child : internalNode.getChildren()) {
				ParseTree substituted = child.accept(this);
				changed |= substituted != child;
				children.add(substituted);
			}
			return changed ? new InternalNode(internalNode.getLabel(), internalNode.getKind(), children) : internalNode;
		}

		@Override
		public ParseTree visit(LeafNode leafNode) {
			return leafNode;
		}
	}
}
