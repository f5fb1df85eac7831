package mmpls.model.mmp;

import mmpls.model.parsetree.InternalNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Parse trees of the formulas met while editing proofs, keyed by formula text with symbols
 * separated by single spaces. Owned by the editing session; not thread safe.
 */
public class FormulaToParseTreeCache {

	private final Map<String, InternalNode> formulaToParseTree = new HashMap<>();

	public void add(String formula, InternalNode parseTree) {
		formulaToParseTree.put(formula, parseTree);
	}

	public InternalNode get(String formula) {
		return formulaToParseTree.get(formula);
	}

	public boolean contains(String formula) {
		return formulaToParseTree.containsKey(formula);
	}

	public int size() {
		return formulaToParseTree.size();
	}
}
