package mmpls.parsetrees;

import mmpls.model.parsetree.InternalNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Formula text to parse tree, for the duration of one batch. Many statements share the same
 * hypotheses, so a theory has far fewer distinct formulas than statements. Only formulas that
 * parse are stored.
 */
public class ParseTreeCache {

	private final Map<String, InternalNode> formulaToParseTree = new HashMap<>();

	public InternalNode get(String formula) {
		return formulaToParseTree.get(formula);
	}

	public void put(String formula, InternalNode parseTree) {
		formulaToParseTree.put(formula, parseTree);
	}

	public int size() {
		return formulaToParseTree.size();
	}
}
