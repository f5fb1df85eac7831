package mmpls.parsetrees;

import mmpls.grammar.FormulaParser;
import mmpls.grammar.GrammarBuilder;
import mmpls.model.mmp.WorkingVars;
import mmpls.model.parsetree.InternalNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses every formula of a payload with a grammar built from its rules, reusing the tree of a
 * formula already parsed in the same batch. Runs on whichever thread calls it.
 */
public class ParseTreesBatch {
	private ParseTreesBatch() {}

	/**
	 * Reports {@link MessageProgress} before each formula, then two {@link MessageLog}s with the
	 * number of trees and the number of distinct formulas cached.
	 *
	 * @return label to parse tree, in payload order, for the formulas that parse; the others are left out
	 */
	public static LinkedHashMap<String, InternalNode> createLabelToParseTreeMap(
			ParseTreesPayload payload, ProgressCallback progressCallback) {
		LinkedHashMap<String, InternalNode> labelToParseTree = new LinkedHashMap<>();
		WorkingVars workingVars = new WorkingVars(payload.getKindToPrefix());
		FormulaParser parser = new FormulaParser(GrammarBuilder.build(payload.getGrammarRules()), workingVars);
		ParseTreeCache cache = new ParseTreeCache();
		Map<String, String> labelToFormula = payload.getLabelToFormula();
		int i = 0;
		for (Map.Entry<String, String> entry : labelToFormula.entrySet()) {
			progressCallback.report(new MessageProgress(i++, labelToFormula.size()));
			InternalNode parseTree = getParseTree(entry.getValue(), parser, cache);
			if (parseTree != null) {
				labelToParseTree.put(entry.getKey(), parseTree);
			}
		}

		progressCallback.report(new MessageLog("labelToParseTreeMap.size = " + labelToParseTree.size()));
		progressCallback.report(new MessageLog("formulaToParseTreeCache.size = " + cache.size()));

		return labelToParseTree;
	}

	static InternalNode getParseTree(String formula, FormulaParser parser, ParseTreeCache cache) {
		InternalNode parseTree = cache.get(formula);
		if (parseTree == null) {
			parseTree = parser.parse(formula).getSuccessOrNull();
			if (parseTree != null) {
				cache.put(formula, parseTree);
			}
		}
		return parseTree;
	}
}
