package mmpls.parsetrees;

import mmpls.grammar.RuleDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a batch parse needs, as plain immutable data, handed to the worker once at start.
 */
public class ParseTreesPayload {

	private final Map<String, String> labelToFormula;
	private final List<RuleDescriptor> grammarRules;
	private final Map<String, String> kindToPrefix;

	public ParseTreesPayload(LinkedHashMap<String, String> labelToFormula, List<RuleDescriptor> grammarRules,
	                         Map<String, String> kindToPrefix) {
		this.labelToFormula = Collections.unmodifiableMap(new LinkedHashMap<>(labelToFormula));
		this.grammarRules = Collections.unmodifiableList(new ArrayList<>(grammarRules));
		this.kindToPrefix = Collections.unmodifiableMap(new LinkedHashMap<>(kindToPrefix));
	}

	/**
	 * @return label to formula text, iterating in statement order
	 */
	public Map<String, String> getLabelToFormula() {
		return labelToFormula;
	}

	public List<RuleDescriptor> getGrammarRules() {
		return grammarRules;
	}

	public Map<String, String> getKindToPrefix() {
		return kindToPrefix;
	}
}
