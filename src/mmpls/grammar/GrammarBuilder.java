package mmpls.grammar;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class GrammarBuilder {
	private GrammarBuilder() {}

	/**
	 * Builds a grammar from rule descriptors. Rules keep their relative order, which decides
	 * between derivations of an ambiguous formula.
	 *
	 * @throws IllegalArgumentException if a rule has an empty right hand side
	 */
	public static Grammar build(List<RuleDescriptor> descriptors) {
		List<RuleDescriptor> rules = new ArrayList<>(descriptors.size());
		Map<String, List<RuleDescriptor>> rulesByKind = new LinkedHashMap<>();
		Map<String, String> varToKind = new HashMap<>();
		for (RuleDescriptor rule : descriptors) {
			if (rule.getSymbols().isEmpty()) {
				throw new IllegalArgumentException("rule " + rule.getLabel() + " has an empty right hand side");
			}
			rules.add(rule);
			rulesByKind.computeIfAbsent(rule.getKind(), k -> new ArrayList<>()).add(rule);
			for (GrammarSymbol symbol : rule.getSymbols()) {
				if (symbol.getType() == GrammarSymbol.Type.VARIABLE) {
					varToKind.put(symbol.getValue(), rule.getKind());
				}
			}
		}
		return new Grammar(rules, rulesByKind, varToKind);
	}
}
