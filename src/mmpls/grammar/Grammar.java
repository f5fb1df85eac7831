package mmpls.grammar;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An executable grammar: rules indexed by the kind they produce, and the variable vocabulary the
 * lexer needs. Built by {@link GrammarBuilder}; never shared between threads.
 *
 * Every formula is parsed from {@link #START_KIND}, whose rules read a typecode followed by an
 * expression, e.g. "|- ( ph -> ps )".
 */
public class Grammar {

	public static final String START_KIND = "$start";

	private final List<RuleDescriptor> rules;
	private final Map<String, List<RuleDescriptor>> rulesByKind;
	private final Map<String, String> varToKind;

	Grammar(List<RuleDescriptor> rules, Map<String, List<RuleDescriptor>> rulesByKind,
	        Map<String, String> varToKind) {
		this.rules = Collections.unmodifiableList(rules);
		this.rulesByKind = Collections.unmodifiableMap(rulesByKind);
		this.varToKind = Collections.unmodifiableMap(varToKind);
	}

	public List<RuleDescriptor> getRules() {
		return rules;
	}

	public List<RuleDescriptor> getRulesForKind(String kind) {
		return rulesByKind.getOrDefault(kind, Collections.emptyList());
	}

	public Map<String, String> getVarToKind() {
		return varToKind;
	}
}
