package mmpls.model.mm;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The outermost scope of a theory: its variables, in declaration order, and the floating
 * hypothesis giving each one its kind.
 */
public class TheoryScope {

	private final Set<String> variables = new LinkedHashSet<>();
	private final Map<String, LabeledStatement> varToFloatingHyp = new HashMap<>();

	void declareVariable(String var) {
		variables.add(var);
	}

	void addFloatingHypothesis(String var, LabeledStatement floatingHyp) {
		varToFloatingHyp.put(var, floatingHyp);
	}

	public Set<String> getVariables() {
		return Collections.unmodifiableSet(variables);
	}

	public boolean isVariable(String symbol) {
		return variables.contains(symbol);
	}

	/**
	 * @return the kind of the given variable, null if it has no floating hypothesis in this scope
	 */
	public String kindOf(String var) {
		LabeledStatement floatingHyp = varToFloatingHyp.get(var);
		return floatingHyp == null ? null : floatingHyp.getTypecode();
	}

	public LabeledStatement getFloatingHypothesis(String var) {
		return varToFloatingHyp.get(var);
	}
}
