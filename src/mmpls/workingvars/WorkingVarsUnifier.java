package mmpls.workingvars;

import mmpls.model.parsetree.InternalNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The substitution computed for the working variables of a proof: working variable to the node of
 * the theory variable replacing it. No theory variable replaces two working variables. Working
 * variables left without a replacement are listed as unresolved.
 */
public class WorkingVarsUnifier {

	private final Map<String, InternalNode> substitution = new LinkedHashMap<>();
	private final Set<String> unresolved = new LinkedHashSet<>();

	void substitute(String workingVar, InternalNode replacement) {
		substitution.put(workingVar, replacement);
	}

	void markUnresolved(String workingVar) {
		unresolved.add(workingVar);
	}

	public Map<String, InternalNode> getSubstitution() {
		return Collections.unmodifiableMap(substitution);
	}

	public InternalNode get(String workingVar) {
		return substitution.get(workingVar);
	}

	public Set<String> getUnresolved() {
		return Collections.unmodifiableSet(unresolved);
	}

	public int size() {
		return substitution.size();
	}

	public boolean isEmpty() {
		return substitution.isEmpty();
	}

	public ReplacementOutcome getOutcome() {
		if (!unresolved.isEmpty()) {
			return ReplacementOutcome.PARTIALLY_RESOLVED;
		}
		return substitution.isEmpty() ? ReplacementOutcome.EMPTY : ReplacementOutcome.RESOLVED;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		substitution.forEach((workingVar, replacement) -> {
			if (sb.length() > 1) {
				sb.append(", ");
			}
			sb.append(workingVar).append(" -> ").append(replacement.getSingleLeaf().getValue());
		});
		return sb.append("}").toString();
	}
}
