package mmpls.model.mmp;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The working variables of a proof under construction.
 *
 * A working variable is written '&amp;' followed by the prefix configured for its kind and a
 * number of any length, e.g. &amp;W3 for a wff. Besides the kind to prefix configuration, an
 * instance records every working variable the lexer has met, in first-seen order. That record
 * only grows: a token never changes kind once recorded.
 *
 * Instances are not thread safe; every parsing session owns its own.
 */
public class WorkingVars {

	private final Map<String, String> prefixToKind;
	private final Map<String, String> recorded;

	public WorkingVars(Map<String, String> kindToPrefix) {
		this.prefixToKind = new HashMap<>();
		kindToPrefix.forEach((kind, prefix) -> prefixToKind.put(prefix, kind));
		this.recorded = new LinkedHashMap<>();
	}

	/**
	 * @return the kind of the given working variable, or null if symbol is not a working variable
	 */
	public String kindOf(String symbol) {
		if (symbol.length() < 3 || symbol.charAt(0) != '&') {
			return null;
		}
		int digitsStart = symbol.length();
		while (digitsStart > 1 && Character.isDigit(symbol.charAt(digitsStart - 1))) {
			digitsStart--;
		}
		if (digitsStart == symbol.length() || digitsStart == 1) {
			return null;
		}
		return prefixToKind.get(symbol.substring(1, digitsStart));
	}

	/**
	 * Records an occurrence of a working variable. Symbols that are not working variables are ignored.
	 */
	public void record(String symbol) {
		String kind = kindOf(symbol);
		if (kind == null || recorded.containsKey(symbol)) {
			return;
		}
		recorded.put(symbol, kind);
	}

	public Set<String> getRecordedWorkingVars() {
		return Collections.unmodifiableSet(recorded.keySet());
	}
}
