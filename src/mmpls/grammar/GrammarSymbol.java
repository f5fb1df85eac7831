package mmpls.grammar;

import java.io.Serializable;
import java.util.Objects;

/**
 * One symbol of the right hand side of a grammar rule.
 */
public final class GrammarSymbol implements Serializable {
	private static final long serialVersionUID = -3102734160377145311L;

	public enum Type {
		// a constant math symbol, matched by value
		CONSTANT,
		// a theory variable, matched by value; only found in the rules of floating hypotheses
		VARIABLE,
		// any subexpression of the given kind
		KIND,
		// any working variable of the given kind
		WORKING_VAR,
	}

	private final Type type;
	private final String value;

	private GrammarSymbol(Type type, String value) {
		this.type = type;
		this.value = value;
	}

	public static GrammarSymbol constant(String symbol) {
		return new GrammarSymbol(Type.CONSTANT, symbol);
	}

	public static GrammarSymbol variable(String var) {
		return new GrammarSymbol(Type.VARIABLE, var);
	}

	public static GrammarSymbol kind(String kind) {
		return new GrammarSymbol(Type.KIND, kind);
	}

	public static GrammarSymbol workingVar(String kind) {
		return new GrammarSymbol(Type.WORKING_VAR, kind);
	}

	public Type getType() {
		return type;
	}

	/**
	 * @return the math symbol for constants and variables, the kind otherwise
	 */
	public String getValue() {
		return value;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		GrammarSymbol other = (GrammarSymbol) obj;
		return type == other.type && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value);
	}

	@Override
	public String toString() {
		switch (type) {
			case CONSTANT:
			case VARIABLE:
				return "\"" + value + "\"";
			case KIND:
				return value;
			case WORKING_VAR:
				return "&" + value;
			default:
				throw new IllegalStateException("unknown symbol type " + type);
		}
	}
}
