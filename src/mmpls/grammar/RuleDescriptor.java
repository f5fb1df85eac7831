package mmpls.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A grammar rule as plain data: the label of the statement that defines it, the kind it
 * produces and its right hand side. Descriptors are what travels to a parsing worker; each side
 * builds its own {@link Grammar} from them.
 */
public final class RuleDescriptor implements Serializable {
	private static final long serialVersionUID = 6720553939716216342L;

	private final String label;
	private final String kind;
	private final List<GrammarSymbol> symbols;

	public RuleDescriptor(String label, String kind, List<GrammarSymbol> symbols) {
		this.label = label;
		this.kind = kind;
		this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
	}

	public String getLabel() {
		return label;
	}

	public String getKind() {
		return kind;
	}

	public List<GrammarSymbol> getSymbols() {
		return symbols;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		RuleDescriptor other = (RuleDescriptor) obj;
		return label.equals(other.label) && kind.equals(other.kind) && symbols.equals(other.symbols);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, kind, symbols);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(label).append(": ").append(kind).append(" ->");
		for (GrammarSymbol symbol : symbols) {
			sb.append(' ').append(symbol);
		}
		return sb.toString();
	}
}
