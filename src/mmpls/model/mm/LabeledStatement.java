package mmpls.model.mm;

import mmpls.model.parsetree.InternalNode;
import mmpls.util.SourceLocatable;
import mmpls.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statement of the theory addressed by its label. The formula includes the leading typecode.
 *
 * The parse tree is filled in once, when the theory's formulas are parsed, and replaced as a
 * whole if they are parsed again.
 */
public class LabeledStatement extends SourceLocatable {

	private final String label;
	private final StatementType type;
	private final List<String> formula;
	private final SourceLocation location;
	private volatile InternalNode parseTree;

	public LabeledStatement(String label, StatementType type, List<String> formula, SourceLocation location) {
		this.label = label;
		this.type = type;
		this.formula = Collections.unmodifiableList(new ArrayList<>(formula));
		this.location = location;
	}

	public String getLabel() {
		return label;
	}

	public StatementType getType() {
		return type;
	}

	public String getTypecode() {
		return formula.get(0);
	}

	public List<String> getFormula() {
		return formula;
	}

	/**
	 * @return the formula with its symbols joined by single spaces
	 */
	public String getFormulaText() {
		return String.join(" ", formula);
	}

	/**
	 * @return the parse tree of the formula, null if not parsed yet or if it does not parse
	 */
	public InternalNode getParseTree() {
		return parseTree;
	}

	public void setParseTree(InternalNode parseTree) {
		this.parseTree = parseTree;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public String toString() {
		return label + " " + type.getKeyword() + " " + getFormulaText() + " $.";
	}
}
