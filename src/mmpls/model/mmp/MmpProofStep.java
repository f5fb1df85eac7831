package mmpls.model.mmp;

import mmpls.model.parsetree.InternalNode;
import mmpls.util.SourceLocatable;
import mmpls.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A step of a proof under construction, e.g. {@code 5:1,2:ax-mp |- &W3}: its label, the steps it
 * is derived from, the label of the assertion justifying it, and its formula.
 *
 * The parse tree is absent while the formula is empty or does not parse. Substituting working
 * variables replaces both the formula and the tree.
 */
public class MmpProofStep extends SourceLocatable implements MmpProofItem {

	private final String label;
	private final List<String> hypRefs;
	private final String ref;
	private final SourceLocation location;
	private String formula;
	private InternalNode parseTree;

	public MmpProofStep(String label, List<String> hypRefs, String ref, String formula, SourceLocation location) {
		this.label = label;
		this.hypRefs = Collections.unmodifiableList(new ArrayList<>(hypRefs));
		this.ref = ref;
		this.formula = formula;
		this.location = location;
	}

	public String getLabel() {
		return label;
	}

	public List<String> getHypRefs() {
		return hypRefs;
	}

	public String getRef() {
		return ref;
	}

	/**
	 * @return the formula with its symbols joined by single spaces
	 */
	public String getFormula() {
		return formula;
	}

	public void setFormula(String formula) {
		this.formula = formula;
	}

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
	public String toText() {
		String text = label + ":" + String.join(",", hypRefs) + ":" + ref;
		return formula.isEmpty() ? text : text + " " + formula;
	}

	@Override
	public MmpProofStep getStepOrNull() {
		return this;
	}

	@Override
	public String toString() {
		return toText();
	}
}
