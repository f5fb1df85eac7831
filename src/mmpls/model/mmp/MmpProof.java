package mmpls.model.mmp;

import mmpls.model.mm.TheoryScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A proof being edited: its steps and comments in order, the theory scope it lives in and the
 * registry of its working variables.
 *
 * Not thread safe; callers serialize access to a proof.
 */
public class MmpProof {

	private final String theoremLabel;
	private final List<MmpProofItem> items;
	private final List<MmpProofStep> steps;
	private final TheoryScope outermostScope;
	private final WorkingVars workingVars;

	public MmpProof(String theoremLabel, List<? extends MmpProofItem> items, TheoryScope outermostScope,
	                WorkingVars workingVars) {
		this.theoremLabel = theoremLabel;
		this.items = Collections.unmodifiableList(new ArrayList<>(items));
		List<MmpProofStep> steps = new ArrayList<>();
		for (MmpProofItem item : items) {
			MmpProofStep step = item.getStepOrNull();
			if (step != null) {
				steps.add(step);
			}
		}
		this.steps = Collections.unmodifiableList(steps);
		this.outermostScope = outermostScope;
		this.workingVars = workingVars;
	}

	public String getTheoremLabel() {
		return theoremLabel;
	}

	public List<MmpProofItem> getItems() {
		return items;
	}

	public List<MmpProofStep> getSteps() {
		return steps;
	}

	public MmpProofStep getStep(String label) {
		for (MmpProofStep step : steps) {
			if (step.getLabel().equals(label)) {
				return step;
			}
		}
		return null;
	}

	public TheoryScope getOutermostScope() {
		return outermostScope;
	}

	public WorkingVars getWorkingVars() {
		return workingVars;
	}

	public String toText() {
		StringBuilder sb = new StringBuilder();
		if (theoremLabel != null) {
			sb.append("$theorem ").append(theoremLabel).append("\n\n");
		}
		for (MmpProofItem item : items) {
			sb.append(item.toText()).append('\n');
		}
		return sb.toString();
	}
}
