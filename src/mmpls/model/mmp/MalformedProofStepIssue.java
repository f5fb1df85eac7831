package mmpls.model.mmp;

import mmpls.errors.Issue;
import mmpls.errors.IssueVisitor;
import mmpls.util.SourceLocation;

public class MalformedProofStepIssue extends Issue {

	private final String stepText;
	private final SourceLocation location;

	public MalformedProofStepIssue(String stepText, SourceLocation location) {
		this.stepText = stepText;
		this.location = location;
	}

	public String getStepText() {
		return stepText;
	}

	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
