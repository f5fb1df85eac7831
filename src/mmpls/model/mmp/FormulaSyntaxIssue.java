package mmpls.model.mmp;

import mmpls.errors.Issue;
import mmpls.errors.IssueVisitor;
import mmpls.grammar.ParseFailure;

public class FormulaSyntaxIssue extends Issue {

	private final String stepLabel;
	private final ParseFailure failure;

	public FormulaSyntaxIssue(String stepLabel, ParseFailure failure) {
		this.stepLabel = stepLabel;
		this.failure = failure;
	}

	public String getStepLabel() {
		return stepLabel;
	}

	public ParseFailure getFailure() {
		return failure;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
