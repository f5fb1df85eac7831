package mmpls.errors;

import mmpls.model.mmp.FormulaSyntaxIssue;
import mmpls.model.mmp.MalformedProofStepIssue;
import mmpls.workingvars.NoUnusedTheoryVarIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(NoUnusedTheoryVarIssue noUnusedTheoryVarIssue) throws E;
	public abstract T visit(FormulaSyntaxIssue formulaSyntaxIssue) throws E;
	public abstract T visit(MalformedProofStepIssue malformedProofStepIssue) throws E;
}
