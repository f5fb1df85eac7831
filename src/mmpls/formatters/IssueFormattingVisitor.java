package mmpls.formatters;

import mmpls.errors.IssueVisitor;
import mmpls.model.mmp.FormulaSyntaxIssue;
import mmpls.model.mmp.MalformedProofStepIssue;
import mmpls.workingvars.NoUnusedTheoryVarIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(NoUnusedTheoryVarIssue noUnusedTheoryVarIssue) throws IOException {
		out.write(MessageFormats.noUnusedTheoryVar(noUnusedTheoryVarIssue.getKind()));
		out.write(" for ");
		out.write(noUnusedTheoryVarIssue.getWorkingVar());
		out.write(" ");
		out.write(noUnusedTheoryVarIssue.getLocation().prettyString());
		return null;
	}

	@Override
	public Void visit(FormulaSyntaxIssue formulaSyntaxIssue) throws IOException {
		out.write("unable to parse the formula of step ");
		out.write(formulaSyntaxIssue.getStepLabel());
		out.write(": ");
		out.write(formulaSyntaxIssue.getFailure().describe());
		out.write(" ");
		out.write(formulaSyntaxIssue.getFailure().getLocation().prettyString());
		return null;
	}

	@Override
	public Void visit(MalformedProofStepIssue malformedProofStepIssue) throws IOException {
		out.write("malformed proof step \"");
		out.write(malformedProofStepIssue.getStepText());
		out.write("\" ");
		out.write(malformedProofStepIssue.getLocation().prettyString());
		return null;
	}
}
