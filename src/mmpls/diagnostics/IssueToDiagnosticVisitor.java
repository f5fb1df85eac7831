package mmpls.diagnostics;

import mmpls.errors.IssueVisitor;
import mmpls.formatters.MessageFormats;
import mmpls.model.mmp.FormulaSyntaxIssue;
import mmpls.model.mmp.MalformedProofStepIssue;
import mmpls.workingvars.NoUnusedTheoryVarIssue;
import org.eclipse.lsp4j.Diagnostic;

import java.util.List;

public class IssueToDiagnosticVisitor extends IssueVisitor<Void, RuntimeException> {

	private final List<Diagnostic> diagnostics;

	public IssueToDiagnosticVisitor(List<Diagnostic> diagnostics) {
		this.diagnostics = diagnostics;
	}

	@Override
	public Void visit(NoUnusedTheoryVarIssue noUnusedTheoryVarIssue) {
		MmpDiagnostics.addDiagnosticWarning(
				MessageFormats.noUnusedTheoryVar(noUnusedTheoryVarIssue.getKind()),
				MmpDiagnostics.toRange(noUnusedTheoryVarIssue.getLocation()),
				MmpWarningCode.proofCompleteButWorkingVarsRemainAndNoUnusedTheoryVars,
				diagnostics);
		return null;
	}

	@Override
	public Void visit(FormulaSyntaxIssue formulaSyntaxIssue) {
		MmpDiagnostics.addDiagnosticWarning(
				MessageFormats.formulaSyntax(formulaSyntaxIssue.getFailure().describe()),
				MmpDiagnostics.toRange(formulaSyntaxIssue.getFailure().getLocation()),
				MmpWarningCode.formulaSyntaxError,
				diagnostics);
		return null;
	}

	@Override
	public Void visit(MalformedProofStepIssue malformedProofStepIssue) {
		MmpDiagnostics.addDiagnosticWarning(
				MessageFormats.malformedProofStep(),
				MmpDiagnostics.toRange(malformedProofStepIssue.getLocation()),
				MmpWarningCode.malformedProofStep,
				diagnostics);
		return null;
	}
}
