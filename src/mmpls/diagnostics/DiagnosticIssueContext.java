package mmpls.diagnostics;

import mmpls.errors.Issue;
import mmpls.errors.IssueContext;
import org.eclipse.lsp4j.Diagnostic;

import java.util.List;

/**
 * Turns every reported issue into a warning appended to a caller-owned diagnostics list.
 */
public class DiagnosticIssueContext extends IssueContext {

	private final List<Diagnostic> diagnostics;
	private final IssueToDiagnosticVisitor visitor;
	private boolean hasErrors = false;

	public DiagnosticIssueContext(List<Diagnostic> diagnostics) {
		this.diagnostics = diagnostics;
		this.visitor = new IssueToDiagnosticVisitor(diagnostics);
	}

	@Override
	public void error(Issue err) {
		hasErrors = true;
		err.accept(visitor);
	}

	@Override
	public boolean hasErrors() {
		return hasErrors;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}
}
