package mmpls.diagnostics;

import mmpls.util.SourceLocation;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import java.util.List;

public final class MmpDiagnostics {

	public static final String SOURCE = "mmpls";

	private MmpDiagnostics() {}

	public static void addDiagnosticWarning(String message, Range range, MmpWarningCode code,
	                                        List<Diagnostic> diagnostics) {
		Diagnostic diagnostic = new Diagnostic();
		diagnostic.setSeverity(DiagnosticSeverity.Warning);
		diagnostic.setRange(range);
		diagnostic.setMessage(message);
		diagnostic.setSource(SOURCE);
		diagnostic.setCode(code.name());
		diagnostics.add(diagnostic);
	}

	/**
	 * Unknown locations map to the empty range at the start of the document.
	 */
	public static Range toRange(SourceLocation location) {
		if (location.isUnknown()) {
			return new Range(new Position(0, 0), new Position(0, 0));
		}
		return new Range(
				new Position(location.getStartLine(), location.getStartColumn()),
				new Position(location.getEndLine(), location.getEndColumn()));
	}
}
