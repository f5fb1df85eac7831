package mmpls.model.mmp;

import mmpls.errors.IssueContext;
import mmpls.grammar.FormulaParser;
import mmpls.grammar.ParseResult;
import mmpls.model.mm.MmTheory;
import mmpls.model.parsetree.InternalNode;
import mmpls.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads the text of a proof under construction:
 * <pre>
 * $theorem mp2b
 *
 * * a comment, possibly continued on indented lines
 *
 * h1::mp2b.1     |- ph
 * 2::ax-1        |- ( ph -&gt;
 *                     ( ps -&gt; ph ) )
 * qed:1,2:ax-mp  |- ( ps -&gt; ph )
 * </pre>
 * A step is {@code label:hyp,hyp:ref} followed by its formula, which may continue on the
 * following indented lines. Formulas are parsed with the theory's grammar, sharing the proof's
 * working variables; the leaves of the trees carry document positions. Problems are reported to
 * the issue context and never stop the reading.
 */
public class MmpProofReader {

	private static final String THEOREM_KEYWORD = "$theorem";

	private final MmTheory theory;

	public MmpProofReader(MmTheory theory) {
		this.theory = theory;
	}

	public MmpProof read(CharSequence text, IssueContext ctx) {
		return read(text, theory.createWorkingVars(), ctx);
	}

	public MmpProof read(CharSequence text, WorkingVars workingVars, IssueContext ctx) {
		String[] lines = text.toString().split("\n", -1);
		String theoremLabel = null;
		List<PendingItem> pending = new ArrayList<>();
		PendingItem current = null;
		for (int i = 0; i < lines.length; i++) {
			String line = lines[i].endsWith("\r") ? lines[i].substring(0, lines[i].length() - 1) : lines[i];
			if (line.trim().isEmpty()) {
				current = null;
			} else if (Character.isWhitespace(line.charAt(0))) {
				if (current != null) {
					current.continueWith(line);
				}
			} else if (line.startsWith(THEOREM_KEYWORD)) {
				theoremLabel = line.substring(THEOREM_KEYWORD.length()).trim();
				current = null;
			} else if (line.startsWith("*")) {
				current = new PendingComment(line);
				pending.add(current);
			} else {
				current = readStepLine(line, i, ctx);
				if (current != null) {
					pending.add(current);
				}
			}
		}

		FormulaParser parser = new FormulaParser(theory.getGrammar(), workingVars);
		List<MmpProofItem> items = new ArrayList<>();
		for (PendingItem p : pending) {
			items.add(p.toItem(parser, ctx));
		}
		return new MmpProof(theoremLabel, items, theory.getOutermostScope(), workingVars);
	}

	private static PendingStep readStepLine(String line, int lineNumber, IssueContext ctx) {
		int headEnd = 0;
		while (headEnd < line.length() && !Character.isWhitespace(line.charAt(headEnd))) {
			headEnd++;
		}
		String head = line.substring(0, headEnd);
		SourceLocation headLocation = new SourceLocation(0, headEnd, lineNumber, lineNumber, 0, headEnd);
		String[] parts = head.split(":", -1);
		if (parts.length != 3 || parts[0].isEmpty()) {
			ctx.error(new MalformedProofStepIssue(head, headLocation));
			return null;
		}
		int formulaStart = headEnd;
		while (formulaStart < line.length() && Character.isWhitespace(line.charAt(formulaStart))) {
			formulaStart++;
		}
		List<String> hypRefs = parts[1].isEmpty() ?
				Collections.emptyList() : Arrays.asList(parts[1].split(","));
		return new PendingStep(parts[0], hypRefs, parts[2], headLocation,
				line.substring(formulaStart), lineNumber, formulaStart);
	}

	private interface PendingItem {

		void continueWith(String line);

		MmpProofItem toItem(FormulaParser parser, IssueContext ctx);
	}

	private static final class PendingComment implements PendingItem {
		final StringBuilder text;

		PendingComment(String firstLine) {
			this.text = new StringBuilder(firstLine);
		}

		@Override
		public void continueWith(String line) {
			text.append('\n').append(line);
		}

		@Override
		public MmpProofItem toItem(FormulaParser parser, IssueContext ctx) {
			return new MmpProofComment(text.toString());
		}
	}

	private static final class PendingStep implements PendingItem {
		final String label;
		final List<String> hypRefs;
		final String ref;
		final SourceLocation location;
		final StringBuilder formula;
		final int formulaLine;
		final int formulaColumn;

		PendingStep(String label, List<String> hypRefs, String ref, SourceLocation location, String formula,
		            int formulaLine, int formulaColumn) {
			this.label = label;
			this.hypRefs = hypRefs;
			this.ref = ref;
			this.location = location;
			this.formula = new StringBuilder(formula);
			this.formulaLine = formulaLine;
			this.formulaColumn = formulaColumn;
		}

		@Override
		public void continueWith(String line) {
			formula.append('\n').append(line);
		}

		@Override
		public MmpProofItem toItem(FormulaParser parser, IssueContext ctx) {
			String trimmed = formula.toString().trim();
			String normalized = trimmed.isEmpty() ? "" : String.join(" ", trimmed.split("\\s+"));
			MmpProofStep step = new MmpProofStep(label, hypRefs, ref, normalized, location);
			if (!normalized.isEmpty()) {
				ParseResult<InternalNode> result = parser.parse(formula, formulaLine, formulaColumn);
				if (result.isSuccess()) {
					step.setParseTree(result.getSuccess());
				} else {
					ctx.error(new FormulaSyntaxIssue(label, result.getFailure()));
				}
			}
			return step;
		}
	}
}
