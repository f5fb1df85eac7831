package mmpls.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import mmpls.model.mmp.WorkingVars;
import mmpls.util.SourceLocation;

/**
 * Splits a formula into whitespace separated math symbols and classifies each one.
 *
 * Theory variables are recognised through the variable to kind map of the grammar, working
 * variables through the {@link WorkingVars} of the current session. Every working variable seen
 * is recorded in that {@link WorkingVars}, so the lexer state of a session only ever grows.
 */
public class MmLexer {

	private final Map<String, String> varToKind;
	private final WorkingVars workingVars;

	public MmLexer(Map<String, String> varToKind, WorkingVars workingVars) {
		this.varToKind = varToKind;
		this.workingVars = workingVars;
	}

	public List<MmToken> readTokens(CharSequence formula) {
		return readTokens(formula, 0, 0);
	}

	/**
	 * @param startLine line of the first character of formula in the enclosing document
	 * @param startColumn column of the first character of formula in the enclosing document
	 */
	public List<MmToken> readTokens(CharSequence formula, int startLine, int startColumn) {
		List<MmToken> tokens = new ArrayList<>();
		int line = startLine;
		int column = startColumn;
		int pos = 0;
		while (pos < formula.length()) {
			char c = formula.charAt(pos);
			if (c == '\n') {
				line++;
				column = 0;
				pos++;
				continue;
			}
			if (Character.isWhitespace(c)) {
				column++;
				pos++;
				continue;
			}
			int start = pos;
			while (pos < formula.length() && !Character.isWhitespace(formula.charAt(pos))) {
				pos++;
			}
			String value = formula.subSequence(start, pos).toString();
			SourceLocation location = new SourceLocation(
					start, pos, line, line, column, column + (pos - start));
			tokens.add(classify(value, location));
			column += pos - start;
		}
		return tokens;
	}

	private MmToken classify(String value, SourceLocation location) {
		String workingVarKind = workingVars.kindOf(value);
		if (workingVarKind != null) {
			workingVars.record(value);
			return new MmToken(value, MmTokenType.WORKING_VARIABLE, workingVarKind, location);
		}
		String varKind = varToKind.get(value);
		if (varKind != null) {
			return new MmToken(value, MmTokenType.THEORY_VARIABLE, varKind, location);
		}
		return new MmToken(value, MmTokenType.CONSTANT, null, location);
	}

}
