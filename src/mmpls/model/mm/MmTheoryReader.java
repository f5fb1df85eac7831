package mmpls.model.mm;

import mmpls.MmplsOptions;
import mmpls.grammar.Grammar;
import mmpls.grammar.GrammarSymbol;
import mmpls.grammar.RuleDescriptor;
import mmpls.util.SourceLocation;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads the text of a Metamath theory.
 *
 * Only what the language server needs is kept: labeled statements with their formulas, the
 * outermost scope and the grammar. Proofs and disjoint variable conditions are skipped, and no
 * statement is verified.
 *
 * The grammar has one rule per floating hypothesis and per syntax axiom, in source order,
 * followed by a working variable rule for every configured kind that some variable has, and by
 * the start rules: one for the provable typecode and one per variable kind.
 */
public class MmTheoryReader {

	private static final Logger logger = Logger.getLogger(MmTheoryReader.class.getName());

	private final MmplsOptions options;

	public MmTheoryReader(MmplsOptions options) {
		this.options = options;
	}

	public MmTheory readFile(Path file) throws IOException {
		logger.info("Reading theory " + file);
		return read(FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8));
	}

	public MmTheory read(CharSequence text) {
		Reading reading = new Reading(tokenize(text));
		reading.readAll();
		List<RuleDescriptor> rules = new ArrayList<>(reading.rules);
		for (Map.Entry<String, String> entry : options.getKindToPrefix().entrySet()) {
			String kind = entry.getKey();
			if (reading.variableKinds.contains(kind)) {
				rules.add(new RuleDescriptor("&" + entry.getValue(), kind,
						Collections.singletonList(GrammarSymbol.workingVar(kind))));
			}
		}
		rules.add(new RuleDescriptor(options.getProvableTypecode(), Grammar.START_KIND, List.of(
				GrammarSymbol.constant(options.getProvableTypecode()),
				GrammarSymbol.kind(options.getProvableKind()))));
		for (String kind : reading.variableKinds) {
			rules.add(new RuleDescriptor(kind, Grammar.START_KIND, List.of(
					GrammarSymbol.constant(kind), GrammarSymbol.kind(kind))));
		}
		logger.info("Read " + reading.labelToStatement.size() + " labeled statements and " + rules.size() +
				" grammar rules");
		return new MmTheory(reading.labelToStatement, reading.outermostScope, rules,
				options.getProvableTypecode(), options.getKindToPrefix());
	}

	private static final class Token {
		final String value;
		final SourceLocation location;

		Token(String value, SourceLocation location) {
			this.value = value;
			this.location = location;
		}
	}

	private static List<Token> tokenize(CharSequence text) {
		List<Token> tokens = new ArrayList<>();
		int line = 0;
		int column = 0;
		int pos = 0;
		while (pos < text.length()) {
			char c = text.charAt(pos);
			if (c == '\n') {
				line++;
				column = 0;
				pos++;
			} else if (Character.isWhitespace(c)) {
				column++;
				pos++;
			} else {
				int start = pos;
				while (pos < text.length() && !Character.isWhitespace(text.charAt(pos))) {
					pos++;
				}
				tokens.add(new Token(text.subSequence(start, pos).toString(),
						new SourceLocation(start, pos, line, line, column, column + pos - start)));
				column += pos - start;
			}
		}
		return tokens;
	}

	private final class Reading {
		final List<Token> tokens;
		int pos = 0;

		final LinkedHashMap<String, LabeledStatement> labelToStatement = new LinkedHashMap<>();
		final TheoryScope outermostScope = new TheoryScope();
		final Deque<Map<String, String>> activeVarKinds = new ArrayDeque<>();
		final List<RuleDescriptor> rules = new ArrayList<>();
		final Set<String> variableKinds = new LinkedHashSet<>();

		Reading(List<Token> tokens) {
			this.tokens = tokens;
			activeVarKinds.push(new HashMap<>());
		}

		Token next() {
			while (pos < tokens.size() && tokens.get(pos).value.equals("$(")) {
				Token open = tokens.get(pos);
				pos++;
				while (pos < tokens.size() && !tokens.get(pos).value.equals("$)")) {
					pos++;
				}
				if (pos == tokens.size()) {
					throw new MmTheoryReaderException("unterminated comment", open.location);
				}
				pos++;
			}
			return pos < tokens.size() ? tokens.get(pos++) : null;
		}

		List<String> readUntil(Token start, String terminator) {
			List<String> symbols = new ArrayList<>();
			Token token = next();
			while (token != null && !token.value.equals(terminator)) {
				symbols.add(token.value);
				token = next();
			}
			if (token == null) {
				throw new MmTheoryReaderException("missing " + terminator, start.location);
			}
			return symbols;
		}

		void readAll() {
			for (Token token = next(); token != null; token = next()) {
				switch (token.value) {
					case "$c":
					case "$d":
						readUntil(token, "$.");
						break;
					case "$v":
						List<String> vars = readUntil(token, "$.");
						if (activeVarKinds.size() == 1) {
							vars.forEach(outermostScope::declareVariable);
						}
						break;
					case "${":
						activeVarKinds.push(new HashMap<>());
						break;
					case "$}":
						if (activeVarKinds.size() == 1) {
							throw new MmTheoryReaderException("$} without matching ${", token.location);
						}
						activeVarKinds.pop();
						break;
					case "$[":
						throw new MmTheoryReaderException("file inclusion is not supported", token.location);
					default:
						if (token.value.startsWith("$")) {
							throw new MmTheoryReaderException("unexpected keyword " + token.value, token.location);
						}
						readLabeledStatement(token);
				}
			}
			if (activeVarKinds.size() != 1) {
				throw new MmTheoryReaderException("missing $}", tokens.get(tokens.size() - 1).location);
			}
		}

		void readLabeledStatement(Token label) {
			Token keyword = next();
			if (keyword == null) {
				throw new MmTheoryReaderException("missing keyword after label " + label.value, label.location);
			}
			List<String> formula;
			StatementType type;
			switch (keyword.value) {
				case "$f":
					type = StatementType.FLOATING_HYPOTHESIS;
					formula = readUntil(keyword, "$.");
					if (formula.size() != 2) {
						throw new MmTheoryReaderException("a floating hypothesis needs a typecode and a variable",
								label.location);
					}
					break;
				case "$e":
					type = StatementType.ESSENTIAL_HYPOTHESIS;
					formula = readUntil(keyword, "$.");
					break;
				case "$a":
					type = StatementType.AXIOM;
					formula = readUntil(keyword, "$.");
					break;
				case "$p":
					type = StatementType.THEOREM;
					formula = readUntil(keyword, "$=");
					readUntil(keyword, "$.");
					break;
				default:
					throw new MmTheoryReaderException("unexpected keyword " + keyword.value + " after label " +
							label.value, keyword.location);
			}
			if (formula.isEmpty()) {
				throw new MmTheoryReaderException("statement " + label.value + " has no typecode", label.location);
			}
			if (labelToStatement.containsKey(label.value)) {
				throw new MmTheoryReaderException("duplicate label " + label.value, label.location);
			}
			LabeledStatement statement = new LabeledStatement(label.value, type, formula, label.location);
			labelToStatement.put(label.value, statement);

			if (type == StatementType.FLOATING_HYPOTHESIS) {
				addFloatingHypothesis(statement);
			} else if (type == StatementType.AXIOM && !statement.getTypecode().equals(options.getProvableTypecode())) {
				addSyntaxAxiom(statement);
			}
		}

		void addFloatingHypothesis(LabeledStatement statement) {
			String kind = statement.getTypecode();
			String var = statement.getFormula().get(1);
			activeVarKinds.peek().put(var, kind);
			if (activeVarKinds.size() == 1) {
				outermostScope.addFloatingHypothesis(var, statement);
			}
			variableKinds.add(kind);
			rules.add(new RuleDescriptor(statement.getLabel(), kind,
					Collections.singletonList(GrammarSymbol.variable(var))));
		}

		void addSyntaxAxiom(LabeledStatement statement) {
			List<String> formula = statement.getFormula();
			List<GrammarSymbol> symbols = new ArrayList<>();
			for (String symbol : formula.subList(1, formula.size())) {
				String varKind = kindOfActiveVar(symbol);
				symbols.add(varKind != null ? GrammarSymbol.kind(varKind) : GrammarSymbol.constant(symbol));
			}
			if (symbols.isEmpty()) {
				throw new MmTheoryReaderException("syntax axiom " + statement.getLabel() + " has an empty expression",
						statement.getLocation());
			}
			rules.add(new RuleDescriptor(statement.getLabel(), statement.getTypecode(), symbols));
		}

		String kindOfActiveVar(String symbol) {
			for (Map<String, String> scope : activeVarKinds) {
				String kind = scope.get(symbol);
				if (kind != null) {
					return kind;
				}
			}
			return null;
		}
	}
}
