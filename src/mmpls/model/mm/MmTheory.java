package mmpls.model.mm;

import mmpls.grammar.FormulaParser;
import mmpls.grammar.Grammar;
import mmpls.grammar.GrammarBuilder;
import mmpls.grammar.RuleDescriptor;
import mmpls.model.mmp.WorkingVars;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * A theory as read by {@link MmTheoryReader}: its labeled statements in source order, its
 * outermost scope and the grammar rules derived from its floating hypotheses and syntax axioms.
 */
public class MmTheory {

	private static final Logger logger = Logger.getLogger(MmTheory.class.getName());

	private final Map<String, LabeledStatement> labelToStatement;
	private final TheoryScope outermostScope;
	private final List<RuleDescriptor> grammarRules;
	private final String provableTypecode;
	private final Map<String, String> kindToPrefix;
	private Grammar grammar;
	private volatile boolean allParseTreesComplete = false;

	MmTheory(LinkedHashMap<String, LabeledStatement> labelToStatement, TheoryScope outermostScope,
	         List<RuleDescriptor> grammarRules, String provableTypecode, Map<String, String> kindToPrefix) {
		this.labelToStatement = Collections.unmodifiableMap(labelToStatement);
		this.outermostScope = outermostScope;
		this.grammarRules = Collections.unmodifiableList(new ArrayList<>(grammarRules));
		this.provableTypecode = provableTypecode;
		this.kindToPrefix = Collections.unmodifiableMap(new LinkedHashMap<>(kindToPrefix));
	}

	/**
	 * @return every labeled statement, iterating in source order
	 */
	public Map<String, LabeledStatement> getLabelToStatement() {
		return labelToStatement;
	}

	public LabeledStatement getStatement(String label) {
		return labelToStatement.get(label);
	}

	public TheoryScope getOutermostScope() {
		return outermostScope;
	}

	public List<RuleDescriptor> getGrammarRules() {
		return grammarRules;
	}

	public String getProvableTypecode() {
		return provableTypecode;
	}

	public Map<String, String> getKindToPrefix() {
		return kindToPrefix;
	}

	/**
	 * @return the grammar of this theory, for use on the thread that owns the theory only
	 */
	public synchronized Grammar getGrammar() {
		if (grammar == null) {
			grammar = GrammarBuilder.build(grammarRules);
		}
		return grammar;
	}

	public WorkingVars createWorkingVars() {
		return new WorkingVars(kindToPrefix);
	}

	/**
	 * Essential hypotheses, and axioms and theorems other than syntax axioms, are the statements
	 * whose formulas are parsed when the theory is loaded.
	 */
	public boolean isParsable(LabeledStatement statement) {
		switch (statement.getType()) {
			case ESSENTIAL_HYPOTHESIS:
				return true;
			case AXIOM:
			case THEOREM:
				return statement.getTypecode().equals(provableTypecode);
			default:
				return false;
		}
	}

	public boolean isSyntaxAxiom(LabeledStatement statement) {
		return statement.getType() == StatementType.AXIOM && !statement.getTypecode().equals(provableTypecode);
	}

	public boolean areAllParseTreesComplete() {
		return allParseTreesComplete;
	}

	public void setAllParseTreesComplete(boolean allParseTreesComplete) {
		this.allParseTreesComplete = allParseTreesComplete;
	}

	/**
	 * Parses every parsable statement on the calling thread, one formula at a time and without
	 * any caching. This is the reference the batch pipeline is checked against.
	 */
	public void createParseTreesForAssertionsSync() {
		FormulaParser parser = new FormulaParser(getGrammar(), createWorkingVars());
		int parsed = 0;
		for (LabeledStatement statement : labelToStatement.values()) {
			if (isParsable(statement)) {
				statement.setParseTree(parser.parse(statement.getFormulaText()).getSuccessOrNull());
				if (statement.getParseTree() != null) {
					parsed++;
				}
			}
		}
		logger.fine("parsed " + parsed + " statements synchronously");
		allParseTreesComplete = true;
	}
}
