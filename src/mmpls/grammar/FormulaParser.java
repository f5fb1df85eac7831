package mmpls.grammar;

import mmpls.lexer.MmLexer;
import mmpls.lexer.MmToken;
import mmpls.lexer.MmTokenType;
import mmpls.model.mmp.WorkingVars;
import mmpls.model.parsetree.InternalNode;
import mmpls.model.parsetree.LeafNode;
import mmpls.model.parsetree.ParseTree;
import mmpls.util.SourceLocation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A parsing session: one grammar and the working variable state its lexer threads through every
 * formula it reads.
 *
 * Formulas are parsed with an Earley parser, so any context free rule set is accepted as long as
 * no rule has an empty right hand side. Only the first derivation found for each item is kept,
 * which makes the tree of an ambiguous formula depend on rule order only.
 *
 * A formula that does not parse is never an error: {@link #parse(CharSequence)} returns a
 * failed {@link ParseResult} describing where parsing stopped.
 */
public class FormulaParser {

	private final Grammar grammar;
	private final MmLexer lexer;

	public FormulaParser(Grammar grammar, WorkingVars workingVars) {
		this.grammar = grammar;
		this.lexer = new MmLexer(grammar.getVarToKind(), workingVars);
	}

	public Grammar getGrammar() {
		return grammar;
	}

	public ParseResult<InternalNode> parse(CharSequence formula) {
		return parse(formula, 0, 0);
	}

	/**
	 * Parses a formula located at the given position of an enclosing document; the leaves of the
	 * resulting tree carry document positions.
	 */
	public ParseResult<InternalNode> parse(CharSequence formula, int startLine, int startColumn) {
		return parseTokens(lexer.readTokens(formula, startLine, startColumn));
	}

	public ParseResult<InternalNode> parseTokens(List<MmToken> tokens) {
		if (tokens.isEmpty()) {
			return ParseResult.failure(new ParseFailure(
					ParseFailure.Reason.EMPTY_FORMULA, null, SourceLocation.unknown()));
		}
		int n = tokens.size();
		List<ItemSet> sets = new ArrayList<>(n + 1);
		for (int i = 0; i <= n; i++) {
			sets.add(new ItemSet());
		}
		for (RuleDescriptor rule : grammar.getRulesForKind(Grammar.START_KIND)) {
			sets.get(0).add(new Item(rule, 0, 0, null));
		}

		for (int i = 0; i <= n; i++) {
			ItemSet set = sets.get(i);
			for (int k = 0; k < set.size(); k++) {
				Item item = set.get(k);
				if (item.isComplete()) {
					complete(item, sets.get(item.origin), set);
					continue;
				}
				GrammarSymbol next = item.next();
				if (next.getType() == GrammarSymbol.Type.KIND) {
					for (RuleDescriptor rule : grammar.getRulesForKind(next.getValue())) {
						set.add(new Item(rule, 0, i, null));
					}
				} else if (i < n && matches(next, tokens.get(i))) {
					sets.get(i + 1).add(item.advance(new LeafNode(tokens.get(i))));
				}
			}
			if (i < n && sets.get(i + 1).size() == 0) {
				MmToken token = tokens.get(i);
				return ParseResult.failure(new ParseFailure(
						ParseFailure.Reason.UNEXPECTED_TOKEN, token.getValue(), token.getLocation()));
			}
		}

		ItemSet last = sets.get(n);
		for (int k = 0; k < last.size(); k++) {
			Item item = last.get(k);
			if (item.isComplete() && item.origin == 0 && item.rule.getKind().equals(Grammar.START_KIND)) {
				return ParseResult.success(item.toNode());
			}
		}
		return ParseResult.failure(new ParseFailure(
				ParseFailure.Reason.UNEXPECTED_END_OF_FORMULA, null, tokens.get(n - 1).getLocation()));
	}

	private static void complete(Item completed, ItemSet originSet, ItemSet target) {
		InternalNode node = completed.toNode();
		String kind = completed.rule.getKind();
		for (int m = 0; m < originSet.size(); m++) {
			Item waiting = originSet.get(m);
			GrammarSymbol next = waiting.next();
			if (next != null && next.getType() == GrammarSymbol.Type.KIND && next.getValue().equals(kind)) {
				target.add(waiting.advance(node));
			}
		}
	}

	private static boolean matches(GrammarSymbol symbol, MmToken token) {
		switch (symbol.getType()) {
			case CONSTANT:
				return token.getType() == MmTokenType.CONSTANT && symbol.getValue().equals(token.getValue());
			case VARIABLE:
				return token.getType() == MmTokenType.THEORY_VARIABLE && symbol.getValue().equals(token.getValue());
			case WORKING_VAR:
				return token.getType() == MmTokenType.WORKING_VARIABLE && symbol.getValue().equals(token.getKind());
			default:
				return false;
		}
	}

	// children are kept in reverse order so that advancing an item shares its predecessor's list
	private static final class Children {
		final ParseTree head;
		final Children tail;

		Children(ParseTree head, Children tail) {
			this.head = head;
			this.tail = tail;
		}
	}

	private static final class Item {
		final RuleDescriptor rule;
		final int dot;
		final int origin;
		final Children children;

		Item(RuleDescriptor rule, int dot, int origin, Children children) {
			this.rule = rule;
			this.dot = dot;
			this.origin = origin;
			this.children = children;
		}

		boolean isComplete() {
			return dot == rule.getSymbols().size();
		}

		GrammarSymbol next() {
			return isComplete() ? null : rule.getSymbols().get(dot);
		}

		Item advance(ParseTree child) {
			return new Item(rule, dot + 1, origin, new Children(child, children));
		}

		InternalNode toNode() {
			LinkedList<ParseTree> ordered = new LinkedList<>();
			for (Children c = children; c != null; c = c.tail) {
				ordered.addFirst(c.head);
			}
			return new InternalNode(rule.getLabel(), rule.getKind(), ordered);
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj)
				return true;
			if (obj == null || getClass() != obj.getClass())
				return false;
			Item other = (Item) obj;
			return dot == other.dot && origin == other.origin && rule.equals(other.rule);
		}

		@Override
		public int hashCode() {
			return Objects.hash(rule, dot, origin);
		}
	}

	// an Earley set: items in insertion order, each (rule, dot, origin) at most once
	private static final class ItemSet {
		final List<Item> items = new ArrayList<>();
		final Set<Item> seen = new HashSet<>();

		void add(Item item) {
			if (seen.add(item)) {
				items.add(item);
			}
		}

		Item get(int index) {
			return items.get(index);
		}

		int size() {
			return items.size();
		}
	}
}
