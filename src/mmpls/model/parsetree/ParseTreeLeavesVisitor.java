package mmpls.model.parsetree;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the leaves of a tree from left to right, i.e. the tokens of the formula it was parsed from.
 */
public class ParseTreeLeavesVisitor extends ParseTreeVisitor<List<LeafNode>, RuntimeException> {

	@Override
	public List<LeafNode> visit(InternalNode internalNode) {
		List<LeafNode> result = new ArrayList<>();
		for (ParseTree child : internalNode.getChildren()) {
			result.addAll(child.accept(this));
		}
		return result;
	}

	@Override
	public List<LeafNode> visit(LeafNode leafNode) {
		List<LeafNode> result = new ArrayList<>();
		result.add(leafNode);
		return result;
	}

	public static String formulaOf(ParseTree tree) {
		StringBuilder formula = new StringBuilder();
		for (LeafNode leaf : tree.accept(new ParseTreeLeavesVisitor())) {
			if (formula.length() > 0) {
				formula.append(' ');
			}
			formula.append(leaf.getValue());
		}
		return formula.toString();
	}
}
