package mmpls.parsetrees;

import mmpls.model.parsetree.InternalNode;

import java.util.Collections;
import java.util.Map;

public class MessageDone extends ParseTreesMessage {

	private final Map<String, InternalNode> labelToParseTree;

	public MessageDone(Map<String, InternalNode> labelToParseTree) {
		this.labelToParseTree = Collections.unmodifiableMap(labelToParseTree);
	}

	/**
	 * @return the tree of every formula that parsed, by statement label
	 */
	public Map<String, InternalNode> getLabelToParseTree() {
		return labelToParseTree;
	}

	@Override
	public <T, E extends Throwable> T accept(ParseTreesMessageVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public String toString() {
		return "MessageDone [labelToParseTree.size=" + labelToParseTree.size() + "]";
	}
}
