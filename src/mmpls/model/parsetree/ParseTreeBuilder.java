package mmpls.model.parsetree;

import mmpls.lexer.MmTokenType;
import mmpls.util.SourceLocation;

import java.util.Arrays;

public class ParseTreeBuilder {
	private ParseTreeBuilder() {}

	public static InternalNode node(String label, String kind, ParseTree... children) {
		return new InternalNode(label, kind, Arrays.asList(children));
	}

	public static LeafNode constant(String value) {
		return new LeafNode(value, MmTokenType.CONSTANT, null, SourceLocation.unknown());
	}

	public static LeafNode theoryVar(String value, String kind) {
		return new LeafNode(value, MmTokenType.THEORY_VARIABLE, kind, SourceLocation.unknown());
	}

	public static LeafNode workingVar(String value, String kind) {
		return new LeafNode(value, MmTokenType.WORKING_VARIABLE, kind, SourceLocation.unknown());
	}

	/**
	 * @return the node for a theory variable, as built by the rule of its floating hypothesis
	 */
	public static InternalNode varNode(String floatingHypLabel, String var, String kind) {
		return node(floatingHypLabel, kind, theoryVar(var, kind));
	}
}
