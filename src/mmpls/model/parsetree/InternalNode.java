package mmpls.model.parsetree;

import mmpls.util.SourceLocation;

import java.util.Collections;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parse tree node built by the grammar rule labeled {@link #getLabel()}: a syntax axiom, a
 * floating hypothesis, a working variable rule or a start rule.
 */
public class InternalNode extends ParseTree {

	private final String label;
	private final String kind;
	private final List<ParseTree> children;

	public InternalNode(String label, String kind, List<ParseTree> children) {
		this.label = label;
		this.kind = kind;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	public String getLabel() {
		return label;
	}

	@Override
	public String getKind() {
		return kind;
	}

	public List<ParseTree> getChildren() {
		return children;
	}

	/**
	 * @return the leaf of a node made of exactly one token, such as the node for a variable; null otherwise
	 */
	public LeafNode getSingleLeaf() {
		if (children.size() != 1) {
			return null;
		}
		return children.get(0).accept(new ParseTreeVisitor<LeafNode, RuntimeException>() {
			@Override
			public LeafNode visit(InternalNode internalNode) {
				return null;
			}

			@Override
			public LeafNode visit(LeafNode leafNode) {
				return leafNode;
			}
		});
	}

	@Override
	public SourceLocation getLocation() {
		SourceLocation location = SourceLocation.unknown();
		for (ParseTree child : children) {
			location = location.combine(child.getLocation());
		}
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(ParseTreeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, kind, children);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		InternalNode other = (InternalNode) obj;
		return Objects.equals(label, other.label) && Objects.equals(kind, other.kind) &&
				children.equals(other.children);
	}
}
