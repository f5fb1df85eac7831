package mmpls.model.parsetree;

import mmpls.formatters.IndentingWriter;
import mmpls.formatters.ParseTreeFormattingVisitor;
import mmpls.util.SourceLocatable;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * The base class of parse trees: either an {@link InternalNode} produced by a grammar rule or a
 * {@link LeafNode} holding one token of the formula.
 *
 * Parse trees are immutable. A substitution builds a new tree, so a tree built on one thread can
 * be handed to another without copying.
 *
 */
public abstract class ParseTree extends SourceLocatable {

	/**
	 * @return the grammatical kind of this subtree, null for a leaf holding a constant
	 */
	public abstract String getKind();

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new ParseTreeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(ParseTreeVisitor<T, E> v) throws E;

}
