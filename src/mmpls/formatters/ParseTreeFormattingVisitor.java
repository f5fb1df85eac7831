package mmpls.formatters;

import mmpls.model.parsetree.InternalNode;
import mmpls.model.parsetree.LeafNode;
import mmpls.model.parsetree.ParseTree;
import mmpls.model.parsetree.ParseTreeVisitor;

import java.io.IOException;

/**
 * Writes a tree one node per line, children indented under their parent:
 * <pre>
 * wi : wff
 *   (
 *   wph : wff
 *     ph : wff
 *   ...
 * </pre>
 */
public class ParseTreeFormattingVisitor extends ParseTreeVisitor<Void, IOException> {
	private final IndentingWriter out;

	public ParseTreeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(InternalNode internalNode) throws IOException {
		out.write(internalNode.getLabel());
		out.write(" : ");
		out.write(internalNode.getKind());
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (ParseTree child : internalNode.getChildren()) {
				out.newLine();
				child.accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(LeafNode leafNode) throws IOException {
		out.write(leafNode.getValue());
		if (leafNode.getKind() != null) {
			out.write(" : ");
			out.write(leafNode.getKind());
		}
		return null;
	}
}
