package mmpls.model.parsetree;

public abstract class ParseTreeVisitor<T, E extends Throwable> {
	public abstract T visit(InternalNode internalNode) throws E;
	public abstract T visit(LeafNode leafNode) throws E;
}
