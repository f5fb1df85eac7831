package mmpls.parsetrees;

public abstract class ParseTreesMessageVisitor<T, E extends Throwable> {
	public abstract T visit(MessageProgress messageProgress) throws E;
	public abstract T visit(MessageLog messageLog) throws E;
	public abstract T visit(MessageDone messageDone) throws E;
}
