package mmpls.parsetrees;

/**
 * A message posted by a batch parse to the side that started it: any number of
 * {@link MessageProgress} and {@link MessageLog}, then exactly one {@link MessageDone}.
 */
public abstract class ParseTreesMessage {

	public abstract <T, E extends Throwable> T accept(ParseTreesMessageVisitor<T, E> v) throws E;

}
