package mmpls.parsetrees;

/**
 * Receives the {@link MessageProgress} and {@link MessageLog} messages of a batch parse.
 */
@FunctionalInterface
public interface ProgressCallback {
	void report(ParseTreesMessage message);
}
