package mmpls.parsetrees;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The progress callback used when the caller has no progress display: progress goes to the log
 * at FINE, log messages at INFO.
 */
public class LoggingProgressCallback extends ParseTreesMessageVisitor<Void, RuntimeException>
		implements ProgressCallback {

	private static final Logger logger = Logger.getLogger(LoggingProgressCallback.class.getName());

	@Override
	public void report(ParseTreesMessage message) {
		message.accept(this);
	}

	@Override
	public Void visit(MessageProgress messageProgress) {
		if (logger.isLoggable(Level.FINE)) {
			logger.fine("parsed " + messageProgress.getIndex() + " of " + messageProgress.getCount());
		}
		return null;
	}

	@Override
	public Void visit(MessageLog messageLog) {
		logger.info(messageLog.getText());
		return null;
	}

	@Override
	public Void visit(MessageDone messageDone) {
		return null;
	}
}
