package mmpls.parsetrees;

import mmpls.MmplsOptions;
import mmpls.model.mm.LabeledStatement;
import mmpls.model.mm.MmTheory;
import mmpls.model.parsetree.InternalNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the parse tree of every parsable statement of a theory, either on a new thread, so the
 * editor stays responsive while a large theory loads, or on the calling thread.
 *
 * Both ways run {@link ParseTreesBatch} and leave the theory in the same state: every statement
 * whose formula parses has its tree, and {@link MmTheory#areAllParseTreesComplete()} is true.
 * Only one batch may run for a theory at a time.
 */
public class ParseTreesCreator {
	private ParseTreesCreator() {}

	private static final Logger logger = Logger.getLogger(ParseTreesCreator.class.getName());

	public static final ProgressCallback DEFAULT_PROGRESS_CALLBACK = new LoggingProgressCallback();

	private static final String WORKER_THREAD_NAME = "parse-trees-creator";

	public static LinkedHashMap<String, String> createLabelToFormulaMap(MmTheory theory) {
		LinkedHashMap<String, String> labelToFormula = new LinkedHashMap<>();
		for (LabeledStatement statement : theory.getLabelToStatement().values()) {
			if (theory.isParsable(statement)) {
				labelToFormula.put(statement.getLabel(), statement.getFormulaText());
			}
		}
		return labelToFormula;
	}

	public static ParseTreesPayload createPayload(MmTheory theory) {
		return new ParseTreesPayload(createLabelToFormulaMap(theory), theory.getGrammarRules(),
				theory.getKindToPrefix());
	}

	/**
	 * Gives each statement its tree. Labels without a statement are skipped.
	 */
	public static void addParseTrees(Map<String, InternalNode> labelToParseTree,
	                                 Map<String, LabeledStatement> labelToStatement) {
		labelToParseTree.forEach((label, parseTree) -> {
			LabeledStatement statement = labelToStatement.get(label);
			if (statement != null) {
				statement.setParseTree(parseTree);
			}
		});
	}

	/**
	 * Starts the worker with messages handled on the worker thread itself: the callback runs
	 * there, and so does the merge of the trees into the theory. Callers that must own the merge
	 * pass their own executor.
	 */
	public static CompletableFuture<Void> createParseTreesInANewThread(MmTheory theory,
	                                                                    ProgressCallback progressCallback) {
		return createParseTreesInANewThread(theory, progressCallback, Runnable::run);
	}

	/**
	 * Starts one worker thread parsing the theory's formulas.
	 *
	 * Messages from the worker are handed to messageExecutor in the order they are posted, so
	 * messageExecutor must run tasks in submission order. Progress and log messages go to
	 * progressCallback; the final message merges the trees into the theory and completes the
	 * returned future. There is no timeout: if the worker dies, the future never completes and
	 * the failure is logged.
	 *
	 * @param messageExecutor runs message handling on the starting side; Runnable::run handles
	 *                        messages on the worker thread itself
	 */
	public static CompletableFuture<Void> createParseTreesInANewThread(MmTheory theory,
	                                                                    ProgressCallback progressCallback,
	                                                                    Executor messageExecutor) {
		ParseTreesPayload payload = createPayload(theory);
		progressCallback.report(new MessageLog(
				"Main thread: labelToFormulaMap.size = " + payload.getLabelToFormula().size()));

		CompletableFuture<Void> done = new CompletableFuture<>();
		ParseTreesMessageVisitor<Void, RuntimeException> onMessage =
				new ParseTreesMessageVisitor<Void, RuntimeException>() {
			@Override
			public Void visit(MessageProgress messageProgress) {
				progressCallback.report(messageProgress);
				return null;
			}

			@Override
			public Void visit(MessageLog messageLog) {
				progressCallback.report(messageLog);
				return null;
			}

			@Override
			public Void visit(MessageDone messageDone) {
				progressCallback.report(
						new MessageLog("Merging the parse trees on thread " + Thread.currentThread().getName()));
				addParseTrees(messageDone.getLabelToParseTree(), theory.getLabelToStatement());
				theory.setAllParseTreesComplete(true);
				logger.info("Parse trees created for " + messageDone.getLabelToParseTree().size() + " statements");
				done.complete(null);
				return null;
			}
		};

		Thread worker = new Thread(
				new ParseTreesWorker(payload, message -> messageExecutor.execute(() -> message.accept(onMessage))),
				WORKER_THREAD_NAME);
		worker.setDaemon(true);
		worker.setUncaughtExceptionHandler((thread, e) ->
				logger.log(Level.SEVERE, "Thread " + thread.getName() + " stopped before creating all parse trees", e));
		logger.info("Starting " + WORKER_THREAD_NAME + " for " + payload.getLabelToFormula().size() + " formulas");
		worker.start();
		return done;
	}

	/**
	 * The same batch parse on the calling thread, for environments where starting a thread is not
	 * wanted. The callback receives the same progress and log messages.
	 */
	public static void createParseTreesInCurrentThread(MmTheory theory, ProgressCallback progressCallback) {
		ParseTreesPayload payload = createPayload(theory);
		Map<String, InternalNode> labelToParseTree =
				ParseTreesBatch.createLabelToParseTreeMap(payload, progressCallback);
		addParseTrees(labelToParseTree, theory.getLabelToStatement());
		theory.setAllParseTreesComplete(true);
		logger.info("Parse trees created for " + labelToParseTree.size() + " statements");
	}

	/**
	 * Creates the parse trees on a new thread or on the calling one, as the options ask.
	 */
	public static CompletableFuture<Void> createParseTrees(MmTheory theory, MmplsOptions options,
	                                                        ProgressCallback progressCallback) {
		if (options.isParseInNewThread()) {
			return createParseTreesInANewThread(theory, progressCallback);
		}
		createParseTreesInCurrentThread(theory, progressCallback);
		return CompletableFuture.completedFuture(null);
	}
}
