package mmpls.parsetrees;

import mmpls.model.parsetree.InternalNode;

import java.util.Map;
import java.util.function.Consumer;

/**
 * The body of the auxiliary thread of a batch parse. It owns its grammar and working variable
 * state, built from the payload, and talks to the starting side only through posted messages.
 */
public class ParseTreesWorker implements Runnable {

	private final ParseTreesPayload payload;
	private final Consumer<ParseTreesMessage> postMessage;

	public ParseTreesWorker(ParseTreesPayload payload, Consumer<ParseTreesMessage> postMessage) {
		this.payload = payload;
		this.postMessage = postMessage;
	}

	@Override
	public void run() {
		postMessage.accept(new MessageLog("Worker thread " + Thread.currentThread().getName() +
				": labelToFormulaMap.size = " + payload.getLabelToFormula().size()));
		Map<String, InternalNode> labelToParseTree =
				ParseTreesBatch.createLabelToParseTreeMap(payload, postMessage::accept);
		postMessage.accept(new MessageDone(labelToParseTree));
	}
}
