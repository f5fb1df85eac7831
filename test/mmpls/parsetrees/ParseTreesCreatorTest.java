package mmpls.parsetrees;

import mmpls.MmFixtures;
import mmpls.MmplsOptions;
import mmpls.model.mm.LabeledStatement;
import mmpls.model.mm.MmTheory;
import mmpls.model.parsetree.InternalNode;
import org.json.JSONObject;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class ParseTreesCreatorTest {

	private static final long TIMEOUT_SECONDS = 30;

	@Test
	public void testCreateLabelToFormulaMap() {
		Map<String, String> labelToFormula = ParseTreesCreator.createLabelToFormulaMap(MmFixtures.mp2());
		assertThat(new ArrayList<>(labelToFormula.keySet()), is(Arrays.asList(
				"min", "maj", "ax-mp", "ax-1", "mp2.1", "mp2.2", "mp2.3", "mp2", "a1i.1", "a1i")));
		assertEquals("|- ( ph -> ( ps -> ch ) )", labelToFormula.get("mp2.3"));
	}

	// the worker's trees are the trees a plain single threaded parse gives
	@Test
	public void testNewThreadMatchesSync() throws Exception {
		MmTheory threaded = MmFixtures.mp2();
		MmTheory reference = MmFixtures.mp2();
		reference.createParseTreesForAssertionsSync();

		CompletableFuture<Void> done = ParseTreesCreator.createParseTreesInANewThread(threaded, message -> {});
		done.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

		assertTrue(threaded.areAllParseTreesComplete());
		for (LabeledStatement statement : reference.getLabelToStatement().values()) {
			assertEquals(statement.getLabel(), statement.getParseTree(),
					threaded.getStatement(statement.getLabel()).getParseTree());
		}
	}

	@Test
	public void testNewThreadMessages() throws Exception {
		List<ParseTreesMessage> messages = Collections.synchronizedList(new ArrayList<>());
		ParseTreesCreator.createParseTreesInANewThread(MmFixtures.mp2(), messages::add)
				.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

		assertThat(messages.size(), is(15));
		assertEquals(new MessageLog("Main thread: labelToFormulaMap.size = 10"), messages.get(0));
		assertEquals(new MessageLog("Worker thread parse-trees-creator: labelToFormulaMap.size = 10"),
				messages.get(1));
		for (int i = 0; i < 10; i++) {
			assertEquals(new MessageProgress(i, 10), messages.get(2 + i));
		}
		assertEquals(new MessageLog("labelToParseTreeMap.size = 10"), messages.get(12));
		assertEquals(new MessageLog("formulaToParseTreeCache.size = 7"), messages.get(13));
		// without an executor the worker merges its own trees
		assertEquals(new MessageLog("Merging the parse trees on thread parse-trees-creator"), messages.get(14));
	}

	// messages are handled by the delivery executor, in the order the worker posted them
	@Test
	public void testDeliveryExecutor() throws Exception {
		ExecutorService delivery = Executors.newSingleThreadExecutor(r -> new Thread(r, "delivery"));
		try {
			List<String> threadNames = Collections.synchronizedList(new ArrayList<>());
			List<ParseTreesMessage> messages = Collections.synchronizedList(new ArrayList<>());
			MmTheory theory = MmFixtures.mp2();
			CompletableFuture<Void> done = ParseTreesCreator.createParseTreesInANewThread(theory, message -> {
				threadNames.add(Thread.currentThread().getName());
				messages.add(message);
			}, delivery);
			done.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

			assertTrue(theory.areAllParseTreesComplete());
			assertThat(threadNames.size(), is(15));
			// the first message is reported before the worker starts
			assertEquals(Thread.currentThread().getName(), threadNames.get(0));
			for (String name : threadNames.subList(1, threadNames.size())) {
				assertEquals("delivery", name);
			}
			for (int i = 0; i < 10; i++) {
				assertEquals(new MessageProgress(i, 10), messages.get(2 + i));
			}
			assertEquals(new MessageLog("Merging the parse trees on thread delivery"), messages.get(14));
		} finally {
			delivery.shutdownNow();
		}
	}

	@Test
	public void testCurrentThread() {
		MmTheory theory = MmFixtures.mp2();
		MmTheory reference = MmFixtures.mp2();
		reference.createParseTreesForAssertionsSync();
		List<ParseTreesMessage> messages = new ArrayList<>();

		ParseTreesCreator.createParseTreesInCurrentThread(theory, messages::add);

		assertTrue(theory.areAllParseTreesComplete());
		assertThat(messages.size(), is(12));
		assertEquals(new MessageProgress(0, 10), messages.get(0));
		for (LabeledStatement statement : reference.getLabelToStatement().values()) {
			assertEquals(statement.getLabel(), statement.getParseTree(),
					theory.getStatement(statement.getLabel()).getParseTree());
		}
	}

	@Test
	public void testCreateParseTreesFollowsOptions() throws Exception {
		MmTheory theory = MmFixtures.mp2();
		MmplsOptions options = new MmplsOptions(new JSONObject().put(MmplsOptions.PARSE_IN_NEW_THREAD_FIELD, false));
		CompletableFuture<Void> done = ParseTreesCreator.createParseTrees(theory, options,
				ParseTreesCreator.DEFAULT_PROGRESS_CALLBACK);
		assertTrue(done.isDone());
		assertTrue(theory.areAllParseTreesComplete());

		MmTheory threaded = MmFixtures.mp2();
		ParseTreesCreator.createParseTrees(threaded, new MmplsOptions(), ParseTreesCreator.DEFAULT_PROGRESS_CALLBACK)
				.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
		assertTrue(threaded.areAllParseTreesComplete());
		assertNotNull(threaded.getStatement("mp2").getParseTree());
	}

	// labels the theory does not know are ignored
	@Test
	public void testAddParseTreesSkipsUnknownLabels() {
		MmTheory theory = MmFixtures.mp2();
		MmTheory other = MmFixtures.mp2();
		other.createParseTreesForAssertionsSync();
		Map<String, InternalNode> labelToParseTree = new HashMap<>();
		labelToParseTree.put("min", other.getStatement("min").getParseTree());
		labelToParseTree.put("nosuchlabel", other.getStatement("maj").getParseTree());

		ParseTreesCreator.addParseTrees(labelToParseTree, theory.getLabelToStatement());

		assertSame(other.getStatement("min").getParseTree(), theory.getStatement("min").getParseTree());
		assertNull(theory.getStatement("maj").getParseTree());
		assertFalse(theory.areAllParseTreesComplete());
	}
}
