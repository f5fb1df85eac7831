package mmpls.grammar;

import mmpls.MmFixtures;
import mmpls.model.mm.MmTheory;
import mmpls.model.mmp.WorkingVars;
import mmpls.model.parsetree.InternalNode;
import mmpls.model.parsetree.LeafNode;
import mmpls.model.parsetree.ParseTreeLeavesVisitor;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class FormulaParserFailureTest {

	private WorkingVars workingVars;
	private FormulaParser parser;

	@Before
	public void setup() {
		MmTheory theory = MmFixtures.mp2();
		workingVars = theory.createWorkingVars();
		parser = new FormulaParser(theory.getGrammar(), workingVars);
	}

	private ParseFailure failureOf(String formula) {
		ParseResult<InternalNode> result = parser.parse(formula);
		assertFalse(formula, result.isSuccess());
		assertNull(result.getSuccessOrNull());
		return result.getFailure();
	}

	@Test
	public void testEmptyFormula() {
		ParseFailure failure = failureOf("  ");
		assertThat(failure.getReason(), is(ParseFailure.Reason.EMPTY_FORMULA));
		assertTrue(failure.getLocation().isUnknown());
	}

	@Test
	public void testUnexpectedToken() {
		ParseFailure failure = failureOf("|- ( ph -> )");
		assertThat(failure.getReason(), is(ParseFailure.Reason.UNEXPECTED_TOKEN));
		assertEquals(")", failure.getToken());
		assertEquals(11, failure.getLocation().getStartColumn());
		assertEquals("unexpected token \")\"", failure.describe());
	}

	@Test
	public void testTrailingToken() {
		ParseFailure failure = failureOf("|- ps ph");
		assertThat(failure.getReason(), is(ParseFailure.Reason.UNEXPECTED_TOKEN));
		assertEquals("ph", failure.getToken());
		assertEquals(6, failure.getLocation().getStartColumn());
	}

	@Test
	public void testUnknownConstant() {
		ParseFailure failure = failureOf("|- foo");
		assertThat(failure.getReason(), is(ParseFailure.Reason.UNEXPECTED_TOKEN));
		assertEquals("foo", failure.getToken());
	}

	// the failure points at the last token read
	@Test
	public void testUnexpectedEnd() {
		ParseFailure failure = failureOf("|- ( ph -> ps");
		assertThat(failure.getReason(), is(ParseFailure.Reason.UNEXPECTED_END_OF_FORMULA));
		assertEquals(11, failure.getLocation().getStartColumn());
		assertNull(failure.getToken());
	}

	// no rule reads a class, so a class working variable is not a wff
	@Test
	public void testWorkingVarOfAnotherKind() {
		ParseFailure failure = failureOf("|- &C1");
		assertEquals("&C1", failure.getToken());
	}

	@Test
	public void testDocumentPositions() {
		InternalNode tree = parser.parse("|- ( ph\n  -> &W5 )", 3, 14).getSuccess();
		List<LeafNode> leaves = tree.accept(new ParseTreeLeavesVisitor());
		LeafNode workingVar = leaves.get(4);
		assertEquals("&W5", workingVar.getValue());
		assertEquals(4, workingVar.getLocation().getStartLine());
		assertEquals(5, workingVar.getLocation().getStartColumn());
		assertEquals(8, workingVar.getLocation().getEndColumn());
		assertEquals(3, tree.getLocation().getStartLine());
		assertEquals(14, tree.getLocation().getStartColumn());
	}

	// the session keeps the working variables of every formula it read, failed ones included
	@Test
	public void testSessionRecordsWorkingVars() {
		parser.parse("|- ( &W2 -> ph )");
		parser.parse("|- ( &W7 -> )");
		parser.parse("|- &W2");
		assertThat(new ArrayList<>(workingVars.getRecordedWorkingVars()), is(Arrays.asList("&W2", "&W7")));
	}

	@Test
	public void testHugeWorkingVarIndex() {
		ParseResult<InternalNode> result = parser.parse("|- &W99999999999");
		assertTrue(result.isSuccess());
		List<LeafNode> leaves = result.getSuccess().accept(new ParseTreeLeavesVisitor());
		assertEquals("&W99999999999", leaves.get(1).getValue());
		assertTrue(leaves.get(1).isWorkingVar());
	}
}
