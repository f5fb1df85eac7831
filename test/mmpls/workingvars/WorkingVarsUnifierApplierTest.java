package mmpls.workingvars;

import mmpls.MmFixtures;
import mmpls.errors.TopLevelIssueContext;
import mmpls.model.mm.MmTheory;
import mmpls.model.mmp.FormulaToParseTreeCache;
import mmpls.model.mmp.MmpProof;
import mmpls.model.mmp.MmpProofStep;
import mmpls.model.parsetree.InternalNode;
import mmpls.util.SourceLocation;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static mmpls.model.parsetree.ParseTreeBuilder.*;
import static org.junit.Assert.*;

public class WorkingVarsUnifierApplierTest {

	private static InternalNode implication(InternalNode left, InternalNode right) {
		return node("wi", "wff", constant("("), left, constant("->"), right, constant(")"));
	}

	private static InternalNode provable(InternalNode wff) {
		return node("|-", "$start", constant("|-"), wff);
	}

	private static MmpProofStep step(String label, InternalNode tree) {
		MmpProofStep step = new MmpProofStep(label, Collections.emptyList(), "ax-mp", "", SourceLocation.unknown());
		step.setParseTree(tree);
		return step;
	}

	private static WorkingVarsUnifier unifierFor(MmpProof proof) {
		MmTheory theory = MmFixtures.mp2();
		UnifierBuilder builder = new UnifierBuilder(theory.createWorkingVars(),
				new TheoryVarAllocator(theory.getOutermostScope()));
		return builder.build(WorkingVarCollector.collect(proof), UsedTheoryVarsCollector.collect(proof),
				new TopLevelIssueContext());
	}

	@Test
	public void testSubstitutesEveryOccurrence() {
		MmTheory theory = MmFixtures.mp2();
		InternalNode w1 = node("&W", "wff", workingVar("&W1", "wff"));
		InternalNode untouched = provable(varNode("wps", "ps", "wff"));
		MmpProof proof = new MmpProof("t", Arrays.asList(
				step("1", provable(implication(w1, varNode("wps", "ps", "wff")))),
				step("2", untouched),
				step("3", provable(w1))), theory.getOutermostScope(), theory.createWorkingVars());
		FormulaToParseTreeCache cache = new FormulaToParseTreeCache();

		new WorkingVarsUnifierApplier().apply(unifierFor(proof), proof, cache);

		assertEquals("|- ( ph -> ps )", proof.getStep("1").getFormula());
		assertEquals("|- ph", proof.getStep("3").getFormula());
		assertEquals(provable(varNode("wph", "ph", "wff")), proof.getStep("3").getParseTree());
		// steps without working variables keep their tree and formula
		assertSame(untouched, proof.getStep("2").getParseTree());
		assertEquals("", proof.getStep("2").getFormula());
		assertEquals(2, cache.size());
		assertSame(proof.getStep("1").getParseTree(), cache.get("|- ( ph -> ps )"));
	}

	// a working variable missing from the substitution stays where it is
	@Test
	public void testUnresolvedStays() {
		MmTheory theory = MmFixtures.mp2();
		InternalNode tree = provable(implication(
				implication(node("&W", "wff", workingVar("&W1", "wff")), node("&W", "wff", workingVar("&W2", "wff"))),
				implication(node("&W", "wff", workingVar("&W3", "wff")), node("&W", "wff", workingVar("&W4", "wff")))));
		MmpProof proof = new MmpProof("t", Collections.singletonList(step("1", tree)),
				theory.getOutermostScope(), theory.createWorkingVars());

		new WorkingVarsUnifierApplier().apply(unifierFor(proof), proof, null);

		assertEquals("|- ( ( ph -> ps ) -> ( ch -> &W4 ) )", proof.getStep("1").getFormula());
	}
}
