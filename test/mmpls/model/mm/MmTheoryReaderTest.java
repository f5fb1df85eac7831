package mmpls.model.mm;

import mmpls.MmFixtures;
import mmpls.MmplsOptions;
import mmpls.grammar.GrammarSymbol;
import mmpls.grammar.RuleDescriptor;
import org.json.JSONObject;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class MmTheoryReaderTest {

	private static List<String> ruleLabels(MmTheory theory) {
		List<String> labels = new ArrayList<>();
		for (RuleDescriptor rule : theory.getGrammarRules()) {
			labels.add(rule.getLabel());
		}
		return labels;
	}

	private static MmTheory read(String text) {
		return new MmTheoryReader(new MmplsOptions()).read(text);
	}

	@Test
	public void testStatementsInSourceOrder() {
		MmTheory theory = MmFixtures.mp2();
		assertThat(new ArrayList<>(theory.getLabelToStatement().keySet()), is(Arrays.asList(
				"wph", "wps", "wch", "wi", "min", "maj", "ax-mp", "ax-1",
				"mp2.1", "mp2.2", "mp2.3", "mp2", "a1i.1", "a1i")));
		LabeledStatement maj = theory.getStatement("maj");
		assertThat(maj.getType(), is(StatementType.ESSENTIAL_HYPOTHESIS));
		assertEquals("|-", maj.getTypecode());
		assertEquals("|- ( ph -> ps )", maj.getFormulaText());
		assertEquals("maj $e |- ( ph -> ps ) $.", maj.toString());
	}

	// the proof of a $p is not part of its formula
	@Test
	public void testTheoremFormula() {
		assertEquals("|- ch", MmFixtures.mp2().getStatement("mp2").getFormulaText());
	}

	@Test
	public void testGrammarRules() {
		MmTheory theory = MmFixtures.mp2();
		assertThat(ruleLabels(theory), is(Arrays.asList("wph", "wps", "wch", "wi", "&W", "|-", "wff")));
		assertEquals(new RuleDescriptor("wi", "wff", Arrays.asList(
				GrammarSymbol.constant("("),
				GrammarSymbol.kind("wff"),
				GrammarSymbol.constant("->"),
				GrammarSymbol.kind("wff"),
				GrammarSymbol.constant(")"))), theory.getGrammarRules().get(3));
		assertEquals(new RuleDescriptor("wph", "wff", Arrays.asList(GrammarSymbol.variable("ph"))),
				theory.getGrammarRules().get(0));
		assertEquals(new RuleDescriptor("&W", "wff", Arrays.asList(GrammarSymbol.workingVar("wff"))),
				theory.getGrammarRules().get(4));
	}

	// working variable rules only for the configured kinds the theory has variables of
	@Test
	public void testGrammarRulesTwoKinds() {
		MmTheory theory = MmFixtures.readTheory(MmFixtures.SETVAR_THEORY);
		assertThat(ruleLabels(theory), is(Arrays.asList(
				"wph", "wps", "vx", "vy", "wi", "wal", "&W", "&S", "|-", "wff", "setvar")));
	}

	@Test
	public void testOutermostScope() {
		TheoryScope scope = MmFixtures.mp2().getOutermostScope();
		assertThat(new ArrayList<>(scope.getVariables()), is(Arrays.asList("ph", "ps", "ch")));
		assertEquals("wff", scope.kindOf("ch"));
		assertEquals("wps", scope.getFloatingHypothesis("ps").getLabel());
		assertFalse(scope.isVariable("->"));
		assertNull(scope.kindOf("->"));
	}

	@Test
	public void testParsable() {
		MmTheory theory = MmFixtures.mp2();
		assertTrue(theory.isParsable(theory.getStatement("min")));
		assertTrue(theory.isParsable(theory.getStatement("ax-mp")));
		assertTrue(theory.isParsable(theory.getStatement("a1i")));
		assertFalse(theory.isParsable(theory.getStatement("wph")));
		assertFalse(theory.isParsable(theory.getStatement("wi")));
		assertTrue(theory.isSyntaxAxiom(theory.getStatement("wi")));
		assertFalse(theory.isSyntaxAxiom(theory.getStatement("ax-1")));
	}

	@Test
	public void testCreateParseTreesForAssertionsSync() {
		MmTheory theory = MmFixtures.readTheory(MmFixtures.SETVAR_THEORY);
		assertFalse(theory.areAllParseTreesComplete());
		theory.createParseTreesForAssertionsSync();
		assertTrue(theory.areAllParseTreesComplete());
		assertNotNull(theory.getStatement("ax-gen.1").getParseTree());
		assertEquals("wal", theory.getStatement("ax-gen").getParseTree().getChildren().get(1).toString()
				.split(" ")[0]);
		assertNull(theory.getStatement("bogus").getParseTree());
		assertNull(theory.getStatement("wal").getParseTree());
	}

	@Test
	public void testComments() {
		MmTheory theory = read("$( a $c in a comment $. $)\n$c wff $. $v ph $( inline $) $.\nwph $f wff ph $.");
		assertThat(new ArrayList<>(theory.getLabelToStatement().keySet()), is(Arrays.asList("wph")));
		assertTrue(theory.getOutermostScope().isVariable("ph"));
	}

	@Test
	public void testCustomTypecode() throws Exception {
		MmplsOptions options = new MmplsOptions(new JSONObject()
				.put(MmplsOptions.PROVABLE_TYPECODE_FIELD, "=>"));
		MmTheory theory = new MmTheoryReader(options).read(
				"$c wff => $. $v ph $. wph $f wff ph $. ax $a => ph $. ax2 $a |- ph $.");
		assertTrue(theory.isParsable(theory.getStatement("ax")));
		assertTrue(theory.isSyntaxAxiom(theory.getStatement("ax2")));
		assertThat(ruleLabels(theory), is(Arrays.asList("wph", "ax2", "&W", "=>", "wff")));
	}

	@Test(expected = MmTheoryReaderException.class)
	public void testUnmatchedBlockEnd() {
		read("$c wff $. $}");
	}

	@Test(expected = MmTheoryReaderException.class)
	public void testMissingBlockEnd() {
		read("$c wff $. ${ $c x $.");
	}

	@Test(expected = MmTheoryReaderException.class)
	public void testDuplicateLabel() {
		read("$c wff $. $v ph $. wph $f wff ph $. wph $f wff ph $.");
	}

	@Test
	public void testUnterminatedComment() {
		try {
			read("$c wff $.\n  $( no end");
			fail("expected an exception");
		} catch (MmTheoryReaderException e) {
			assertEquals(1, e.getLocation().getStartLine());
			assertEquals(2, e.getLocation().getStartColumn());
			assertEquals("Theory Error", e.getPrefix());
		}
	}

	@Test(expected = MmTheoryReaderException.class)
	public void testFileInclusion() {
		read("$[ set.mm $]");
	}

	@Test(expected = MmTheoryReaderException.class)
	public void testMissingTerminator() {
		read("$c wff $. $v ph $. wph $f wff ph");
	}
}
