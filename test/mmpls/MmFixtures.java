package mmpls;

import mmpls.errors.TopLevelIssueContext;
import mmpls.model.mm.MmTheory;
import mmpls.model.mm.MmTheoryReader;
import mmpls.model.mmp.MmpProof;
import mmpls.model.mmp.MmpProofReader;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.assertFalse;

public class MmFixtures {
	private MmFixtures() {}

	public static final Path MP2_THEORY = Paths.get("test", "mm", "mp2.mm");
	public static final Path SETVAR_THEORY = Paths.get("test", "mm", "setvar.mm");
	public static final Path PARTIAL_PROOF = Paths.get("test", "mmp", "partial.mmp");

	public static MmTheory readTheory(Path file) {
		try {
			return new MmTheoryReader(new MmplsOptions()).readFile(file);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static MmTheory mp2() {
		return readTheory(MP2_THEORY);
	}

	public static String readText(Path file) {
		try {
			return FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	// reads a proof that is expected to have no syntax problems
	public static MmpProof readProof(MmTheory theory, String text) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		MmpProof proof = new MmpProofReader(theory).read(text, ctx);
		assertFalse(ctx.format(), ctx.hasErrors());
		return proof;
	}
}
