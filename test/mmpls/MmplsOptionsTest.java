package mmpls;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.*;

public class MmplsOptionsTest {

	private JSONObject config;

	@Before
	public void setup() {
		config = new JSONObject(MmFixtures.readText(Paths.get("test", "configs", "options.json")));
	}

	private JSONArray getVariableKinds() {
		return config.getJSONArray(MmplsOptions.VARIABLE_KINDS_FIELD);
	}

	// an empty configuration keeps every default
	@Test
	public void testDefaults() throws MmplsOptionException {
		MmplsOptions options = new MmplsOptions(new JSONObject());
		assertThat(options.getKindToPrefix().keySet().toArray(), is(new Object[]{"wff", "setvar", "class"}));
		assertEquals("W", options.getKindToPrefix().get("wff"));
		assertEquals("S", options.getKindToPrefix().get("setvar"));
		assertEquals("C", options.getKindToPrefix().get("class"));
		assertEquals("|-", options.getProvableTypecode());
		assertEquals("wff", options.getProvableKind());
		assertTrue(options.isParseInNewThread());
		assertEquals(Level.INFO, options.getLogLevel());
	}

	@Test
	public void testFromFile() throws MmplsOptionException {
		MmplsOptions options = MmplsOptions.fromFile(Paths.get("test", "configs", "options.json"));
		assertEquals(Arrays.asList("wff", "setvar"), Arrays.asList(options.getKindToPrefix().keySet().toArray()));
		assertFalse(options.isParseInNewThread());
		assertEquals(Level.FINE, options.getLogLevel());
	}

	@Test(expected = MmplsOptionException.class)
	public void testMissingFile() throws MmplsOptionException {
		MmplsOptions.fromFile(Paths.get("test", "configs", "does-not-exist.json"));
	}

	// working variable prefixes are made of letters only
	@Test(expected = MmplsOptionException.class)
	public void testPrefixWithDigit() throws MmplsOptionException {
		getVariableKinds().getJSONObject(0).put(MmplsOptions.WORKING_VAR_PREFIX_FIELD, "W1");
		new MmplsOptions(config);
	}

	@Test(expected = MmplsOptionException.class)
	public void testEmptyPrefix() throws MmplsOptionException {
		getVariableKinds().getJSONObject(0).put(MmplsOptions.WORKING_VAR_PREFIX_FIELD, "");
		new MmplsOptions(config);
	}

	// two kinds sharing a prefix would make working variables ambiguous
	@Test(expected = MmplsOptionException.class)
	public void testDuplicatePrefix() throws MmplsOptionException {
		getVariableKinds().getJSONObject(1).put(MmplsOptions.WORKING_VAR_PREFIX_FIELD, "W");
		new MmplsOptions(config);
	}

	@Test(expected = MmplsOptionException.class)
	public void testNoVariableKinds() throws MmplsOptionException {
		config.put(MmplsOptions.VARIABLE_KINDS_FIELD, new JSONArray());
		new MmplsOptions(config);
	}

	@Test(expected = MmplsOptionException.class)
	public void testKindWithoutPrefix() throws MmplsOptionException {
		getVariableKinds().getJSONObject(0).remove(MmplsOptions.WORKING_VAR_PREFIX_FIELD);
		new MmplsOptions(config);
	}

	@Test(expected = MmplsOptionException.class)
	public void testInvalidLogLevel() throws MmplsOptionException {
		config.put(MmplsOptions.LOG_LEVEL_FIELD, "LOUD");
		new MmplsOptions(config);
	}

	@Test
	public void testApplyLogLevel() throws MmplsOptionException {
		Logger root = Logger.getLogger("mmpls");
		Level previous = root.getLevel();
		try {
			new MmplsOptions(config).applyLogLevel();
			assertEquals(Level.FINE, root.getLevel());
		} finally {
			root.setLevel(previous);
		}
	}
}
