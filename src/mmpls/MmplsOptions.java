package mmpls;

import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

// Options of the proof language server core, read from a JSON object such as
//
// {
//   "variableKinds": [
//     { "kind": "wff", "workingVarPrefix": "W" },
//     { "kind": "setvar", "workingVarPrefix": "S" },
//     { "kind": "class", "workingVarPrefix": "C" }
//   ],
//   "provableTypecode": "|-",
//   "provableKind": "wff",
//   "parseInNewThread": true,
//   "logLevel": "INFO"
// }
//
// Every field is optional; a missing field keeps its default, which is the value shown above.
public class MmplsOptions {

	public static final String VARIABLE_KINDS_FIELD = "variableKinds";
	public static final String KIND_FIELD = "kind";
	public static final String WORKING_VAR_PREFIX_FIELD = "workingVarPrefix";
	public static final String PROVABLE_TYPECODE_FIELD = "provableTypecode";
	public static final String PROVABLE_KIND_FIELD = "provableKind";
	public static final String PARSE_IN_NEW_THREAD_FIELD = "parseInNewThread";
	public static final String LOG_LEVEL_FIELD = "logLevel";

	private static final String ROOT_LOGGER = "mmpls";

	private Map<String, String> kindToPrefix;
	private String provableTypecode = "|-";
	private String provableKind = "wff";
	private boolean parseInNewThread = true;
	private Level logLevel = Level.INFO;

	public MmplsOptions() {
		kindToPrefix = new LinkedHashMap<>();
		kindToPrefix.put("wff", "W");
		kindToPrefix.put("setvar", "S");
		kindToPrefix.put("class", "C");
	}

	public MmplsOptions(JSONObject config) throws MmplsOptionException {
		this();
		try {
			if (config.has(VARIABLE_KINDS_FIELD)) {
				kindToPrefix = new LinkedHashMap<>();
				JSONArray kinds = config.getJSONArray(VARIABLE_KINDS_FIELD);
				for (int i = 0; i < kinds.length(); i++) {
					JSONObject kind = kinds.getJSONObject(i);
					kindToPrefix.put(kind.getString(KIND_FIELD), kind.getString(WORKING_VAR_PREFIX_FIELD));
				}
			}
			if (config.has(PROVABLE_TYPECODE_FIELD)) {
				provableTypecode = config.getString(PROVABLE_TYPECODE_FIELD);
			}
			if (config.has(PROVABLE_KIND_FIELD)) {
				provableKind = config.getString(PROVABLE_KIND_FIELD);
			}
			if (config.has(PARSE_IN_NEW_THREAD_FIELD)) {
				parseInNewThread = config.getBoolean(PARSE_IN_NEW_THREAD_FIELD);
			}
			if (config.has(LOG_LEVEL_FIELD)) {
				logLevel = Level.parse(config.getString(LOG_LEVEL_FIELD));
			}
		} catch (JSONException e) {
			throw new MmplsOptionException("Configuration is invalid: " + e.getMessage(), e);
		} catch (IllegalArgumentException e) {
			throw new MmplsOptionException("Invalid log level: " + config.optString(LOG_LEVEL_FIELD), e);
		}

		validate();
	}

	public static MmplsOptions fromFile(Path configFile) throws MmplsOptionException {
		String contents;
		try {
			contents = FileUtils.readFileToString(configFile.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new MmplsOptionException("Cannot read configuration file " + configFile, e);
		}
		try {
			return new MmplsOptions(new JSONObject(contents));
		} catch (JSONException e) {
			throw new MmplsOptionException("Configuration file " + configFile + " is not valid JSON: " +
					e.getMessage(), e);
		}
	}

	private void validate() throws MmplsOptionException {
		if (kindToPrefix.isEmpty()) {
			throw new MmplsOptionException("No variable kind specified");
		}
		Set<String> prefixes = new HashSet<>();
		for (Map.Entry<String, String> entry : kindToPrefix.entrySet()) {
			String prefix = entry.getValue();
			if (prefix.isEmpty() || !prefix.chars().allMatch(Character::isLetter)) {
				throw new MmplsOptionException("Invalid working variable prefix for kind " + entry.getKey() +
						": \"" + prefix + "\"");
			}
			if (!prefixes.add(prefix)) {
				throw new MmplsOptionException("Working variable prefix " + prefix + " used for more than one kind");
			}
		}
		if (provableTypecode.isEmpty() || provableKind.isEmpty()) {
			throw new MmplsOptionException("Provable typecode and kind must not be empty");
		}
	}

	/**
	 * Sets the level of the logger all loggers of this project descend from.
	 */
	public void applyLogLevel() {
		Logger.getLogger(ROOT_LOGGER).setLevel(logLevel);
	}

	public Map<String, String> getKindToPrefix() {
		return Collections.unmodifiableMap(kindToPrefix);
	}

	public String getProvableTypecode() {
		return provableTypecode;
	}

	public String getProvableKind() {
		return provableKind;
	}

	public boolean isParseInNewThread() {
		return parseInNewThread;
	}

	public Level getLogLevel() {
		return logLevel;
	}
}
