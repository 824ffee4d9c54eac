package org.hxlens.history.conf;

/*
 * This file is part of HxLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * HxLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * HxLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with HxLens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.hxlens.history.util.Logger;

/**
 * Loads HxLens settings from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/hxlens.properties</code> from the
 * classpath. You can override this by setting the system property
 * <code>hxlens.config</code> to a file path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>Every key is optional; getters fall back to the documented defaults and
 * log a warning when a value is present but unusable.</li>
 * <li>Use {@link #validate()} during startup to surface bad values.</li>
 * </ul>
 */
public class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/hxlens.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "hxlens.config";

	// ---- Property keys --------------------------------------------------------
	static final String K_RECORD_SEPARATOR = "RECORD_SEPARATOR";
	static final String K_DATE_FORMATS = "DATE_FORMATS";
	static final String K_DEFAULT_AGE = "DEFAULT_AGE";
	static final String K_DEFAULT_EMERGENCY_MODE = "DEFAULT_EMERGENCY_MODE";
	static final String K_TERM_RULES = "TERM_RULES";
	static final String K_NER_MODEL_PATH = "NER_MODEL_PATH";
	static final String K_NER_MIN_CONFIDENCE = "NER_MIN_CONFIDENCE";
	static final String K_TIME_ZONE = "TIME_ZONE";

	// ---- Defaults -------------------------------------------------------------
	public static final String DEFAULT_RECORD_SEPARATOR = "---";
	public static final List<String> DEFAULT_DATE_FORMATS = List.of("M/d/uuuu", "uuuu-M-d", "d/M/uuuu",
			"MMMM d, uuuu");
	public static final int DEFAULT_AGE = 30;
	public static final String DEFAULT_TERM_RULES = "rules/term_patterns.txt";
	public static final double DEFAULT_NER_MIN_CONFIDENCE = 0.5;

	private static final String LIST_DELIM = "|";

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (StringUtils.isNotBlank(external)) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Create a loader over in-memory properties. */
	public ConfigLoader(Properties props) {
		if (props != null) {
			properties.putAll(props);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks the values that are present. This does not fail; it returns a list
	 * of human-readable issues so the caller can decide how to proceed.
	 *
	 * @return list of issues; empty if every value looks usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		String age = getOptional(K_DEFAULT_AGE, null);
		if (age != null && parseIntOrNull(age) == null) {
			issues.add("Invalid integer for " + K_DEFAULT_AGE + ": '" + age + "'");
		}
		String conf = getOptional(K_NER_MIN_CONFIDENCE, null);
		if (conf != null) {
			Double d = parseDoubleOrNull(conf);
			if (d == null || d < 0.0 || d > 1.0) {
				issues.add(K_NER_MIN_CONFIDENCE + " must be a number between 0 and 1: '" + conf + "'");
			}
		}
		String zone = getOptional(K_TIME_ZONE, null);
		if (zone != null) {
			try {
				ZoneId.of(zone);
			} catch (DateTimeException ex) {
				issues.add("Unknown " + K_TIME_ZONE + ": '" + zone + "'");
			}
		}
		String sep = properties.getProperty(K_RECORD_SEPARATOR);
		if (sep != null && sep.isBlank()) {
			issues.add(K_RECORD_SEPARATOR + " is blank; using '" + DEFAULT_RECORD_SEPARATOR + "'");
		}
		String mode = getOptional(K_DEFAULT_EMERGENCY_MODE, null);
		if (mode != null && !"true".equalsIgnoreCase(mode) && !"false".equalsIgnoreCase(mode)) {
			issues.add(K_DEFAULT_EMERGENCY_MODE + " must be true or false: '" + mode + "'");
		}
		return issues;
	}

	/** Line content that separates two encounters in a raw history. */
	public String getRecordSeparator() {
		return getOptional(K_RECORD_SEPARATOR, DEFAULT_RECORD_SEPARATOR);
	}

	/** Ordered {@link java.time.format.DateTimeFormatter} patterns tried for {@code Date:} values. */
	public List<String> getDateFormats() {
		String raw = getOptional(K_DATE_FORMATS, null);
		if (raw == null) {
			return DEFAULT_DATE_FORMATS;
		}
		List<String> formats = Arrays.stream(StringUtils.split(raw, LIST_DELIM)).map(String::trim)
				.filter(StringUtils::isNotEmpty).collect(Collectors.toList());
		return formats.isEmpty() ? DEFAULT_DATE_FORMATS : formats;
	}

	/** Age used when a prediction request omits it. */
	public int getDefaultAge() {
		String raw = getOptional(K_DEFAULT_AGE, null);
		if (raw == null) {
			return DEFAULT_AGE;
		}
		Integer val = parseIntOrNull(raw);
		if (val == null || val < 0) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", K_DEFAULT_AGE, raw, DEFAULT_AGE);
			return DEFAULT_AGE;
		}
		return val;
	}

	/** Emergency mode used when a summary request omits it. */
	public boolean isDefaultEmergencyMode() {
		String raw = getOptional(K_DEFAULT_EMERGENCY_MODE, null);
		return raw == null || !"false".equalsIgnoreCase(raw);
	}

	/** Classpath resource (or file path) of the term extraction rule table. */
	public String getTermRules() {
		return getOptional(K_TERM_RULES, DEFAULT_TERM_RULES);
	}

	/** Optional: OpenNLP name finder model for entity extraction; empty when not configured. */
	public String getNerModelPath() {
		return getOptional(K_NER_MODEL_PATH, "");
	}

	/** Entities scored below this value are left out of summaries. */
	public double getNerMinConfidence() {
		String raw = getOptional(K_NER_MIN_CONFIDENCE, null);
		if (raw == null) {
			return DEFAULT_NER_MIN_CONFIDENCE;
		}
		Double val = parseDoubleOrNull(raw);
		if (val == null || val < 0.0 || val > 1.0) {
			Logger.warn("Invalid {}: '{}'. Using default {}", K_NER_MIN_CONFIDENCE, raw,
					DEFAULT_NER_MIN_CONFIDENCE);
			return DEFAULT_NER_MIN_CONFIDENCE;
		}
		return val;
	}

	/** Zone used to turn the wall clock into "today" for timeline buckets. */
	public ZoneId getTimeZone() {
		String raw = getOptional(K_TIME_ZONE, null);
		if (raw == null) {
			return ZoneId.of("UTC");
		}
		try {
			return ZoneId.of(raw);
		} catch (DateTimeException ex) {
			Logger.warn("Unknown {} '{}'. Using UTC", K_TIME_ZONE, raw);
			return ZoneId.of("UTC");
		}
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.warn("Unable to find resource on classpath: {}; using defaults", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private static Integer parseIntOrNull(String raw) {
		try {
			return Integer.parseInt(raw.trim());
		} catch (NumberFormatException nfe) {
			return null;
		}
	}

	private static Double parseDoubleOrNull(String raw) {
		try {
			return Double.parseDouble(raw.trim());
		} catch (NumberFormatException nfe) {
			return null;
		}
	}
}
