package org.hxlens.history.processing.extract;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.hxlens.history.om.TermCategory;
import org.hxlens.history.util.Logger;

/**
 * Rule table for {@link TermExtractor}: per-category regular expressions plus
 * the keyword vocabulary that marks a warning sentence.
 * <p>
 * The table is read from a classpath resource (default
 * {@code rules/term_patterns.txt}); when it is not on the classpath the same
 * path is tried on the file system. Format:
 * <pre>
 * # comment
 * [disease]
 * \b(?:asthma|pneumonia)\b
 * [warning-indicator]
 * caution
 * </pre>
 */
public final class TermPatternCatalog {

	public static final String DEFAULT_RESOURCE = "rules/term_patterns.txt";

	static final String WARNING_INDICATOR_SECTION = "warning-indicator";

	private final Map<TermCategory, List<Pattern>> patterns;
	private final List<String> warningIndicators;

	private TermPatternCatalog(Map<TermCategory, List<Pattern>> patterns, List<String> warningIndicators) {
		this.patterns = patterns;
		this.warningIndicators = warningIndicators;
	}

	/** Load the bundled rule table. */
	public static TermPatternCatalog loadDefault() {
		return load(DEFAULT_RESOURCE);
	}

	/**
	 * Load a rule table from the classpath, falling back to the file system.
	 *
	 * @throws IllegalStateException if the table cannot be found or is invalid
	 */
	public static TermPatternCatalog load(String location) {
		try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(location)) {
			if (in != null) {
				try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
					return parse(r, location);
				}
			}
		} catch (IOException ioe) {
			Logger.warn("Term rules: classpath read failed for {}: {}", location, ioe.getMessage());
		}

		Path fs = Path.of(location);
		if (Files.isReadable(fs)) {
			try (Reader r = Files.newBufferedReader(fs, StandardCharsets.UTF_8)) {
				return parse(r, location);
			} catch (IOException e) {
				throw new IllegalStateException("Error loading term rules from " + fs + ": " + e.getMessage(), e);
			}
		}
		throw new IllegalStateException("Term rules not found on classpath or file system: " + location);
	}

	/** Parse a rule table held in memory. */
	public static TermPatternCatalog fromString(String table) {
		try {
			return parse(new StringReader(table), "<string>");
		} catch (IOException e) {
			throw new IllegalStateException(e);
		}
	}

	private static TermPatternCatalog parse(Reader source, String origin) throws IOException {
		Map<TermCategory, List<Pattern>> byCategory = new EnumMap<>(TermCategory.class);
		for (TermCategory c : TermCategory.values()) {
			byCategory.put(c, new ArrayList<>());
		}
		List<String> indicators = new ArrayList<>();

		String section = null;
		int lineNo = 0;
		try (BufferedReader br = new BufferedReader(source)) {
			String line;
			while ((line = br.readLine()) != null) {
				lineNo++;
				String trimmed = line.trim();
				if (trimmed.isEmpty() || trimmed.startsWith("#"))
					continue;

				if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
					section = trimmed.substring(1, trimmed.length() - 1).trim().toLowerCase(Locale.ROOT);
					continue;
				}
				if (section == null) {
					throw new IllegalStateException(origin + ":" + lineNo + ": rule outside of a section");
				}
				if (WARNING_INDICATOR_SECTION.equals(section)) {
					indicators.add(trimmed.toLowerCase(Locale.ROOT));
					continue;
				}

				TermCategory category = categoryFor(section);
				if (category == null) {
					Logger.warn("Term rules {}:{}: unknown section [{}], line ignored", origin, lineNo, section);
					continue;
				}
				try {
					byCategory.get(category).add(Pattern.compile(trimmed, Pattern.CASE_INSENSITIVE));
				} catch (PatternSyntaxException pse) {
					throw new IllegalStateException(origin + ":" + lineNo + ": invalid pattern: " + pse.getMessage(),
							pse);
				}
			}
		}

		for (TermCategory c : TermCategory.values()) {
			byCategory.put(c, Collections.unmodifiableList(byCategory.get(c)));
		}
		return new TermPatternCatalog(byCategory, Collections.unmodifiableList(indicators));
	}

	private static TermCategory categoryFor(String section) {
		for (TermCategory c : TermCategory.values()) {
			if (c.sectionName().equals(section)) {
				return c;
			}
		}
		return null;
	}

	public List<Pattern> getPatterns(TermCategory category) {
		return patterns.get(category);
	}

	/** Lower-cased keywords that mark a sentence as a warning. */
	public List<String> getWarningIndicators() {
		return warningIndicators;
	}
}
