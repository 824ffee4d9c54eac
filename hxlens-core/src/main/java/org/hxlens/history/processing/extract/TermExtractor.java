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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.hxlens.history.om.ExtractedTerms;
import org.hxlens.history.om.TermCategory;

/**
 * Applies the categorized pattern rules of a {@link TermPatternCatalog} to free
 * text. Stateless; safe to share between threads.
 */
public class TermExtractor {

	private final TermPatternCatalog catalog;

	public TermExtractor(TermPatternCatalog catalog) {
		this.catalog = catalog;
	}

	/**
	 * Every match of every rule, per category. Duplicates within a category are
	 * collapsed (exact string comparison, so case variants are kept apart).
	 */
	public ExtractedTerms extract(String text) {
		ExtractedTerms out = new ExtractedTerms();
		if (text == null || text.isEmpty()) {
			return out;
		}
		for (TermCategory category : TermCategory.values()) {
			for (Pattern p : catalog.getPatterns(category)) {
				Matcher m = p.matcher(text);
				while (m.find()) {
					out.add(category, m.group());
				}
			}
		}
		return out;
	}

	/**
	 * Sentences of a description (split on '.') that mention a warning
	 * indicator. Returned trimmed, in source order, duplicates included.
	 */
	public List<String> extractWarningSentences(String description) {
		List<String> out = new ArrayList<>();
		if (description == null || description.isEmpty()) {
			return out;
		}
		for (String sentence : description.split("\\.")) {
			String lower = sentence.toLowerCase(Locale.ROOT);
			for (String indicator : catalog.getWarningIndicators()) {
				if (lower.contains(indicator)) {
					out.add(sentence.trim());
					break;
				}
			}
		}
		return out;
	}
}
