package org.hxlens.history.om;

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

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Distinct matched substrings per {@link TermCategory}. Set order carries no
 * meaning; insertion order is kept only so repeated runs print the same text.
 */
public final class ExtractedTerms {

	private final Map<TermCategory, Set<String>> terms = new EnumMap<>(TermCategory.class);

	public ExtractedTerms() {
		for (TermCategory c : TermCategory.values()) {
			terms.put(c, new LinkedHashSet<>());
		}
	}

	public void add(TermCategory category, String term) {
		if (term != null && !term.isEmpty()) {
			terms.get(category).add(term);
		}
	}

	public void addAll(TermCategory category, Collection<String> values) {
		for (String v : values) {
			add(category, v);
		}
	}

	/** Merge another extraction into this one, category by category. */
	public ExtractedTerms merge(ExtractedTerms other) {
		if (other != null) {
			for (TermCategory c : TermCategory.values()) {
				addAll(c, other.get(c));
			}
		}
		return this;
	}

	public Set<String> get(TermCategory category) {
		return Collections.unmodifiableSet(terms.get(category));
	}

	public boolean isEmpty() {
		return terms.values().stream().allMatch(Set::isEmpty);
	}

	@Override
	public String toString() {
		return "ExtractedTerms" + terms;
	}
}
