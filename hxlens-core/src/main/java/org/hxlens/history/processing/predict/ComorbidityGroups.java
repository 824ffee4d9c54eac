package org.hxlens.history.processing.predict;

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

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.PatientHistory;

/**
 * Keyword groups of related conditions and the bonus paid when several of them
 * co-occur. Each encounter with a disease label counts once per group it hits.
 */
public final class ComorbidityGroups {

	public enum Group {
		METABOLIC(List.of("diabetes", "obesity", "metabolic syndrome", "cholesterol"), 2, 0.3),
		CARDIOVASCULAR(List.of("hypertension", "heart disease", "coronary", "cardiac"), 2, 0.3),
		RESPIRATORY(List.of("asthma", "copd", "bronchitis", "pneumonia"), 2, 0.2);

		final List<String> keywords;
		final int minCount;
		final double bonus;

		Group(List<String> keywords, int minCount, double bonus) {
			this.keywords = keywords;
			this.minCount = minCount;
			this.bonus = bonus;
		}

		boolean matches(String lowerLabel) {
			for (String k : keywords) {
				if (lowerLabel.contains(k)) {
					return true;
				}
			}
			return false;
		}
	}

	// Metabolic together with cardiovascular
	static final double CROSS_GROUP_BONUS = 0.2;
	static final double MAX_SCORE = 1.0;

	private ComorbidityGroups() {
	}

	public static Map<Group, Integer> countByGroup(PatientHistory history) {
		Map<Group, Integer> counts = new EnumMap<>(Group.class);
		for (Group g : Group.values()) {
			counts.put(g, 0);
		}
		for (EncounterRecord r : history) {
			if (!r.hasDisease())
				continue;
			String label = r.getDisease().toLowerCase(Locale.ROOT);
			for (Group g : Group.values()) {
				if (g.matches(label)) {
					counts.merge(g, 1, Integer::sum);
				}
			}
		}
		return counts;
	}

	public static double score(PatientHistory history) {
		Map<Group, Integer> counts = countByGroup(history);
		double score = 0.0;
		for (Group g : Group.values()) {
			if (counts.get(g) >= g.minCount) {
				score += g.bonus;
			}
		}
		if (counts.get(Group.METABOLIC) >= 1 && counts.get(Group.CARDIOVASCULAR) >= 1) {
			score += CROSS_GROUP_BONUS;
		}
		return Math.min(score, MAX_SCORE);
	}
}
