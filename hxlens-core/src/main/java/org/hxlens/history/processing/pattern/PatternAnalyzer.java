package org.hxlens.history.processing.pattern;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.PatientHistory;
import org.hxlens.history.om.PatternAnalysis;
import org.hxlens.history.om.RiskTrend;

/**
 * Detects recurring diagnoses and the direction of risk over the most recent
 * encounters.
 * <p>
 * Trend: the risk ordinals (low=1 .. critical=4) of the first
 * {@value #TREND_WINDOW} records are split into the {@value #RECENT_COUNT} most
 * recent ones and the rest. The "older" mean divides by at least one, so an
 * empty remainder counts as zero.
 */
public class PatternAnalyzer {

	static final int TREND_WINDOW = 10;
	static final int RECENT_COUNT = 3;
	static final double TREND_THRESHOLD = 0.5;

	// Ordinal span used to normalize the difference of means
	private static final double PROGRESSION_SCALE = 4.0;

	/** @param history records sorted most-recent-first */
	public PatternAnalysis analyze(PatientHistory history) {
		PatternAnalysis out = new PatternAnalysis();
		out.setTotalVisits(history.size());

		Map<String, Integer> counts = countConditions(history);
		out.setConditionCounts(counts);
		Map<String, Integer> recurring = new LinkedHashMap<>();
		counts.forEach((disease, n) -> {
			if (n > 1) {
				recurring.put(disease, n);
			}
		});
		out.setRecurringConditions(recurring);

		double diff = ordinalDifference(history);
		out.setRiskTrend(trendOf(diff));
		out.setProgressionScore(Math.max(0.0, Math.min(diff / PROGRESSION_SCALE, 1.0)));
		return out;
	}

	/** Occurrences per exact (case-sensitive) disease label. */
	static Map<String, Integer> countConditions(PatientHistory history) {
		Map<String, Integer> counts = new LinkedHashMap<>();
		for (EncounterRecord r : history) {
			if (r.hasDisease()) {
				counts.merge(r.getDisease(), 1, Integer::sum);
			}
		}
		return counts;
	}

	/** recent mean minus older mean; 0 with fewer than two records. */
	static double ordinalDifference(PatientHistory history) {
		List<Integer> ordinals = new ArrayList<>();
		for (EncounterRecord r : history) {
			if (ordinals.size() == TREND_WINDOW)
				break;
			ordinals.add(r.getRiskLevel().getOrdinalValue());
		}
		if (ordinals.size() < 2) {
			return 0.0;
		}
		int split = Math.min(RECENT_COUNT, ordinals.size());
		List<Integer> recent = ordinals.subList(0, split);
		List<Integer> older = ordinals.subList(split, ordinals.size());

		double recentAvg = sum(recent) / (double) recent.size();
		double olderAvg = sum(older) / (double) Math.max(1, older.size());
		return recentAvg - olderAvg;
	}

	static RiskTrend trendOf(double diff) {
		if (diff > TREND_THRESHOLD) {
			return RiskTrend.ESCALATING;
		}
		if (diff < -TREND_THRESHOLD) {
			return RiskTrend.IMPROVING;
		}
		return RiskTrend.STABLE;
	}

	private static int sum(List<Integer> values) {
		int s = 0;
		for (int v : values) {
			s += v;
		}
		return s;
	}
}
