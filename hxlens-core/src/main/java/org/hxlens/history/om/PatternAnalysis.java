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

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;

/** Recurrence and trend signals derived from a {@link PatientHistory}. */
@Data
public class PatternAnalysis {

	// Disease label -> occurrences, in first-seen order
	private Map<String, Integer> conditionCounts = new LinkedHashMap<>();

	// Labels seen more than once
	private Map<String, Integer> recurringConditions = new LinkedHashMap<>();

	private RiskTrend riskTrend = RiskTrend.STABLE;

	// Normalized (recent - older) ordinal difference, clamped to [0,1]
	private double progressionScore;

	private int totalVisits;

	public int getUniqueConditions() {
		return conditionCounts.size();
	}

	public boolean isRecurring(String disease) {
		return disease != null && recurringConditions.containsKey(disease);
	}
}
