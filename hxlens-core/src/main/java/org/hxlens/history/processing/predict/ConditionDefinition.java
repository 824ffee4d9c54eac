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

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Declarative scoring rule for one condition.
 * <p>
 * {@code score = min(matches x matchWeight + severeRecords x severityWeight
 * + sum(dependencyScore x dependencyWeight), 1.0)}, where {@code matches} is
 * the number of distinct disease labels containing one of the indicators.
 */
@Value
@Builder
public class ConditionDefinition {

	@NonNull
	String name;

	/** Lower-case substrings looked up in disease labels. */
	@Singular
	List<String> indicators;

	double matchWeight;

	/** Added once per high or critical encounter. */
	double severityWeight;

	/** Condition name to weight; insertion order kept. */
	@Singular
	Map<String, Double> dependencies;

	/** Always given. */
	@Singular
	List<String> recommendations;

	/** Appended when the predicted level is high or critical. */
	@Singular
	List<String> highRiskRecommendations;

	/** Appended when the predicted level is critical. */
	@Singular
	List<String> criticalRecommendations;

	public boolean isComposite() {
		return !dependencies.isEmpty();
	}
}
