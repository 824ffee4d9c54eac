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

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Data;

/** Output of the risk predictor for one patient. */
@Data
@JsonPropertyOrder({ "predictions", "overallHealthScore", "trendDirection" })
public class PredictionResult {

	/** Score reported when no condition has any evidence. */
	public static final double DEFAULT_HEALTH_SCORE = 85.0;

	// Highest risk first
	private List<Prediction> predictions = new ArrayList<>();

	private double overallHealthScore = DEFAULT_HEALTH_SCORE;

	private HealthTrend trendDirection = HealthTrend.STABLE;
}
