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

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health direction reported with a prediction. It is the inverse view of
 * {@link RiskTrend}: escalating risk means declining health.
 */
public enum HealthTrend {
	DECLINING, IMPROVING, STABLE;

	public static HealthTrend fromRiskTrend(RiskTrend trend) {
		if (trend == RiskTrend.ESCALATING) {
			return DECLINING;
		}
		if (trend == RiskTrend.IMPROVING) {
			return IMPROVING;
		}
		return STABLE;
	}

	@JsonValue
	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
