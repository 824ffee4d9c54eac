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
 * Severity tier of an encounter or a prediction. The ordinal value is the
 * integer used for trend arithmetic.
 */
public enum RiskLevel {

	LOW(1), MEDIUM(2), HIGH(3), CRITICAL(4);

	private final int ordinalValue;

	RiskLevel(int ordinalValue) {
		this.ordinalValue = ordinalValue;
	}

	public int getOrdinalValue() {
		return ordinalValue;
	}

	@JsonValue
	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}

	public boolean isAtLeastHigh() {
		return this == HIGH || this == CRITICAL;
	}

	/**
	 * Resolve a free-text risk label. Matching is case-insensitive; null, blank
	 * and unrecognized values resolve to {@link #LOW}.
	 */
	public static RiskLevel fromLabel(String label) {
		if (label == null) {
			return LOW;
		}
		String key = label.trim().toLowerCase(Locale.ROOT);
		for (RiskLevel level : values()) {
			if (level.label().equals(key)) {
				return level;
			}
		}
		return LOW;
	}

	/** Thresholds on a 0-100 score; a value exactly on a boundary takes the higher tier. */
	public static RiskLevel fromScore(double score) {
		if (score >= 75) {
			return CRITICAL;
		}
		if (score >= 50) {
			return HIGH;
		}
		if (score >= 25) {
			return MEDIUM;
		}
		return LOW;
	}
}
