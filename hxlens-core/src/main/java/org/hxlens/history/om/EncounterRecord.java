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

import java.time.LocalDate;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One clinical visit parsed from a raw history block.
 * <p>
 * Fields that are absent from the source text stay {@code null}. A
 * {@code Date:} label whose value cannot be parsed carries
 * {@link #UNKNOWN_DATE} so the record sorts as the oldest one.
 */
@Value
@Builder(toBuilder = true)
public class EncounterRecord {

	/** Sentinel for a date that was present but could not be parsed. */
	public static final LocalDate UNKNOWN_DATE = LocalDate.of(1900, 1, 1);

	LocalDate date;
	String disease;
	String description;
	String treatment;
	/** Risk label as written in the source; see {@link #getRiskLevel()}. */
	String riskLabel;
	String warnings;
	@NonNull
	@Builder.Default
	String rawText = "";

	public RiskLevel getRiskLevel() {
		return RiskLevel.fromLabel(riskLabel);
	}

	/** False when the date is absent or the parse sentinel. */
	public boolean hasKnownDate() {
		return date != null && !UNKNOWN_DATE.equals(date);
	}

	/** Date used for ordering: absent dates rank with the sentinel. */
	public LocalDate getSortDate() {
		return date == null ? UNKNOWN_DATE : date;
	}

	public boolean hasDisease() {
		return disease != null && !disease.isBlank();
	}
}
