package org.hxlens.history.processing.categorize;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.PatientHistory;
import org.hxlens.history.om.RiskLevel;
import org.hxlens.history.om.TimelineBucket;
import org.junit.jupiter.api.Test;

class CategorizerTest {

	private static final LocalDate TODAY = LocalDate.of(2024, 12, 1);

	private final Categorizer categorizer = new Categorizer();

	private static EncounterRecord rec(LocalDate date, String risk) {
		return EncounterRecord.builder().date(date).disease("D-" + date).riskLabel(risk).build();
	}

	@Test
	void timeline_boundaries_are_inclusive() {
		EncounterRecord d0 = rec(TODAY, "low");
		EncounterRecord d7 = rec(TODAY.minusDays(7), "low");
		EncounterRecord d8 = rec(TODAY.minusDays(8), "low");
		EncounterRecord d30 = rec(TODAY.minusDays(30), "low");
		EncounterRecord d90 = rec(TODAY.minusDays(90), "low");
		EncounterRecord d91 = rec(TODAY.minusDays(91), "low");

		Map<TimelineBucket, List<EncounterRecord>> b = categorizer
				.byTimeline(PatientHistory.of(List.of(d0, d7, d8, d30, d90, d91)), TODAY);

		assertEquals(List.of(d0, d7), b.get(TimelineBucket.LAST_7_DAYS));
		assertEquals(List.of(d8, d30), b.get(TimelineBucket.LAST_30_DAYS));
		assertEquals(List.of(d90), b.get(TimelineBucket.LAST_90_DAYS));
		assertEquals(List.of(d91), b.get(TimelineBucket.OLDER));
	}

	@Test
	void unknown_and_absent_dates_are_older() {
		EncounterRecord garbled = rec(EncounterRecord.UNKNOWN_DATE, "low");
		EncounterRecord undated = EncounterRecord.builder().disease("X").build();

		Map<TimelineBucket, List<EncounterRecord>> b = categorizer
				.byTimeline(PatientHistory.of(List.of(garbled, undated)), TODAY);

		assertEquals(2, b.get(TimelineBucket.OLDER).size());
		assertTrue(b.get(TimelineBucket.LAST_7_DAYS).isEmpty());
	}

	@Test
	void every_bucket_is_present_even_when_empty() {
		Map<TimelineBucket, List<EncounterRecord>> b = categorizer.byTimeline(PatientHistory.empty(), TODAY);
		assertEquals(TimelineBucket.values().length, b.size());

		Map<RiskLevel, List<EncounterRecord>> r = categorizer.byRiskLevel(PatientHistory.empty());
		assertEquals(RiskLevel.values().length, r.size());
	}

	@Test
	void risk_buckets_use_resolved_levels() {
		EncounterRecord crit = rec(TODAY, "Critical");
		EncounterRecord high = rec(TODAY.minusDays(1), "high");
		EncounterRecord odd = rec(TODAY.minusDays(2), "severe");
		EncounterRecord none = rec(TODAY.minusDays(3), null);

		Map<RiskLevel, List<EncounterRecord>> r = categorizer
				.byRiskLevel(PatientHistory.of(List.of(crit, high, odd, none)));

		assertEquals(List.of(crit), r.get(RiskLevel.CRITICAL));
		assertEquals(List.of(high), r.get(RiskLevel.HIGH));
		assertTrue(r.get(RiskLevel.MEDIUM).isEmpty());
		assertEquals(List.of(odd, none), r.get(RiskLevel.LOW));
	}

	@Test
	void reference_date_is_required() {
		assertThrows(IllegalArgumentException.class, () -> categorizer.byTimeline(PatientHistory.empty(), null));
	}
}
