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

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.PatientHistory;
import org.hxlens.history.om.RiskLevel;
import org.hxlens.history.om.TimelineBucket;

/**
 * Partitions a history by recency and by severity. Each pass places every
 * record in exactly one bucket and keeps history order inside a bucket.
 * Every bucket is present in the returned map, possibly empty.
 */
public class Categorizer {

	/**
	 * @param today reference day; passed in so results do not depend on the wall clock
	 */
	public Map<TimelineBucket, List<EncounterRecord>> byTimeline(PatientHistory history, LocalDate today) {
		if (today == null) {
			throw new IllegalArgumentException("Reference date is required");
		}
		Map<TimelineBucket, List<EncounterRecord>> buckets = new EnumMap<>(TimelineBucket.class);
		for (TimelineBucket b : TimelineBucket.values()) {
			buckets.put(b, new ArrayList<>());
		}
		for (EncounterRecord r : history) {
			buckets.get(timelineBucket(r, today)).add(r);
		}
		return buckets;
	}

	public Map<RiskLevel, List<EncounterRecord>> byRiskLevel(PatientHistory history) {
		Map<RiskLevel, List<EncounterRecord>> buckets = new EnumMap<>(RiskLevel.class);
		for (RiskLevel level : RiskLevel.values()) {
			buckets.put(level, new ArrayList<>());
		}
		for (EncounterRecord r : history) {
			buckets.get(r.getRiskLevel()).add(r);
		}
		return buckets;
	}

	/** Unknown dates go to {@link TimelineBucket#OLDER} whatever the thresholds say. */
	static TimelineBucket timelineBucket(EncounterRecord r, LocalDate today) {
		if (!r.hasKnownDate()) {
			return TimelineBucket.OLDER;
		}
		long daysAgo = ChronoUnit.DAYS.between(r.getDate(), today);
		return TimelineBucket.forDaysElapsed(daysAgo);
	}
}
