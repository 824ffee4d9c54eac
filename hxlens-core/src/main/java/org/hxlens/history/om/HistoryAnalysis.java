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
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import lombok.Data;

/** Everything the summary needs to know about one parsed history. */
@Data
public class HistoryAnalysis {

	private PatientHistory history = PatientHistory.empty();

	private Map<TimelineBucket, List<EncounterRecord>> timeline = new EnumMap<>(TimelineBucket.class);

	private Map<RiskLevel, List<EncounterRecord>> riskBuckets = new EnumMap<>(RiskLevel.class);

	private PatternAnalysis patterns = new PatternAnalysis();

	// Union of the per-record term extractions
	private ExtractedTerms terms = new ExtractedTerms();

	// Warning sentences and explicit warnings, distinct, first-seen order
	private List<String> warnings = new ArrayList<>();

	private List<MedicalEntity> entities = new ArrayList<>();
}
