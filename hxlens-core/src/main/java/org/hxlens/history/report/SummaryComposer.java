package org.hxlens.history.report;

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
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.HistoryAnalysis;
import org.hxlens.history.om.MedicalEntity;
import org.hxlens.history.om.PatternAnalysis;
import org.hxlens.history.om.RiskLevel;
import org.hxlens.history.om.TermCategory;
import org.hxlens.history.om.TimelineBucket;

/**
 * Arranges a {@link HistoryAnalysis} into the text sections of an emergency
 * summary. Emergency mode adds the alert, recent-history and clinical sections.
 */
public class SummaryComposer {

	public static final String NO_RECORDS_MESSAGE = "No medical records found to summarize.";

	static final Set<String> DIAGNOSIS_LABELS = Set.of("DISEASE", "CONDITION", "PROBLEM");
	static final Set<String> TREATMENT_LABELS = Set.of("TREATMENT", "MEDICATION", "PROCEDURE");
	static final Set<String> FINDING_LABELS = Set.of("SYMPTOM", "SIGN");

	private static final String UNKNOWN_DISEASE = "Unknown";

	private final double minEntityConfidence;

	public SummaryComposer() {
		this(0.5);
	}

	public SummaryComposer(double minEntityConfidence) {
		this.minEntityConfidence = minEntityConfidence;
	}

	public String compose(HistoryAnalysis a, boolean emergencyMode) {
		if (a.getHistory().isEmpty()) {
			return NO_RECORDS_MESSAGE;
		}

		List<String> sections = new ArrayList<>();
		if (emergencyMode) {
			addSection(sections, "CRITICAL ALERTS", criticalAlerts(a));
			addSection(sections, "RECENT HISTORY", recentHistory(a));
		}
		addSection(sections, "MEDICAL PROFILE", medicalProfile(a));
		if (emergencyMode) {
			addSection(sections, "CLINICAL CONSIDERATIONS", clinicalConsiderations(a));
		}
		addSection(sections, "EXTRACTED ENTITIES", extractedEntities(a));
		addSection(sections, "QUICK INSIGHTS", quickInsights(a));
		return String.join("\n\n", sections);
	}

	private List<String> criticalAlerts(HistoryAnalysis a) {
		List<String> lines = new ArrayList<>();
		List<EncounterRecord> severe = new ArrayList<>(a.getRiskBuckets().getOrDefault(RiskLevel.CRITICAL, List.of()));
		severe.addAll(a.getRiskBuckets().getOrDefault(RiskLevel.HIGH, List.of()));
		Set<String> conditions = severe.stream().filter(EncounterRecord::hasDisease).map(EncounterRecord::getDisease)
				.collect(Collectors.toCollection(LinkedHashSet::new));
		if (!conditions.isEmpty()) {
			lines.add("High-Risk Conditions: " + joinFirst(conditions, 5, ", "));
		}
		if (!a.getWarnings().isEmpty()) {
			lines.add("Clinical Warnings: " + joinFirst(a.getWarnings(), 3, "; "));
		}
		return lines;
	}

	private List<String> recentHistory(HistoryAnalysis a) {
		List<String> lines = new ArrayList<>();
		List<EncounterRecord> week = a.getTimeline().getOrDefault(TimelineBucket.LAST_7_DAYS, List.of());
		if (!week.isEmpty()) {
			lines.add("Last 7 Days: " + joinFirst(diseaseNames(week), Integer.MAX_VALUE, ", ") + " (" + week.size()
					+ " visit(s))");
		}
		List<EncounterRecord> month = a.getTimeline().getOrDefault(TimelineBucket.LAST_30_DAYS, List.of());
		if (!month.isEmpty()) {
			lines.add("Last 30 Days: " + joinFirst(diseaseNames(month), 3, ", "));
		}
		return lines;
	}

	private List<String> medicalProfile(HistoryAnalysis a) {
		List<String> lines = new ArrayList<>();
		Set<String> diagnosed = a.getPatterns().getConditionCounts().keySet();
		if (!diagnosed.isEmpty()) {
			lines.add("Diagnosed Conditions: " + joinFirst(diagnosed, 5, ", "));
		}
		Set<String> recurring = a.getPatterns().getRecurringConditions().keySet();
		if (!recurring.isEmpty()) {
			lines.add("Recurring Conditions: " + joinFirst(recurring, 3, ", "));
		}
		Set<String> treatments = a.getTerms().get(TermCategory.TREATMENT);
		if (!treatments.isEmpty()) {
			lines.add("Treatment History: " + joinFirst(treatments, 5, ", "));
		}
		return lines;
	}

	private List<String> clinicalConsiderations(HistoryAnalysis a) {
		List<String> lines = new ArrayList<>();
		Set<String> warningTerms = a.getTerms().get(TermCategory.WARNING);
		if (!warningTerms.isEmpty()) {
			lines.add("Attention Required: " + joinFirst(warningTerms, 5, ", "));
		}
		Set<String> symptoms = a.getTerms().get(TermCategory.SYMPTOM);
		if (!symptoms.isEmpty()) {
			lines.add("Reported Symptoms: " + joinFirst(symptoms, 5, ", "));
		}
		return lines;
	}

	private List<String> extractedEntities(HistoryAnalysis a) {
		List<String> lines = new ArrayList<>();
		if (a.getEntities() == null || a.getEntities().isEmpty()) {
			return lines;
		}
		addEntityLine(lines, "Chief Complaints/Diagnoses", a.getEntities(), DIAGNOSIS_LABELS);
		addEntityLine(lines, "Treatments", a.getEntities(), TREATMENT_LABELS);
		addEntityLine(lines, "Key Symptoms/Findings", a.getEntities(), FINDING_LABELS);
		return lines;
	}

	private void addEntityLine(List<String> lines, String title, List<MedicalEntity> entities, Set<String> labels) {
		Set<String> texts = entities.stream()
				.filter(e -> e.getConfidence() >= minEntityConfidence)
				.filter(e -> e.getLabel() != null && labels.contains(e.getLabel().toUpperCase(Locale.ROOT)))
				.map(MedicalEntity::getText)
				.collect(Collectors.toCollection(LinkedHashSet::new));
		if (!texts.isEmpty()) {
			lines.add(title + ": " + joinFirst(texts, 5, ", "));
		}
	}

	private List<String> quickInsights(HistoryAnalysis a) {
		List<String> lines = new ArrayList<>();
		List<String> distribution = new ArrayList<>();
		for (RiskLevel level : new RiskLevel[] { RiskLevel.CRITICAL, RiskLevel.HIGH, RiskLevel.MEDIUM, RiskLevel.LOW }) {
			int count = a.getRiskBuckets().getOrDefault(level, List.of()).size();
			if (count > 0) {
				distribution.add(StringUtils.capitalize(level.label()) + ": " + count);
			}
		}
		if (!distribution.isEmpty()) {
			lines.add("Risk Distribution: " + String.join(", ", distribution));
		}
		PatternAnalysis p = a.getPatterns();
		lines.add("Risk Trend: " + StringUtils.capitalize(p.getRiskTrend().name().toLowerCase(Locale.ROOT)));
		lines.add("Total Records: " + p.getTotalVisits() + " visits, " + p.getUniqueConditions()
				+ " unique conditions");
		return lines;
	}

	private static List<String> diseaseNames(List<EncounterRecord> records) {
		List<String> names = new ArrayList<>();
		for (EncounterRecord r : records) {
			names.add(r.hasDisease() ? r.getDisease() : UNKNOWN_DISEASE);
		}
		return names;
	}

	private static String joinFirst(Collection<String> values, int limit, String delimiter) {
		return values.stream().limit(limit).collect(Collectors.joining(delimiter));
	}

	private static void addSection(List<String> sections, String title, List<String> lines) {
		if (!lines.isEmpty()) {
			sections.add("=== " + title + " ===\n" + String.join("\n", lines));
		}
	}
}
