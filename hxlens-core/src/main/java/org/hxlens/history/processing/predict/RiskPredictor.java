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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.hxlens.history.om.ConditionRiskProfile;
import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.HealthTrend;
import org.hxlens.history.om.PatientHistory;
import org.hxlens.history.om.PatternAnalysis;
import org.hxlens.history.om.Prediction;
import org.hxlens.history.om.PredictionResult;
import org.hxlens.history.om.RiskLevel;
import org.hxlens.history.processing.categorize.Categorizer;
import org.hxlens.history.util.Logger;

/**
 * Combines age, history, trend, recurrence and comorbidity signals into a
 * per-condition risk prediction.
 *
 * <pre>
 * riskScore = 100 x ( age        x 0.15
 *                   + history    x 0.35
 *                   + progression x 0.25
 *                   + 0.15 if the condition name is a recurring disease label
 *                   + comorbidity x 0.10 )
 * </pre>
 *
 * Conditions without evidence in the history are not reported.
 */
public class RiskPredictor {

	static final double AGE_WEIGHT = 0.15;
	static final double HISTORY_WEIGHT = 0.35;
	static final double PROGRESSION_WEIGHT = 0.25;
	static final double RECURRENCE_BONUS = 0.15;
	static final double COMORBIDITY_WEIGHT = 0.10;

	static final double BASE_CONFIDENCE = 0.7;
	static final double CONFIDENCE_PER_RECORD = 0.03;
	static final double MAX_CONFIDENCE = 0.95;

	static final int FACTOR_AGE = 60;
	static final double FACTOR_HISTORY = 0.3;
	static final double FACTOR_PROGRESSION = 0.3;
	static final double FACTOR_COMORBIDITY = 0.2;

	private final ConditionCatalog catalog;
	private final Categorizer categorizer;

	public RiskPredictor() {
		this(ConditionCatalog.defaults(), new Categorizer());
	}

	public RiskPredictor(ConditionCatalog catalog, Categorizer categorizer) {
		this.catalog = catalog;
		this.categorizer = categorizer;
	}

	/**
	 * @param history  records sorted most-recent-first
	 * @param age      patient age in years
	 * @param patterns output of the pattern analyzer for the same history
	 */
	public PredictionResult predict(PatientHistory history, int age, PatternAnalysis patterns) {
		double ageRisk = AgeBrackets.riskFor(age);
		double progression = patterns.getProgressionScore();
		double comorbidity = ComorbidityGroups.score(history);
		Map<String, ConditionRiskProfile> profiles = computeProfiles(history);

		List<Prediction> predictions = new ArrayList<>();
		for (ConditionDefinition def : catalog.getDefinitions()) {
			ConditionRiskProfile profile = profiles.get(def.getName());
			if (!profile.isEvidenced() || profile.getHistoryScore() <= 0.0) {
				continue; // no evidence, no prediction
			}
			boolean recurring = patterns.isRecurring(def.getName());

			double raw = ageRisk * AGE_WEIGHT
					+ profile.getHistoryScore() * HISTORY_WEIGHT
					+ progression * PROGRESSION_WEIGHT
					+ (recurring ? RECURRENCE_BONUS : 0.0)
					+ comorbidity * COMORBIDITY_WEIGHT;
			double score = round1(raw * 100.0);
			RiskLevel level = RiskLevel.fromScore(score);

			Prediction p = new Prediction();
			p.setCondition(def.getName());
			p.setRiskScore(score);
			p.setRiskLevel(level);
			p.setConfidence(confidence(history.size()));
			p.setFactors(factors(age, profile.getHistoryScore(), progression, recurring, comorbidity));
			p.setRecommendations(recommendations(def, level));
			predictions.add(p);

			Logger.debug("{}: history={} score={} level={}", def.getName(), profile.getHistoryScore(), score,
					level.label());
		}

		// List.sort is stable, so equal scores keep catalog order
		predictions.sort(Comparator.comparingDouble(Prediction::getRiskScore).reversed());

		PredictionResult result = new PredictionResult();
		result.setPredictions(predictions);
		result.setOverallHealthScore(overallHealthScore(predictions));
		result.setTrendDirection(HealthTrend.fromRiskTrend(patterns.getRiskTrend()));
		return result;
	}

	/**
	 * History score of every catalog condition, evaluated in dependency order so
	 * that composite conditions read finalized scores. Returned in catalog order.
	 */
	public Map<String, ConditionRiskProfile> computeProfiles(PatientHistory history) {
		Set<String> labels = distinctDiseaseLabels(history);
		Map<RiskLevel, List<EncounterRecord>> byRisk = categorizer.byRiskLevel(history);
		int severeRecords = byRisk.get(RiskLevel.HIGH).size() + byRisk.get(RiskLevel.CRITICAL).size();

		Map<String, ConditionRiskProfile> computed = new LinkedHashMap<>();
		for (ConditionDefinition def : catalog.getEvaluationOrder()) {
			int matches = countMatches(labels, def.getIndicators());
			double score = matches * def.getMatchWeight() + severeRecords * def.getSeverityWeight();
			boolean evidenced = matches > 0;
			for (Map.Entry<String, Double> dep : def.getDependencies().entrySet()) {
				ConditionRiskProfile upstream = computed.get(dep.getKey());
				score += upstream.getHistoryScore() * dep.getValue();
				if (def.getIndicators().isEmpty()) {
					evidenced |= upstream.isEvidenced();
				}
			}
			computed.put(def.getName(),
					new ConditionRiskProfile(def.getName(), matches, Math.min(score, 1.0), evidenced));
		}

		Map<String, ConditionRiskProfile> inCatalogOrder = new LinkedHashMap<>();
		for (ConditionDefinition def : catalog.getDefinitions()) {
			inCatalogOrder.put(def.getName(), computed.get(def.getName()));
		}
		return inCatalogOrder;
	}

	/** Distinct labels, compared exactly; lower-cased afterwards for matching. */
	static Set<String> distinctDiseaseLabels(PatientHistory history) {
		Set<String> distinct = new LinkedHashSet<>();
		for (EncounterRecord r : history) {
			if (r.hasDisease()) {
				distinct.add(r.getDisease());
			}
		}
		return distinct;
	}

	static int countMatches(Set<String> labels, List<String> indicators) {
		if (indicators.isEmpty()) {
			return 0;
		}
		int n = 0;
		for (String label : labels) {
			String lower = label.toLowerCase(Locale.ROOT);
			for (String indicator : indicators) {
				if (lower.contains(indicator)) {
					n++;
					break;
				}
			}
		}
		return n;
	}

	static double confidence(int recordCount) {
		return Math.min(BASE_CONFIDENCE + recordCount * CONFIDENCE_PER_RECORD, MAX_CONFIDENCE);
	}

	static List<String> factors(int age, double historyScore, double progression, boolean recurring,
			double comorbidity) {
		List<String> factors = new ArrayList<>();
		if (age >= FACTOR_AGE) {
			factors.add("Age factor: " + age + " years");
		}
		if (historyScore > FACTOR_HISTORY) {
			factors.add("Existing medical history");
		}
		if (progression > FACTOR_PROGRESSION) {
			factors.add("Increasing risk trend");
		}
		if (recurring) {
			factors.add("Recurring condition");
		}
		if (comorbidity > FACTOR_COMORBIDITY) {
			factors.add("Related health conditions present");
		}
		return factors;
	}

	static List<String> recommendations(ConditionDefinition def, RiskLevel level) {
		List<String> recs = new ArrayList<>(def.getRecommendations());
		if (level.isAtLeastHigh()) {
			recs.addAll(def.getHighRiskRecommendations());
		}
		if (level == RiskLevel.CRITICAL) {
			recs.addAll(def.getCriticalRecommendations());
		}
		if (level.isAtLeastHigh()) {
			recs.add(ConditionCatalog.FOLLOW_UP_RECOMMENDATION);
		}
		return recs.size() > ConditionCatalog.MAX_RECOMMENDATIONS
				? new ArrayList<>(recs.subList(0, ConditionCatalog.MAX_RECOMMENDATIONS))
				: recs;
	}

	static double overallHealthScore(List<Prediction> predictions) {
		if (predictions.isEmpty()) {
			return PredictionResult.DEFAULT_HEALTH_SCORE;
		}
		double sum = 0.0;
		for (Prediction p : predictions) {
			sum += p.getRiskScore();
		}
		return round1(Math.max(0.0, 100.0 - sum / predictions.size()));
	}

	/** Half-even rounding of the exact binary value to one decimal. */
	static double round1(double value) {
		return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
	}
}
