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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.hxlens.history.om.ConditionRiskProfile;
import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.HealthTrend;
import org.hxlens.history.om.PatientHistory;
import org.hxlens.history.om.Prediction;
import org.hxlens.history.om.PredictionResult;
import org.hxlens.history.om.RiskLevel;
import org.hxlens.history.processing.categorize.Categorizer;
import org.hxlens.history.processing.pattern.PatternAnalyzer;
import org.junit.jupiter.api.Test;

class RiskPredictorTest {

	private final PatternAnalyzer analyzer = new PatternAnalyzer();
	private final RiskPredictor predictor = new RiskPredictor();

	private static EncounterRecord rec(String date, String disease, String risk) {
		return EncounterRecord.builder().date(LocalDate.parse(date)).disease(disease).riskLabel(risk).build();
	}

	private static PatientHistory scenario() {
		return PatientHistory.of(List.of(
				rec("2024-11-20", "Hypertension", "high"),
				rec("2024-11-15", "Type 2 Diabetes", "high"),
				rec("2024-10-10", "Hypertension", "medium"),
				rec("2024-09-05", "Acute Bronchitis", "medium")));
	}

	private PredictionResult predict(PatientHistory h, int age) {
		return predictor.predict(h, age, analyzer.analyze(h));
	}

	private static Prediction find(PredictionResult r, String condition) {
		return r.getPredictions().stream().filter(p -> p.getCondition().equals(condition)).findFirst().orElse(null);
	}

	@Test
	void scenario_hypertension_is_medium_at_40_7() {
		PredictionResult r = predict(scenario(), 55);

		Prediction htn = find(r, ConditionCatalog.HYPERTENSION);
		assertEquals(40.7, htn.getRiskScore(), 1e-9);
		assertEquals(RiskLevel.MEDIUM, htn.getRiskLevel());
		assertEquals(0.82, htn.getConfidence(), 1e-9);
		assertEquals(List.of("Recurring condition", "Related health conditions present"), htn.getFactors());
		assertEquals(List.of("Monitor blood pressure regularly", "Reduce sodium intake",
				"Regular cardiovascular exercise"), htn.getRecommendations());
	}

	@Test
	void scenario_full_result() {
		PredictionResult r = predict(scenario(), 55);

		List<String> order = r.getPredictions().stream().map(Prediction::getCondition).collect(Collectors.toList());
		assertEquals(List.of(ConditionCatalog.HYPERTENSION, ConditionCatalog.TYPE_2_DIABETES, ConditionCatalog.STROKE),
				order);

		assertEquals(25.7, find(r, ConditionCatalog.TYPE_2_DIABETES).getRiskScore(), 1e-9);
		assertEquals(24.6, find(r, ConditionCatalog.STROKE).getRiskScore(), 1e-9);
		assertEquals(RiskLevel.LOW, find(r, ConditionCatalog.STROKE).getRiskLevel());

		// severe encounters alone are not evidence of heart disease
		assertNull(find(r, ConditionCatalog.HEART_DISEASE));
		// nor is a related condition evidence of kidney disease
		assertNull(find(r, ConditionCatalog.KIDNEY_DISEASE));

		assertEquals(69.7, r.getOverallHealthScore(), 1e-9);
		assertEquals(HealthTrend.DECLINING, r.getTrendDirection());
	}

	@Test
	void scenario_profiles_and_comorbidity() {
		Map<String, ConditionRiskProfile> profiles = predictor.computeProfiles(scenario());

		assertEquals(0.3, profiles.get(ConditionCatalog.HYPERTENSION).getHistoryScore(), 1e-9);
		assertEquals(0.3, profiles.get(ConditionCatalog.TYPE_2_DIABETES).getHistoryScore(), 1e-9);
		assertEquals(0.2, profiles.get(ConditionCatalog.HEART_DISEASE).getHistoryScore(), 1e-9);
		assertFalse(profiles.get(ConditionCatalog.HEART_DISEASE).isEvidenced());
		assertEquals(0.27, profiles.get(ConditionCatalog.STROKE).getHistoryScore(), 1e-9);
		assertTrue(profiles.get(ConditionCatalog.STROKE).isEvidenced());
		assertEquals(0.18, profiles.get(ConditionCatalog.KIDNEY_DISEASE).getHistoryScore(), 1e-9);
		assertFalse(profiles.get(ConditionCatalog.KIDNEY_DISEASE).isEvidenced());

		assertEquals(0.5, ComorbidityGroups.score(scenario()), 1e-9);
	}

	@Test
	void hypertension_alone_does_not_predict_kidney_disease() {
		PatientHistory h = PatientHistory.of(List.of(rec("2024-11-20", "Hypertension", "high")));

		PredictionResult r = predict(h, 55);

		assertEquals(16.5, find(r, ConditionCatalog.HYPERTENSION).getRiskScore(), 1e-9);
		// Stroke has no indicators of its own and follows hypertension
		assertEquals(11.2, find(r, ConditionCatalog.STROKE).getRiskScore(), 1e-9);
		assertNull(find(r, ConditionCatalog.KIDNEY_DISEASE));
		assertTrue(predictor.computeProfiles(h).get(ConditionCatalog.KIDNEY_DISEASE).getHistoryScore() > 0.0);
	}

	@Test
	void kidney_disease_is_predicted_from_its_own_indicator() {
		PatientHistory h = PatientHistory.of(List.of(
				rec("2024-11-20", "Hypertension", "high"),
				rec("2024-11-01", "Chronic Kidney Disease", "medium")));

		PredictionResult r = predict(h, 55);

		Prediction kidney = find(r, ConditionCatalog.KIDNEY_DISEASE);
		assertTrue(kidney != null && kidney.getRiskScore() > 0.0);
		assertTrue(predictor.computeProfiles(h).get(ConditionCatalog.KIDNEY_DISEASE).isEvidenced());
	}

	@Test
	void composite_scores_do_not_depend_on_catalog_order() {
		List<ConditionDefinition> reversed = new ArrayList<>(ConditionCatalog.defaults().getDefinitions());
		Collections.reverse(reversed);
		RiskPredictor reversedPredictor = new RiskPredictor(new ConditionCatalog(reversed), new Categorizer());

		Map<String, ConditionRiskProfile> expected = predictor.computeProfiles(scenario());
		Map<String, ConditionRiskProfile> actual = reversedPredictor.computeProfiles(scenario());

		// Stroke read before its inputs would have scored 0
		assertEquals(expected.get(ConditionCatalog.STROKE).getHistoryScore(),
				actual.get(ConditionCatalog.STROKE).getHistoryScore(), 1e-12);
		assertEquals(expected.get(ConditionCatalog.KIDNEY_DISEASE).getHistoryScore(),
				actual.get(ConditionCatalog.KIDNEY_DISEASE).getHistoryScore(), 1e-12);

		// profiles come back in the catalog's own order
		assertEquals(ConditionCatalog.KIDNEY_DISEASE, actual.keySet().iterator().next());
	}

	@Test
	void conditions_without_evidence_are_not_predicted() {
		PatientHistory h = PatientHistory.of(List.of(
				rec("2024-05-01", "Migraine", "critical"),
				rec("2024-04-01", "Fracture", "high")));

		PredictionResult r = predict(h, 80);

		assertTrue(r.getPredictions().isEmpty());
		assertEquals(PredictionResult.DEFAULT_HEALTH_SCORE, r.getOverallHealthScore(), 1e-9);
	}

	@Test
	void empty_history_scores_85_and_stable() {
		PredictionResult r = predict(PatientHistory.empty(), 30);

		assertTrue(r.getPredictions().isEmpty());
		assertEquals(85.0, r.getOverallHealthScore(), 1e-9);
		assertEquals(HealthTrend.STABLE, r.getTrendDirection());
	}

	@Test
	void levels_always_match_the_score_thresholds() {
		PredictionResult r = predict(PatientHistory.of(List.of(
				rec("2024-06-03", "Heart failure", "critical"),
				rec("2024-06-02", "Coronary artery disease", "critical"),
				rec("2024-06-01", "Hypertension", "critical"),
				rec("2024-01-01", "Hypertension", "low"))), 78);

		assertFalse(r.getPredictions().isEmpty());
		for (Prediction p : r.getPredictions()) {
			assertEquals(RiskLevel.fromScore(p.getRiskScore()), p.getRiskLevel(), p.getCondition());
			assertTrue(p.getRecommendations().size() <= ConditionCatalog.MAX_RECOMMENDATIONS);
		}
		double prev = Double.MAX_VALUE;
		for (Prediction p : r.getPredictions()) {
			assertTrue(p.getRiskScore() <= prev);
			prev = p.getRiskScore();
		}
	}

	@Test
	void recurrence_bonus_needs_a_literal_label_match() {
		PatientHistory h = PatientHistory.of(List.of(
				rec("2024-03-03", "Stroke", "medium"),
				rec("2024-03-02", "Stroke", "medium"),
				rec("2024-03-01", "Hypertension", "medium")));

		Prediction stroke = find(predict(h, 50), ConditionCatalog.STROKE);

		assertTrue(stroke.getFactors().contains("Recurring condition"));
	}

	@Test
	void severe_levels_add_escalation_advice_within_the_cap() {
		ConditionDefinition diabetes = ConditionCatalog.defaults().getDefinitions().get(0);

		List<String> high = RiskPredictor.recommendations(diabetes, RiskLevel.HIGH);
		assertEquals(5, high.size());
		assertEquals(ConditionCatalog.FOLLOW_UP_RECOMMENDATION, high.get(4));

		assertEquals(2, RiskPredictor.recommendations(diabetes, RiskLevel.LOW).size());

		ConditionDefinition heart = ConditionCatalog.defaults().getDefinitions().get(2);
		List<String> critical = RiskPredictor.recommendations(heart, RiskLevel.CRITICAL);
		assertTrue(critical.contains("Emergency cardiac evaluation recommended"));
		assertEquals(5, critical.size());
	}

	@Test
	void confidence_grows_with_records_and_caps() {
		assertEquals(0.7, RiskPredictor.confidence(0), 1e-9);
		assertEquals(0.85, RiskPredictor.confidence(5), 1e-9);
		assertEquals(0.95, RiskPredictor.confidence(20), 1e-9);
	}

	@Test
	void factors_reflect_each_threshold() {
		List<String> f = RiskPredictor.factors(60, 0.31, 0.31, false, 0.21);

		assertEquals(List.of("Age factor: 60 years", "Existing medical history", "Increasing risk trend",
				"Related health conditions present"), f);
		assertTrue(RiskPredictor.factors(59, 0.3, 0.3, false, 0.2).isEmpty());
	}

	@Test
	void rounding_is_to_one_decimal() {
		assertEquals(40.7, RiskPredictor.round1(40.66666666), 1e-9);
		assertEquals(21.5, RiskPredictor.round1(21.46666666), 1e-9);
		assertEquals(85.0, RiskPredictor.round1(85.0), 1e-9);
	}

	@Test
	void severity_counts_come_from_the_categorizer() {
		Categorizer categorizer = spy(new Categorizer());
		RiskPredictor p = new RiskPredictor(ConditionCatalog.defaults(), categorizer);

		p.computeProfiles(scenario());

		verify(categorizer, times(1)).byRiskLevel(any(PatientHistory.class));
	}
}
