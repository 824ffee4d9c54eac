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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered set of {@link ConditionDefinition}s. Catalog order is the tie-break
 * order of predictions with equal scores.
 */
public final class ConditionCatalog {

	public static final String TYPE_2_DIABETES = "Type 2 Diabetes";
	public static final String HYPERTENSION = "Hypertension";
	public static final String HEART_DISEASE = "Heart Disease";
	public static final String STROKE = "Stroke";
	public static final String KIDNEY_DISEASE = "Kidney Disease";

	public static final String FOLLOW_UP_RECOMMENDATION = "Schedule follow-up appointment within 2 weeks";
	public static final int MAX_RECOMMENDATIONS = 5;

	private final Map<String, ConditionDefinition> byName;
	private final List<ConditionDefinition> evaluationOrder;

	/**
	 * @throws IllegalStateException on duplicate names, unknown dependencies or
	 *                               dependency cycles
	 */
	public ConditionCatalog(List<ConditionDefinition> definitions) {
		Map<String, ConditionDefinition> map = new LinkedHashMap<>();
		for (ConditionDefinition d : definitions) {
			if (map.put(d.getName(), d) != null) {
				throw new IllegalStateException("Duplicate condition: " + d.getName());
			}
		}
		this.byName = Collections.unmodifiableMap(map);
		this.evaluationOrder = Collections.unmodifiableList(topologicalOrder(map));
	}

	/** The built-in conditions. */
	public static ConditionCatalog defaults() {
		List<ConditionDefinition> defs = new ArrayList<>();

		defs.add(ConditionDefinition.builder().name(TYPE_2_DIABETES)
				.indicator("diabetes").indicator("blood sugar").indicator("glucose").indicator("insulin")
				.matchWeight(0.3)
				.recommendation("Regular blood sugar monitoring")
				.recommendation("Maintain healthy diet with controlled carbohydrate intake")
				.highRiskRecommendation("Consult endocrinologist for medication review")
				.highRiskRecommendation("Consider continuous glucose monitoring")
				.build());

		defs.add(ConditionDefinition.builder().name(HYPERTENSION)
				.indicator("hypertension").indicator("blood pressure").indicator("bp")
				.matchWeight(0.3)
				.recommendation("Monitor blood pressure regularly")
				.recommendation("Reduce sodium intake")
				.recommendation("Regular cardiovascular exercise")
				.highRiskRecommendation("Immediate consultation with cardiologist recommended")
				.build());

		defs.add(ConditionDefinition.builder().name(HEART_DISEASE)
				.indicator("heart").indicator("cardiac").indicator("coronary").indicator("chest pain")
				.matchWeight(0.25)
				.severityWeight(0.1)
				.recommendation("Regular cardiac checkups")
				.recommendation("Stress management and adequate rest")
				.recommendation("Heart-healthy diet (low saturated fat)")
				.criticalRecommendation("Emergency cardiac evaluation recommended")
				.build());

		defs.add(ConditionDefinition.builder().name(STROKE)
				.dependency(HYPERTENSION, 0.4)
				.dependency(TYPE_2_DIABETES, 0.3)
				.dependency(HEART_DISEASE, 0.3)
				.recommendation("Control blood pressure and blood sugar")
				.recommendation("Regular neurological assessments")
				.recommendation("Antiplatelet therapy as prescribed")
				.highRiskRecommendation("Immediate stroke risk assessment needed")
				.build());

		defs.add(ConditionDefinition.builder().name(KIDNEY_DISEASE)
				.indicator("kidney").indicator("renal").indicator("creatinine")
				.matchWeight(0.2)
				.dependency(HYPERTENSION, 0.3)
				.dependency(TYPE_2_DIABETES, 0.3)
				.recommendation("Regular kidney function tests")
				.recommendation("Stay well hydrated")
				.recommendation("Limit protein and sodium intake")
				.highRiskRecommendation("Nephrology consultation recommended")
				.build());

		return new ConditionCatalog(defs);
	}

	/** Definitions in catalog order. */
	public List<ConditionDefinition> getDefinitions() {
		return new ArrayList<>(byName.values());
	}

	/** Definitions ordered so that every dependency precedes its dependents. */
	public List<ConditionDefinition> getEvaluationOrder() {
		return evaluationOrder;
	}

	/** Position of a condition in catalog order, -1 when unknown. */
	public int indexOf(String name) {
		int i = 0;
		for (String n : byName.keySet()) {
			if (n.equals(name)) {
				return i;
			}
			i++;
		}
		return -1;
	}

	/** Kahn's algorithm; ready nodes are taken in catalog order so the result is stable. */
	private static List<ConditionDefinition> topologicalOrder(Map<String, ConditionDefinition> defs) {
		Map<String, Integer> pending = new HashMap<>();
		Map<String, List<String>> dependents = new HashMap<>();
		for (ConditionDefinition d : defs.values()) {
			pending.put(d.getName(), d.getDependencies().size());
			for (String dep : d.getDependencies().keySet()) {
				if (!defs.containsKey(dep)) {
					throw new IllegalStateException(d.getName() + " depends on unknown condition: " + dep);
				}
				dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(d.getName());
			}
		}

		List<ConditionDefinition> order = new ArrayList<>();
		Deque<String> ready = new ArrayDeque<>();
		for (ConditionDefinition d : defs.values()) {
			if (pending.get(d.getName()) == 0) {
				ready.add(d.getName());
			}
		}
		while (!ready.isEmpty()) {
			String name = ready.poll();
			order.add(defs.get(name));
			for (String dependent : dependents.getOrDefault(name, Collections.emptyList())) {
				if (pending.merge(dependent, -1, Integer::sum) == 0) {
					ready.add(dependent);
				}
			}
		}
		if (order.size() != defs.size()) {
			throw new IllegalStateException("Cyclic condition dependencies detected");
		}
		return order;
	}
}
