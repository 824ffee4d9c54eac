package org.hxlens.history.io;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.hxlens.history.om.HealthTrend;
import org.hxlens.history.om.PatientData;
import org.hxlens.history.om.Prediction;
import org.hxlens.history.om.PredictionResult;
import org.hxlens.history.om.RiskLevel;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

class PayloadCodecTest {

	private final PayloadCodec codec = new PayloadCodec(true);
	private final ObjectMapper mapper = new ObjectMapper();

	@Test
	void summary_request_fields_and_defaults() {
		SummaryRequest full = codec.readSummaryRequest("{\"history\":\"Disease: Flu\",\"emergencyMode\":false}");
		assertEquals("Disease: Flu", full.getHistory());
		assertFalse(full.isEmergencyMode());

		SummaryRequest bare = codec.readSummaryRequest("{}");
		assertEquals("", bare.getHistory());
		assertTrue(bare.isEmergencyMode());

		assertFalse(new PayloadCodec(false).readSummaryRequest("{\"history\":null}").isEmergencyMode());
	}

	@Test
	void summary_request_field_types_are_checked() {
		assertThrows(PayloadException.class, () -> codec.readSummaryRequest("{\"history\":42}"));
		assertThrows(PayloadException.class, () -> codec.readSummaryRequest("{\"emergencyMode\":\"yes\"}"));
	}

	@Test
	void malformed_bodies_are_rejected() {
		assertThrows(PayloadException.class, () -> codec.readSummaryRequest(""));
		assertThrows(PayloadException.class, () -> codec.readSummaryRequest("   "));
		assertThrows(PayloadException.class, () -> codec.readSummaryRequest("{not json"));
		assertThrows(PayloadException.class, () -> codec.readPredictionRequest("[1,2,3]"));
		assertThrows(PayloadException.class, () -> codec.readPredictionRequest("\"text\""));
	}

	@Test
	void prediction_request_maps_records_and_aliases() {
		PatientData d = codec.readPredictionRequest("{\"patientData\":{\"age\":61,\"records\":["
				+ "{\"date\":\"2024-11-20\",\"disease\":\"Hypertension\",\"riskLevel\":\"high\",\"extra\":1},"
				+ "{\"disease\":\"Asthma\",\"risk\":\"low\"}]}}");

		assertEquals(61, d.getAge());
		assertEquals(2, d.getRecords().size());
		assertEquals("high", d.getRecords().get(0).getRisk());
		assertEquals("low", d.getRecords().get(1).getRisk());
		assertNull(d.getRecords().get(1).getDate());
	}

	@Test
	void missing_patient_data_or_fields_decode_to_empty_data() {
		PatientData none = codec.readPredictionRequest("{}");
		assertNull(none.getAge());
		assertTrue(none.getRecords().isEmpty());

		PatientData nullRecords = codec.readPredictionRequest("{\"patientData\":{\"records\":null}}");
		assertTrue(nullRecords.getRecords().isEmpty());
	}

	@Test
	void wrong_patient_data_shape_is_rejected() {
		assertThrows(PayloadException.class, () -> codec.readPredictionRequest("{\"patientData\":[]}"));
		assertThrows(PayloadException.class,
				() -> codec.readPredictionRequest("{\"patientData\":{\"age\":\"old\"}}"));
	}

	@Test
	void responses_are_single_json_objects() throws Exception {
		assertEquals("{\"summary\":\"line1\\nline2\"}", codec.writeSummary("line1\nline2"));
		assertEquals("{\"error\":\"Invalid request: empty request body\"}",
				codec.writeError("Invalid request: empty request body"));

		Prediction p = new Prediction();
		p.setCondition("Hypertension");
		p.setRiskScore(40.7);
		p.setRiskLevel(RiskLevel.MEDIUM);
		p.setConfidence(0.82);
		p.setFactors(List.of("Recurring condition"));
		PredictionResult r = new PredictionResult();
		r.setPredictions(List.of(p));
		r.setOverallHealthScore(59.3);
		r.setTrendDirection(HealthTrend.DECLINING);

		JsonNode out = mapper.readTree(codec.writePrediction(r)).get("prediction");
		assertEquals("medium", out.get("predictions").get(0).get("riskLevel").asText());
		assertEquals(40.7, out.get("predictions").get(0).get("riskScore").asDouble(), 1e-9);
		assertEquals(59.3, out.get("overallHealthScore").asDouble(), 1e-9);
		assertEquals("declining", out.get("trendDirection").asText());
	}
}
