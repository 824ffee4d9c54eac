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

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.hxlens.history.om.PatientData;
import org.hxlens.history.om.PredictionResult;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON bodies in and out of the summarizer and predictor.
 * <p>
 * Summarizer request: {@code {"history": "...", "emergencyMode": true}}.
 * Predictor request: {@code {"patientData": {"age": 55, "records": [...]}}}.
 * Both fields of the summarizer request are optional, as is
 * {@code patientData}.
 */
public class PayloadCodec {

	public static final String FIELD_HISTORY = "history";
	public static final String FIELD_EMERGENCY_MODE = "emergencyMode";
	public static final String FIELD_PATIENT_DATA = "patientData";
	public static final String FIELD_SUMMARY = "summary";
	public static final String FIELD_PREDICTION = "prediction";
	public static final String FIELD_ERROR = "error";

	private final ObjectMapper mapper;
	private final boolean defaultEmergencyMode;

	public PayloadCodec(boolean defaultEmergencyMode) {
		this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
		this.defaultEmergencyMode = defaultEmergencyMode;
	}

	public SummaryRequest readSummaryRequest(String body) {
		JsonNode root = readObject(body);

		JsonNode history = root.get(FIELD_HISTORY);
		String text = "";
		if (history != null && !history.isNull()) {
			if (!history.isTextual()) {
				throw new PayloadException("'" + FIELD_HISTORY + "' must be a string");
			}
			text = history.asText();
		}

		boolean emergency = defaultEmergencyMode;
		JsonNode mode = root.get(FIELD_EMERGENCY_MODE);
		if (mode != null && !mode.isNull()) {
			if (!mode.isBoolean()) {
				throw new PayloadException("'" + FIELD_EMERGENCY_MODE + "' must be a boolean");
			}
			emergency = mode.booleanValue();
		}
		return new SummaryRequest(text, emergency);
	}

	/** A missing or null {@code patientData} decodes to empty data. */
	public PatientData readPredictionRequest(String body) {
		JsonNode root = readObject(body);
		JsonNode data = root.get(FIELD_PATIENT_DATA);
		if (data == null || data.isNull()) {
			return new PatientData();
		}
		if (!data.isObject()) {
			throw new PayloadException("'" + FIELD_PATIENT_DATA + "' must be an object");
		}
		try {
			PatientData pd = mapper.treeToValue(data, PatientData.class);
			if (pd.getRecords() == null) {
				pd.setRecords(new PatientData().getRecords());
			}
			return pd;
		} catch (JsonProcessingException e) {
			throw new PayloadException("malformed '" + FIELD_PATIENT_DATA + "': " + e.getOriginalMessage(), e);
		}
	}

	public String writeSummary(String summary) {
		Map<String, Object> out = new LinkedHashMap<>();
		out.put(FIELD_SUMMARY, summary);
		return write(out);
	}

	public String writePrediction(PredictionResult result) {
		Map<String, Object> out = new LinkedHashMap<>();
		out.put(FIELD_PREDICTION, result);
		return write(out);
	}

	public String writeError(String message) {
		Map<String, Object> out = new LinkedHashMap<>();
		out.put(FIELD_ERROR, message);
		return write(out);
	}

	private JsonNode readObject(String body) {
		if (body == null || body.isBlank()) {
			throw new PayloadException("empty request body");
		}
		JsonNode root;
		try {
			root = mapper.readTree(body);
		} catch (IOException e) {
			throw new PayloadException("malformed JSON: " + e.getMessage(), e);
		}
		if (root == null || !root.isObject()) {
			throw new PayloadException("request body must be a JSON object");
		}
		return root;
	}

	private String write(Object value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Unable to serialize response", e);
		}
	}
}
