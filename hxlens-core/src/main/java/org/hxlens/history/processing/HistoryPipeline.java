package org.hxlens.history.processing;

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

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.hxlens.history.conf.ConfigLoader;
import org.hxlens.history.nlp.EntityExtractor;
import org.hxlens.history.nlp.OpenNlpEntityExtractor;
import org.hxlens.history.om.EncounterInput;
import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.ExtractedTerms;
import org.hxlens.history.om.HistoryAnalysis;
import org.hxlens.history.om.MedicalEntity;
import org.hxlens.history.om.PatientData;
import org.hxlens.history.om.PatientHistory;
import org.hxlens.history.om.PatternAnalysis;
import org.hxlens.history.om.PredictionResult;
import org.hxlens.history.processing.categorize.Categorizer;
import org.hxlens.history.processing.extract.TermExtractor;
import org.hxlens.history.processing.extract.TermPatternCatalog;
import org.hxlens.history.processing.parse.DateParser;
import org.hxlens.history.processing.parse.RecordParser;
import org.hxlens.history.processing.pattern.PatternAnalyzer;
import org.hxlens.history.processing.predict.RiskPredictor;
import org.hxlens.history.report.SummaryComposer;
import org.hxlens.history.util.Logger;

/**
 * Wires the parsing, extraction, categorization and prediction steps into the
 * two use cases: an emergency summary of a raw history and a risk prediction
 * for structured records.
 * <p>
 * The pipeline holds no per-request state. "Today" comes from the injected
 * {@link Clock}, which tests pin to a fixed instant.
 */
public class HistoryPipeline {

	private final ConfigLoader cfg;
	private final Clock clock;

	private final DateParser dateParser;
	private final RecordParser parser;
	private final TermExtractor termExtractor;
	private final Categorizer categorizer;
	private final PatternAnalyzer patternAnalyzer;
	private final RiskPredictor predictor;
	private final SummaryComposer composer;
	private final EntityExtractor entityExtractor;

	public HistoryPipeline(ConfigLoader cfg, Clock clock) {
		this(cfg, clock, OpenNlpEntityExtractor.forModel(cfg.getNerModelPath()));
	}

	public HistoryPipeline(ConfigLoader cfg, Clock clock, EntityExtractor entityExtractor) {
		this.cfg = cfg;
		this.clock = clock;
		this.dateParser = new DateParser(cfg.getDateFormats());
		this.parser = new RecordParser(cfg.getRecordSeparator(), dateParser);
		this.termExtractor = new TermExtractor(TermPatternCatalog.load(cfg.getTermRules()));
		this.categorizer = new Categorizer();
		this.patternAnalyzer = new PatternAnalyzer();
		this.predictor = new RiskPredictor();
		this.composer = new SummaryComposer(cfg.getNerMinConfidence());
		this.entityExtractor = entityExtractor;
	}

	/** Parse and analyze a raw history. */
	public HistoryAnalysis analyze(String rawHistory) {
		PatientHistory history = parser.parse(rawHistory);

		HistoryAnalysis a = new HistoryAnalysis();
		a.setHistory(history);
		a.setTimeline(categorizer.byTimeline(history, today()));
		a.setRiskBuckets(categorizer.byRiskLevel(history));
		a.setPatterns(patternAnalyzer.analyze(history));

		ExtractedTerms terms = new ExtractedTerms();
		Set<String> warnings = new LinkedHashSet<>();
		for (EncounterRecord r : history) {
			terms.merge(termExtractor.extract(r.getRawText()));
			warnings.addAll(termExtractor.extractWarningSentences(r.getDescription()));
			if (r.getWarnings() != null) {
				warnings.add(r.getWarnings());
			}
		}
		a.setTerms(terms);
		a.setWarnings(new ArrayList<>(warnings));
		a.setEntities(extractEntities(history));

		Logger.info("Analyzed {} record(s): {} unique condition(s), trend {}", history.size(),
				a.getPatterns().getUniqueConditions(), a.getPatterns().getRiskTrend());
		return a;
	}

	/**
	 * @return the summary text; the fixed no-records message for an empty history
	 */
	public String summarize(String rawHistory, boolean emergencyMode) {
		HistoryAnalysis a = analyze(rawHistory);
		return composer.compose(a, emergencyMode);
	}

	/** Prediction for a request body; missing age and records take their defaults. */
	public PredictionResult predict(PatientData data) {
		PatientData body = (data == null) ? new PatientData() : data;
		int age = (body.getAge() == null) ? cfg.getDefaultAge() : body.getAge();
		return predict(toHistory(body.getRecords()), age);
	}

	public PredictionResult predict(PatientHistory history, int age) {
		PatternAnalysis patterns = patternAnalyzer.analyze(history);
		PredictionResult result = predictor.predict(history, age, patterns);
		Logger.info("Predicted {} condition(s) from {} record(s); overall health score {}",
				result.getPredictions().size(), history.size(), result.getOverallHealthScore());
		return result;
	}

	/** Structured request records to a sorted history. */
	public PatientHistory toHistory(List<EncounterInput> inputs) {
		List<EncounterRecord> records = new ArrayList<>();
		if (inputs != null) {
			for (EncounterInput in : inputs) {
				if (in != null) {
					records.add(toRecord(in));
				}
			}
		}
		return PatientHistory.of(records);
	}

	EncounterRecord toRecord(EncounterInput in) {
		return EncounterRecord.builder()
				.date(dateParser.parse(in.getDate()))
				.disease(in.getDisease())
				.description(in.getDescription())
				.treatment(in.getTreatment())
				.riskLabel(in.getRisk())
				.warnings(in.getWarnings())
				.rawText(rawTextOf(in))
				.build();
	}

	/** Label-formatted text of the fields that are present. */
	private static String rawTextOf(EncounterInput in) {
		StringBuilder sb = new StringBuilder();
		appendField(sb, "Date", in.getDate());
		appendField(sb, "Disease", in.getDisease());
		appendField(sb, "Description", in.getDescription());
		appendField(sb, "Treatment", in.getTreatment());
		appendField(sb, "Risk Level", in.getRisk());
		appendField(sb, "Warnings", in.getWarnings());
		return sb.toString().trim();
	}

	private static void appendField(StringBuilder sb, String label, String value) {
		if (value != null && !value.isBlank()) {
			sb.append(label).append(": ").append(value.trim()).append('\n');
		}
	}

	private List<MedicalEntity> extractEntities(PatientHistory history) {
		List<MedicalEntity> entities = new ArrayList<>();
		if (!entityExtractor.isAvailable()) {
			return entities;
		}
		for (EncounterRecord r : history) {
			try {
				entities.addAll(entityExtractor.extract(r.getRawText()));
			} catch (RuntimeException e) {
				Logger.warn("Entity extraction failed; summary continues with pattern rules only: {}",
						e.getMessage());
				return new ArrayList<>();
			}
		}
		return entities;
	}

	LocalDate today() {
		return LocalDate.now(clock.withZone(cfg.getTimeZone()));
	}
}
