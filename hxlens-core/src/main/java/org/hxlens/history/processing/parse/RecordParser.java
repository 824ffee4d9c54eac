package org.hxlens.history.processing.parse;

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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.hxlens.history.om.EncounterRecord;
import org.hxlens.history.om.PatientHistory;
import org.hxlens.history.util.Logger;

/**
 * Splits a raw history into encounter blocks and pulls the labeled fields out
 * of each block.
 *
 * <pre>
 * Date: 11/20/2024
 * Disease: Hypertension
 * Description: Elevated blood pressure ...
 *   continued on the next line
 * Treatment: Lifestyle modifications
 * Risk Level: high
 * Warnings: Regular BP monitoring required
 * ---
 * Date: ...
 * </pre>
 *
 * Labels are recognized at the start of a line. The first occurrence of a label
 * wins. {@code Description:} keeps collecting lines until the next recognized
 * label; other {@code Word:} lines stay part of it. Malformed blocks never
 * raise; at worst only the raw text is set.
 */
public class RecordParser {

	/** Fields recognized inside a block. */
	enum Field {
		DATE("Date"), DISEASE("Disease"), DESCRIPTION("Description"), TREATMENT("Treatment"),
		RISK_LEVEL("Risk Level"), WARNINGS("Warnings?");

		final Pattern pattern;

		Field(String label) {
			this.pattern = Pattern.compile("^\\s*" + label + "\\s*:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
		}
	}

	private final String separator;
	private final DateParser dateParser;

	public RecordParser() {
		this("---", new DateParser());
	}

	public RecordParser(String separator, DateParser dateParser) {
		if (StringUtils.isBlank(separator)) {
			throw new IllegalArgumentException("Record separator must not be blank");
		}
		this.separator = separator.trim();
		this.dateParser = dateParser;
	}

	/**
	 * Parse a raw history into records sorted most-recent-first.
	 *
	 * @param rawHistory separator-delimited text; null is treated as empty
	 */
	public PatientHistory parse(String rawHistory) {
		List<EncounterRecord> records = new ArrayList<>();
		for (String block : splitBlocks(rawHistory)) {
			records.add(parseBlock(block));
		}
		Logger.debug("Parsed {} encounter block(s)", records.size());
		return PatientHistory.of(records);
	}

	/** Non-empty, trimmed blocks between separator lines. */
	List<String> splitBlocks(String rawHistory) {
		List<String> blocks = new ArrayList<>();
		if (rawHistory == null || rawHistory.isBlank()) {
			return blocks;
		}
		StringBuilder current = new StringBuilder();
		for (String line : rawHistory.split("\\R", -1)) {
			if (line.trim().equals(separator)) {
				addBlock(blocks, current);
				current.setLength(0);
			} else {
				current.append(line).append('\n');
			}
		}
		addBlock(blocks, current);
		return blocks;
	}

	private static void addBlock(List<String> blocks, StringBuilder sb) {
		String block = sb.toString().trim();
		if (!block.isEmpty()) {
			blocks.add(block);
		}
	}

	/** Build one record from a single block of text. */
	EncounterRecord parseBlock(String block) {
		Map<Field, String> values = new EnumMap<>(Field.class);
		StringBuilder description = null;

		for (String line : block.split("\\R")) {
			Field field = null;
			Matcher m = null;
			for (Field f : Field.values()) {
				Matcher candidate = f.pattern.matcher(line);
				if (candidate.matches()) {
					field = f;
					m = candidate;
					break;
				}
			}

			if (field == null) {
				if (description != null) {
					description.append('\n').append(line.trim());
				}
				continue;
			}

			if (description != null) {
				description = finishDescription(values, description);
			}

			String value = m.group(1).trim();
			if (values.containsKey(field)) {
				continue; // first occurrence wins
			}
			if (field == Field.DESCRIPTION) {
				description = new StringBuilder(value);
			} else if (!value.isEmpty()) {
				values.put(field, value);
			}
		}
		if (description != null) {
			finishDescription(values, description);
		}

		return EncounterRecord.builder()
				.date(dateParser.parse(values.get(Field.DATE)))
				.disease(values.get(Field.DISEASE))
				.description(values.get(Field.DESCRIPTION))
				.treatment(values.get(Field.TREATMENT))
				.riskLabel(values.get(Field.RISK_LEVEL))
				.warnings(values.get(Field.WARNINGS))
				.rawText(block)
				.build();
	}

	private static StringBuilder finishDescription(Map<Field, String> values, StringBuilder description) {
		String text = description.toString().trim();
		if (!text.isEmpty()) {
			values.put(Field.DESCRIPTION, text);
		}
		return null;
	}
}
