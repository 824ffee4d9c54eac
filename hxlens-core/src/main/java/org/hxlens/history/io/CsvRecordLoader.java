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
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.hxlens.history.om.EncounterInput;
import org.hxlens.history.util.Logger;

/**
 * Reads encounter records from a CSV export with a header row. Recognized
 * columns (any case): date, disease, risk, description, treatment, warnings.
 * Missing columns and blank cells leave the field unset.
 */
public class CsvRecordLoader {

	public static final String COL_DATE = "date";
	public static final String COL_DISEASE = "disease";
	public static final String COL_RISK = "risk";
	public static final String COL_DESCRIPTION = "description";
	public static final String COL_TREATMENT = "treatment";
	public static final String COL_WARNINGS = "warnings";

	private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader()
			.setSkipHeaderRecord(true)
			.setIgnoreHeaderCase(true)
			.setIgnoreEmptyLines(true)
			.setTrim(true)
			.build();

	public List<EncounterInput> load(Path csv) throws IOException {
		try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
			return load(reader);
		}
	}

	public List<EncounterInput> load(Reader reader) throws IOException {
		List<EncounterInput> out = new ArrayList<>();
		try (CSVParser parser = FORMAT.parse(reader)) {
			for (CSVRecord rec : parser) {
				EncounterInput in = new EncounterInput();
				in.setDate(cell(rec, COL_DATE));
				in.setDisease(cell(rec, COL_DISEASE));
				in.setRisk(cell(rec, COL_RISK));
				in.setDescription(cell(rec, COL_DESCRIPTION));
				in.setTreatment(cell(rec, COL_TREATMENT));
				in.setWarnings(cell(rec, COL_WARNINGS));
				out.add(in);
			}
		}
		Logger.debug("Loaded {} record(s) from CSV", out.size());
		return out;
	}

	private static String cell(CSVRecord rec, String column) {
		if (!rec.isMapped(column) || !rec.isSet(column)) {
			return null;
		}
		return StringUtils.trimToNull(rec.get(column));
	}
}
