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

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.hxlens.history.conf.ConfigLoader;
import org.hxlens.history.om.EncounterRecord;

/**
 * Parses encounter dates against an ordered list of calendar formats.
 * <p>Formatters are immutable and thread-safe; one instance may be shared.</p>
 */
public final class DateParser {

	private final List<DateTimeFormatter> formats;

	public DateParser() {
		this(ConfigLoader.DEFAULT_DATE_FORMATS);
	}

	/**
	 * @param patterns {@link DateTimeFormatter} patterns, tried in order
	 * @throws IllegalArgumentException if a pattern is not valid
	 */
	public DateParser(List<String> patterns) {
		List<DateTimeFormatter> built = new ArrayList<>();
		for (String p : patterns) {
			built.add(new DateTimeFormatterBuilder()
					.parseCaseInsensitive()
					.appendPattern(p)
					.toFormatter(Locale.ENGLISH)
					.withResolverStyle(ResolverStyle.STRICT));
		}
		this.formats = Collections.unmodifiableList(built);
	}

	/**
	 * First format that parses wins. Unparsable input yields
	 * {@link EncounterRecord#UNKNOWN_DATE}; null input yields {@code null}.
	 */
	public LocalDate parse(String raw) {
		if (raw == null) {
			return null;
		}
		LocalDate d = parseOrNull(raw);
		return d == null ? EncounterRecord.UNKNOWN_DATE : d;
	}

	/** Try every format, return the first that parses, else null. */
	public LocalDate parseOrNull(String raw) {
		if (raw == null || raw.isBlank()) {
			return null;
		}
		String s = raw.trim();
		for (DateTimeFormatter f : formats) {
			try {
				return LocalDate.parse(s, f);
			} catch (DateTimeParseException ignore) {
				// next format
			}
		}
		return null;
	}
}
