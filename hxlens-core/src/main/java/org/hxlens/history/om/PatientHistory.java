package org.hxlens.history.om;

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
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Encounters ordered most-recent-first. Records without a usable date come
 * last and keep their relative input order.
 */
public final class PatientHistory implements Iterable<EncounterRecord> {

	private static final PatientHistory EMPTY = new PatientHistory(Collections.emptyList());

	private static final Comparator<EncounterRecord> MOST_RECENT_FIRST =
			Comparator.comparing(EncounterRecord::getSortDate).reversed();

	private final List<EncounterRecord> records;

	private PatientHistory(List<EncounterRecord> sorted) {
		this.records = Collections.unmodifiableList(sorted);
	}

	/** Sort (stable) and wrap the given records. */
	public static PatientHistory of(List<EncounterRecord> records) {
		if (records == null || records.isEmpty()) {
			return EMPTY;
		}
		List<EncounterRecord> sorted = new ArrayList<>(records);
		sorted.sort(MOST_RECENT_FIRST);
		return new PatientHistory(sorted);
	}

	public static PatientHistory empty() {
		return EMPTY;
	}

	public List<EncounterRecord> getRecords() {
		return records;
	}

	public int size() {
		return records.size();
	}

	public boolean isEmpty() {
		return records.isEmpty();
	}

	@Override
	public Iterator<EncounterRecord> iterator() {
		return records.iterator();
	}
}
