package org.hxlens.history.nlp;

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

import java.util.List;

import org.hxlens.history.om.MedicalEntity;

/**
 * Entity extraction model seen from the pipeline: given text, return labeled
 * spans with a confidence. Implementations must not throw for ordinary input
 * and return an empty list when they have nothing to offer; summaries are
 * produced without entities in that case.
 */
public interface EntityExtractor {

	List<MedicalEntity> extract(String text);

	/** False when the backing model is missing, so callers can skip the call entirely. */
	default boolean isAvailable() {
		return true;
	}
}
