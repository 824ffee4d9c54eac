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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * History-based score of one condition. Composite conditions fold in the
 * finalized scores of the conditions they depend on.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConditionRiskProfile {

	private String condition;

	// Distinct disease labels that hit one of the condition's indicators
	private int matchCount;

	private double historyScore;

	// Own indicator hits; conditions without indicators take it from their dependencies
	private boolean evidenced;
}
