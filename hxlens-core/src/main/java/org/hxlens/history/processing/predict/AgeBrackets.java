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

import java.util.List;

/** Age to risk-factor table. */
public final class AgeBrackets {

	/** Applies to ages below {@code upperExclusive}. */
	static final class Bracket {
		final int upperExclusive;
		final double risk;

		Bracket(int upperExclusive, double risk) {
			this.upperExclusive = upperExclusive;
			this.risk = risk;
		}
	}

	private static final List<Bracket> BRACKETS = List.of(
			new Bracket(18, 0.1),
			new Bracket(40, 0.2),
			new Bracket(60, 0.4),
			new Bracket(75, 0.6));

	private static final double OLDEST_RISK = 0.8;

	private AgeBrackets() {
	}

	public static double riskFor(int age) {
		for (Bracket b : BRACKETS) {
			if (age < b.upperExclusive) {
				return b.risk;
			}
		}
		return OLDEST_RISK;
	}
}
