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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class AgeBracketsTest {

	@Test
	void bracket_edges_belong_to_the_older_bracket() {
		assertEquals(0.1, AgeBrackets.riskFor(0), 1e-9);
		assertEquals(0.1, AgeBrackets.riskFor(17), 1e-9);
		assertEquals(0.2, AgeBrackets.riskFor(18), 1e-9);
		assertEquals(0.2, AgeBrackets.riskFor(39), 1e-9);
		assertEquals(0.4, AgeBrackets.riskFor(40), 1e-9);
		assertEquals(0.4, AgeBrackets.riskFor(59), 1e-9);
		assertEquals(0.6, AgeBrackets.riskFor(60), 1e-9);
		assertEquals(0.6, AgeBrackets.riskFor(74), 1e-9);
		assertEquals(0.8, AgeBrackets.riskFor(75), 1e-9);
		assertEquals(0.8, AgeBrackets.riskFor(101), 1e-9);
	}
}
