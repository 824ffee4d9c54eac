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

/**
 * Recency window of an encounter relative to the day of the request.
 * Upper bounds are inclusive.
 */
public enum TimelineBucket {

	LAST_7_DAYS(7), LAST_30_DAYS(30), LAST_90_DAYS(90), OLDER(Long.MAX_VALUE);

	private final long maxDays;

	TimelineBucket(long maxDays) {
		this.maxDays = maxDays;
	}

	public long getMaxDays() {
		return maxDays;
	}

	public static TimelineBucket forDaysElapsed(long days) {
		for (TimelineBucket b : values()) {
			if (days <= b.maxDays) {
				return b;
			}
		}
		return OLDER;
	}
}
