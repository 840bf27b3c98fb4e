package org.pvcoder.dict.om;

/*
 * This file is part of PVCoder.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * PVCoder is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PVCoder is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PVCoder.  If not, see <https://www.gnu.org/licenses/>.
 */

/** Search ranking tiers, best first. */
public enum MatchTier {
	/** Leaf name equals the query, ignoring case. */
	EXACT,
	STARTS_WITH,
	CONTAINS,
	/** Only the related name (PT, English name or ATC class) contains the query. */
	RELATED_CONTAINS;

	/** Maps the 1-based rank computed in SQL. */
	public static MatchTier ofRank(int rank) {
		MatchTier[] all = values();
		if (rank < 1 || rank > all.length) {
			throw new IllegalArgumentException("Unknown match rank: " + rank);
		}
		return all[rank - 1];
	}
}
