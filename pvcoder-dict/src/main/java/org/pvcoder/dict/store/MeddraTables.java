package org.pvcoder.dict.store;

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

import java.sql.Types;
import java.util.List;

import org.pvcoder.dict.ingest.LltRecord;
import org.pvcoder.dict.ingest.PtRecord;
import org.pvcoder.dict.ingest.RelationRecord;
import org.pvcoder.dict.ingest.SocRecord;
import org.pvcoder.dict.ingest.TermRecord;

/** Load targets and cascade order for the MedDRA tables. */
public final class MeddraTables {

	public static final LoadTarget<SocRecord> SOC = new LoadTarget<>("meddra_soc",
			"INSERT INTO meddra_soc (version_id, soc_code, soc_name, soc_abbrev) VALUES (?, ?, ?, ?)",
			(ps, versionId, r) -> {
				ps.setLong(1, versionId);
				ps.setInt(2, r.getCode());
				ps.setString(3, r.getName());
				ps.setString(4, r.getAbbreviation());
			});

	public static final LoadTarget<TermRecord> HLGT = term("meddra_hlgt", "hlgt_code", "hlgt_name");
	public static final LoadTarget<TermRecord> HLT = term("meddra_hlt", "hlt_code", "hlt_name");

	public static final LoadTarget<PtRecord> PT = new LoadTarget<>("meddra_pt",
			"INSERT INTO meddra_pt (version_id, pt_code, pt_name, primary_soc_code) VALUES (?, ?, ?, ?)",
			(ps, versionId, r) -> {
				ps.setLong(1, versionId);
				ps.setInt(2, r.getCode());
				ps.setString(3, r.getName());
				if (r.getPrimarySocCode() == null) {
					ps.setNull(4, Types.INTEGER);
				} else {
					ps.setInt(4, r.getPrimarySocCode());
				}
			});

	public static final LoadTarget<LltRecord> LLT = new LoadTarget<>("meddra_llt",
			"INSERT INTO meddra_llt (version_id, llt_code, llt_name, pt_code, is_current) VALUES (?, ?, ?, ?, ?)",
			(ps, versionId, r) -> {
				ps.setLong(1, versionId);
				ps.setInt(2, r.getCode());
				ps.setString(3, r.getName());
				ps.setInt(4, r.getPtCode());
				ps.setBoolean(5, r.isCurrent());
			});

	public static final LoadTarget<RelationRecord> SOC_HLGT = relation("meddra_soc_hlgt", "soc_code", "hlgt_code");
	public static final LoadTarget<RelationRecord> HLGT_HLT = relation("meddra_hlgt_hlt", "hlgt_code", "hlt_code");
	public static final LoadTarget<RelationRecord> HLT_PT = relation("meddra_hlt_pt", "hlt_code", "pt_code");

	/** Relationship tables first, then terms from the bottom of the hierarchy up. */
	public static final List<String> DELETE_ORDER = List.of(
			"meddra_soc_hlgt", "meddra_hlgt_hlt", "meddra_hlt_pt",
			"meddra_llt", "meddra_pt", "meddra_hlt", "meddra_hlgt", "meddra_soc");

	public static final String LEAF_TABLE = "meddra_llt";
	public static final String TERM_TABLE = "meddra_pt";

	private MeddraTables() {
	}

	private static LoadTarget<TermRecord> term(String table, String codeColumn, String nameColumn) {
		return new LoadTarget<>(table,
				"INSERT INTO " + table + " (version_id, " + codeColumn + ", " + nameColumn + ") VALUES (?, ?, ?)",
				(ps, versionId, r) -> {
					ps.setLong(1, versionId);
					ps.setInt(2, r.getCode());
					ps.setString(3, r.getName());
				});
	}

	private static LoadTarget<RelationRecord> relation(String table, String parentColumn, String childColumn) {
		return new LoadTarget<>(table,
				"INSERT INTO " + table + " (version_id, " + parentColumn + ", " + childColumn + ") VALUES (?, ?, ?)",
				(ps, versionId, r) -> {
					ps.setLong(1, versionId);
					ps.setInt(2, r.getParentCode());
					ps.setInt(3, r.getChildCode());
				});
	}
}
