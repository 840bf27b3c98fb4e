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

import java.sql.ResultSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.HierarchyNode;
import org.pvcoder.dict.om.MatchTier;
import org.pvcoder.dict.om.SearchResult;
import org.pvcoder.dict.om.VersionedCode;
import org.pvcoder.dict.util.Db;

/**
 * MedDRA hierarchy over the {@code meddra_*} tables.
 * <p>
 * SOC-HLGT, HLGT-HLT and HLT-PT edges live in one join table per level pair and
 * may fan in (a PT under several HLTs). An LLT has exactly one PT, held in
 * {@code meddra_llt.pt_code}.
 */
public class MeddraHierarchyStore extends AbstractHierarchyStore {

	private static final String SEARCH_SQL = """
			SELECT l.llt_code, l.llt_name, l.is_current, p.pt_code, p.pt_name, s.soc_code, s.soc_name,
			       CASE
			           WHEN LOWER(l.llt_name) = ? THEN 1
			           WHEN LOWER(l.llt_name) LIKE ? ESCAPE '!' THEN 2
			           WHEN LOWER(l.llt_name) LIKE ? ESCAPE '!' THEN 3
			           ELSE 4
			       END AS match_tier
			FROM meddra_llt l
			JOIN meddra_pt p ON p.version_id = l.version_id AND p.pt_code = l.pt_code
			LEFT JOIN meddra_soc s ON s.version_id = p.version_id AND s.soc_code = p.primary_soc_code
			WHERE l.version_id = ?
			  AND (LOWER(l.llt_name) LIKE ? ESCAPE '!' OR LOWER(p.pt_name) LIKE ? ESCAPE '!')
			""";

	public MeddraHierarchyStore(DictionaryDatabase database) {
		super(database, DictionaryType.MEDDRA);
	}

	@Override
	public List<HierarchyNode> topLevel(long versionId) {
		String sql = "SELECT " + columns(HierarchyLevel.SOC, "n") + " FROM meddra_soc n WHERE n.version_id = ?"
				+ orderBy(HierarchyLevel.SOC);
		return nodes(sql, ps -> ps.setLong(1, versionId), rs -> map(HierarchyLevel.SOC, versionId, rs));
	}

	@Override
	public List<HierarchyNode> childrenOf(HierarchyLevel parentLevel, VersionedCode parent) {
		checkLevel(parentLevel);
		HierarchyLevel child = parentLevel.next();
		if (child == null || !isBindable(parentLevel, parent)) {
			return List.of();
		}
		String sql;
		if (parentLevel == HierarchyLevel.PT) {
			sql = "SELECT " + columns(child, "n") + " FROM meddra_llt n WHERE n.version_id = ? AND n.pt_code = ?"
					+ orderBy(child);
		} else {
			sql = "SELECT " + columns(child, "n")
					+ " FROM " + relationTable(parentLevel, child) + " r"
					+ " JOIN " + child.getTable() + " n ON n.version_id = r.version_id"
					+ " AND n." + child.getCodeColumn() + " = r." + child.getCodeColumn()
					+ " WHERE r.version_id = ? AND r." + parentLevel.getCodeColumn() + " = ?"
					+ orderBy(child);
		}
		return nodes(sql, versionAndCode(parentLevel, parent), rs -> map(child, parent.getVersionId(), rs));
	}

	@Override
	public Optional<HierarchyNode> byCode(HierarchyLevel level, VersionedCode code) {
		checkLevel(level);
		if (!isBindable(level, code)) {
			return Optional.empty();
		}
		String sql = "SELECT " + columns(level, "n") + " FROM " + level.getTable() + " n"
				+ " WHERE n.version_id = ? AND n." + level.getCodeColumn() + " = ?";
		return node(sql, versionAndCode(level, code), rs -> map(level, code.getVersionId(), rs));
	}

	@Override
	public List<HierarchyNode> parentsOf(HierarchyLevel level, VersionedCode child) {
		checkLevel(level);
		HierarchyLevel parent = parentLevel(level);
		if (parent == null || !isBindable(level, child)) {
			return List.of();
		}
		String sql;
		if (level == HierarchyLevel.LLT) {
			sql = "SELECT " + columns(parent, "n") + " FROM meddra_llt c"
					+ " JOIN meddra_pt n ON n.version_id = c.version_id AND n.pt_code = c.pt_code"
					+ " WHERE c.version_id = ? AND c.llt_code = ?";
		} else {
			sql = "SELECT " + columns(parent, "n")
					+ " FROM " + relationTable(parent, level) + " r"
					+ " JOIN " + parent.getTable() + " n ON n.version_id = r.version_id"
					+ " AND n." + parent.getCodeColumn() + " = r." + parent.getCodeColumn()
					+ " WHERE r.version_id = ? AND r." + level.getCodeColumn() + " = ?"
					+ orderBy(parent);
		}
		return nodes(sql, versionAndCode(level, child), rs -> map(parent, child.getVersionId(), rs));
	}

	@Override
	public List<SearchResult> search(long versionId, String normalizedQuery, boolean includeNonCurrent,
			String countryCode, int limit) {
		String sql = SEARCH_SQL
				+ (includeNonCurrent ? "" : "  AND l.is_current = TRUE\n")
				+ "ORDER BY match_tier, LOWER(l.llt_name), l.llt_code\nLIMIT ?";
		String contains = containsPattern(normalizedQuery);
		return database.withConnection(conn -> Db.runQuery(conn, sql, ps -> {
			ps.setString(1, normalizedQuery);
			ps.setString(2, prefixPattern(normalizedQuery));
			ps.setString(3, contains);
			ps.setLong(4, versionId);
			ps.setString(5, contains);
			ps.setString(6, contains);
			ps.setInt(7, limit);
		}, rs -> new SearchResult(
				versionId,
				HierarchyLevel.LLT,
				rs.getString("llt_code"),
				rs.getString("llt_name"),
				rs.getString("pt_code"),
				rs.getString("pt_name"),
				rs.getString("soc_code"),
				rs.getString("soc_name"),
				rs.getBoolean("is_current"),
				MatchTier.ofRank(rs.getInt("match_tier")))));
	}

	/* ---------------------------- helpers ---------------------------- */

	static HierarchyLevel parentLevel(HierarchyLevel level) {
		switch (level) {
		case HLGT: return HierarchyLevel.SOC;
		case HLT: return HierarchyLevel.HLGT;
		case PT: return HierarchyLevel.HLT;
		case LLT: return HierarchyLevel.PT;
		default: return null;
		}
	}

	private static String relationTable(HierarchyLevel parent, HierarchyLevel child) {
		return "meddra_" + parent.name().toLowerCase(Locale.ROOT) + "_" + child.name().toLowerCase(Locale.ROOT);
	}

	private static String orderBy(HierarchyLevel level) {
		return " ORDER BY LOWER(n." + level.getNameColumn() + "), n." + level.getCodeColumn();
	}

	/** Uniform column aliases so one mapper serves every level. */
	private static String columns(HierarchyLevel level, String alias) {
		String abbrev = level == HierarchyLevel.SOC ? alias + ".soc_abbrev" : "NULL";
		String primary = level == HierarchyLevel.PT ? alias + ".primary_soc_code" : "NULL";
		String current = level == HierarchyLevel.LLT ? alias + ".is_current" : "NULL";
		return alias + "." + level.getCodeColumn() + " AS node_code, "
				+ alias + "." + level.getNameColumn() + " AS node_name, "
				+ abbrev + " AS node_abbrev, "
				+ primary + " AS node_primary, "
				+ current + " AS node_current";
	}

	private static HierarchyNode map(HierarchyLevel level, long versionId, ResultSet rs) throws Exception {
		Boolean current = level == HierarchyLevel.LLT ? rs.getBoolean("node_current") : null;
		return new HierarchyNode(
				VersionedCode.of(versionId, rs.getString("node_code")),
				level,
				rs.getString("node_name"),
				current,
				rs.getString("node_primary"),
				rs.getString("node_abbrev"));
	}
}
