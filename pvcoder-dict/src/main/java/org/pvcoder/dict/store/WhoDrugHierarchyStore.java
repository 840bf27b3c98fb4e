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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.HierarchyNode;
import org.pvcoder.dict.om.MatchTier;
import org.pvcoder.dict.om.ProductDetail;
import org.pvcoder.dict.om.ProductIngredient;
import org.pvcoder.dict.om.SearchResult;
import org.pvcoder.dict.om.VersionedCode;
import org.pvcoder.dict.util.Db;

/**
 * WHO Drug hierarchy: ATC classes, then products, then ingredients.
 * <p>
 * An ATC class's children are its sub-classes followed by the products coded
 * directly to it. A product's children are its ingredients; an ingredient's
 * parents are every product that contains it.
 */
public class WhoDrugHierarchyStore extends AbstractHierarchyStore {

	private static final String ATC_COLUMNS =
			"n.atc_code AS node_code, n.atc_name AS node_name, n.atc_level AS node_atc_level";
	private static final String PRODUCT_COLUMNS =
			"n.drug_code AS node_code, n.drug_name AS node_name, 0 AS node_atc_level";
	private static final String INGREDIENT_COLUMNS =
			"n.ingredient_id AS node_code, n.ingredient_name AS node_name, 0 AS node_atc_level";

	private static final String ATC_ORDER = " ORDER BY LOWER(n.atc_name), n.atc_code";
	private static final String PRODUCT_ORDER = " ORDER BY LOWER(n.drug_name), n.drug_code";
	private static final String INGREDIENT_ORDER = " ORDER BY LOWER(n.ingredient_name), n.ingredient_id";

	private static final String SEARCH_SQL = """
			SELECT d.drug_code, d.drug_name, a.atc_code, a.atc_name, t.atc_code AS top_code, t.atc_name AS top_name,
			       CASE
			           WHEN LOWER(d.drug_name) = ? THEN 1
			           WHEN LOWER(d.drug_name) LIKE ? ESCAPE '!' THEN 2
			           WHEN LOWER(d.drug_name) LIKE ? ESCAPE '!' THEN 3
			           ELSE 4
			       END AS match_tier
			FROM whodrug_product d
			LEFT JOIN whodrug_atc a ON a.version_id = d.version_id AND a.atc_code = d.atc_code
			LEFT JOIN whodrug_atc t ON t.version_id = d.version_id AND t.atc_code = SUBSTRING(d.atc_code, 1, 1)
			WHERE d.version_id = ?
			  AND (LOWER(d.drug_name) LIKE ? ESCAPE '!'
			       OR LOWER(d.drug_name_english) LIKE ? ESCAPE '!'
			       OR LOWER(a.atc_name) LIKE ? ESCAPE '!')
			""";

	private static final String PRODUCT_DETAIL_SQL = """
			SELECT drug_code, drug_name, drug_name_english, country_code, company, atc_code, formulation,
			       marketing_status
			FROM whodrug_product
			WHERE version_id = ? AND drug_code = ?
			""";

	// ingredients missing from the ingredient file still list, by id
	private static final String PRODUCT_INGREDIENTS_SQL = """
			SELECT r.ingredient_id, COALESCE(i.ingredient_name, r.ingredient_id) AS ingredient_name, r.strength
			FROM whodrug_product_ingredient r
			LEFT JOIN whodrug_ingredient i ON i.version_id = r.version_id AND i.ingredient_id = r.ingredient_id
			WHERE r.version_id = ? AND r.drug_code = ?
			ORDER BY LOWER(COALESCE(i.ingredient_name, r.ingredient_id)), r.ingredient_id
			""";

	public WhoDrugHierarchyStore(DictionaryDatabase database) {
		super(database, DictionaryType.WHODRUG);
	}

	@Override
	public List<HierarchyNode> topLevel(long versionId) {
		String sql = "SELECT " + ATC_COLUMNS + " FROM whodrug_atc n WHERE n.version_id = ? AND n.atc_level = 1"
				+ ATC_ORDER;
		return nodes(sql, ps -> ps.setLong(1, versionId), rs -> map(HierarchyLevel.ATC1, versionId, rs));
	}

	@Override
	public List<HierarchyNode> childrenOf(HierarchyLevel parentLevel, VersionedCode parent) {
		checkLevel(parentLevel);
		if (!isBindable(parentLevel, parent)) {
			return List.of();
		}
		long versionId = parent.getVersionId();
		Db.ParamSetter params = versionAndCode(parentLevel, parent);
		if (parentLevel.isAtc()) {
			List<HierarchyNode> out = new ArrayList<>(nodes(
					"SELECT " + ATC_COLUMNS + " FROM whodrug_atc n WHERE n.version_id = ? AND n.parent_code = ?"
							+ ATC_ORDER,
					params, rs -> map(HierarchyLevel.ATC1, versionId, rs)));
			out.addAll(nodes(
					"SELECT " + PRODUCT_COLUMNS + " FROM whodrug_product n WHERE n.version_id = ? AND n.atc_code = ?"
							+ PRODUCT_ORDER,
					params, rs -> map(HierarchyLevel.PRODUCT, versionId, rs)));
			return out;
		}
		if (parentLevel == HierarchyLevel.PRODUCT) {
			return nodes("SELECT " + INGREDIENT_COLUMNS + " FROM whodrug_product_ingredient r"
					+ " JOIN whodrug_ingredient n ON n.version_id = r.version_id AND n.ingredient_id = r.ingredient_id"
					+ " WHERE r.version_id = ? AND r.drug_code = ?" + INGREDIENT_ORDER,
					params, rs -> map(HierarchyLevel.INGREDIENT, versionId, rs));
		}
		return List.of();
	}

	@Override
	public Optional<HierarchyNode> byCode(HierarchyLevel level, VersionedCode code) {
		checkLevel(level);
		if (!isBindable(level, code)) {
			return Optional.empty();
		}
		long versionId = code.getVersionId();
		if (level.isAtc()) {
			return node("SELECT " + ATC_COLUMNS + " FROM whodrug_atc n"
					+ " WHERE n.version_id = ? AND n.atc_code = ? AND n.atc_level = ?", ps -> {
						ps.setLong(1, versionId);
						ps.setString(2, code.getCode());
						ps.setInt(3, level.getAtcLevel());
					}, rs -> map(level, versionId, rs));
		}
		String columns = level == HierarchyLevel.PRODUCT ? PRODUCT_COLUMNS : INGREDIENT_COLUMNS;
		return node("SELECT " + columns + " FROM " + level.getTable() + " n"
				+ " WHERE n.version_id = ? AND n." + level.getCodeColumn() + " = ?",
				versionAndCode(level, code), rs -> map(level, versionId, rs));
	}

	@Override
	public List<HierarchyNode> parentsOf(HierarchyLevel level, VersionedCode child) {
		checkLevel(level);
		if (level == HierarchyLevel.ATC1 || !isBindable(level, child)) {
			return List.of();
		}
		long versionId = child.getVersionId();
		Db.ParamSetter params = versionAndCode(level, child);
		if (level.isAtc()) {
			return nodes("SELECT " + ATC_COLUMNS + " FROM whodrug_atc c"
					+ " JOIN whodrug_atc n ON n.version_id = c.version_id AND n.atc_code = c.parent_code"
					+ " WHERE c.version_id = ? AND c.atc_code = ?",
					params, rs -> map(HierarchyLevel.ATC1, versionId, rs));
		}
		if (level == HierarchyLevel.PRODUCT) {
			return nodes("SELECT " + ATC_COLUMNS + " FROM whodrug_product c"
					+ " JOIN whodrug_atc n ON n.version_id = c.version_id AND n.atc_code = c.atc_code"
					+ " WHERE c.version_id = ? AND c.drug_code = ?",
					params, rs -> map(HierarchyLevel.ATC1, versionId, rs));
		}
		return nodes("SELECT " + PRODUCT_COLUMNS + " FROM whodrug_product_ingredient r"
				+ " JOIN whodrug_product n ON n.version_id = r.version_id AND n.drug_code = r.drug_code"
				+ " WHERE r.version_id = ? AND r.ingredient_id = ?" + PRODUCT_ORDER,
				params, rs -> map(HierarchyLevel.PRODUCT, versionId, rs));
	}

	@Override
	public List<SearchResult> search(long versionId, String normalizedQuery, boolean includeNonCurrent,
			String countryCode, int limit) {
		boolean byCountry = countryCode != null && !countryCode.isBlank();
		String sql = SEARCH_SQL
				+ (byCountry ? "  AND UPPER(d.country_code) = ?\n" : "")
				+ "ORDER BY match_tier, LOWER(d.drug_name), d.drug_code\nLIMIT ?";
		String contains = containsPattern(normalizedQuery);
		return database.withConnection(conn -> Db.runQuery(conn, sql, ps -> {
			int i = 1;
			ps.setString(i++, normalizedQuery);
			ps.setString(i++, prefixPattern(normalizedQuery));
			ps.setString(i++, contains);
			ps.setLong(i++, versionId);
			ps.setString(i++, contains);
			ps.setString(i++, contains);
			ps.setString(i++, contains);
			if (byCountry) {
				ps.setString(i++, countryCode.trim().toUpperCase(Locale.ROOT));
			}
			ps.setInt(i, limit);
		}, rs -> new SearchResult(
				versionId,
				HierarchyLevel.PRODUCT,
				rs.getString("drug_code"),
				rs.getString("drug_name"),
				rs.getString("atc_code"),
				rs.getString("atc_name"),
				rs.getString("top_code"),
				rs.getString("top_name"),
				null,
				MatchTier.ofRank(rs.getInt("match_tier")))));
	}

	/* ---------------------------- WHO Drug extras ---------------------------- */

	/** Products whose ATC code starts with {@code atcPrefix}, by name. */
	public List<HierarchyNode> productsUnderAtc(long versionId, String atcPrefix, int limit) {
		String sql = "SELECT " + PRODUCT_COLUMNS + " FROM whodrug_product n"
				+ " WHERE n.version_id = ? AND n.atc_code LIKE ?" + LIKE_ESCAPE + PRODUCT_ORDER + " LIMIT ?";
		return nodes(sql, ps -> {
			ps.setLong(1, versionId);
			ps.setString(2, prefixPattern(atcPrefix.trim()));
			ps.setInt(3, limit);
		}, rs -> map(HierarchyLevel.PRODUCT, versionId, rs));
	}

	/** The product row with its ingredients and strengths, or empty when the code is not in the version. */
	public Optional<ProductDetail> productDetail(long versionId, String drugCode) {
		VersionedCode key = VersionedCode.of(versionId, drugCode);
		if (!isBindable(HierarchyLevel.PRODUCT, key)) {
			return Optional.empty();
		}
		return database.withConnection(conn -> {
			Optional<ProductDetail> product = Db.queryOne(conn, PRODUCT_DETAIL_SQL,
					versionAndCode(HierarchyLevel.PRODUCT, key), rs -> new ProductDetail(versionId,
							rs.getString("drug_code"), rs.getString("drug_name"), rs.getString("drug_name_english"),
							rs.getString("country_code"), rs.getString("company"), rs.getString("atc_code"),
							rs.getString("formulation"), rs.getString("marketing_status"), List.of()));
			if (product.isEmpty()) {
				return product;
			}
			List<ProductIngredient> ingredients = Db.runQuery(conn, PRODUCT_INGREDIENTS_SQL,
					versionAndCode(HierarchyLevel.PRODUCT, key), rs -> new ProductIngredient(
							rs.getString("ingredient_id"), rs.getString("ingredient_name"), rs.getString("strength")));
			ProductDetail p = product.get();
			return Optional.of(new ProductDetail(versionId, p.getDrugCode(), p.getDrugName(), p.getDrugNameEnglish(),
					p.getCountryCode(), p.getCompany(), p.getAtcCode(), p.getFormulation(), p.getMarketingStatus(),
					ingredients));
		});
	}

	/** Ingredients whose name contains the query; exact and prefix matches first. */
	public List<HierarchyNode> searchIngredients(long versionId, String normalizedQuery, int limit) {
		String sql = "SELECT " + INGREDIENT_COLUMNS + " FROM whodrug_ingredient n"
				+ " WHERE n.version_id = ? AND LOWER(n.ingredient_name) LIKE ?" + LIKE_ESCAPE
				+ " ORDER BY CASE WHEN LOWER(n.ingredient_name) = ? THEN 1"
				+ " WHEN LOWER(n.ingredient_name) LIKE ?" + LIKE_ESCAPE + " THEN 2 ELSE 3 END,"
				+ " LOWER(n.ingredient_name), n.ingredient_id LIMIT ?";
		return nodes(sql, ps -> {
			ps.setLong(1, versionId);
			ps.setString(2, containsPattern(normalizedQuery));
			ps.setString(3, normalizedQuery);
			ps.setString(4, prefixPattern(normalizedQuery));
			ps.setInt(5, limit);
		}, rs -> map(HierarchyLevel.INGREDIENT, versionId, rs));
	}

	/** ATC rows carry their own level; {@code fallback} is used for products and ingredients. */
	private static HierarchyNode map(HierarchyLevel fallback, long versionId, ResultSet rs) throws Exception {
		int atcLevel = rs.getInt("node_atc_level");
		HierarchyLevel level = atcLevel > 0 ? HierarchyLevel.atc(atcLevel) : fallback;
		return HierarchyNode.of(level, VersionedCode.of(versionId, rs.getString("node_code")),
				rs.getString("node_name"));
	}
}
