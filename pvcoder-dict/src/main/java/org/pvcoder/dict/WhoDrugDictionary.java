package org.pvcoder.dict;

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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.pvcoder.dict.om.CodedTerm;
import org.pvcoder.dict.om.Coding;
import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.HierarchyNode;
import org.pvcoder.dict.om.ProductDetail;
import org.pvcoder.dict.om.VersionedCode;
import org.pvcoder.dict.processing.DictionaryImporter;
import org.pvcoder.dict.processing.SearchEngine;
import org.pvcoder.dict.processing.VersionManager;
import org.pvcoder.dict.store.WhoDrugHierarchyStore;

/**
 * WHO Drug adds product and ingredient lookups on top of the common
 * dictionary operations. Like search, these return an empty result when no
 * version applies. Codings carry the {@link ProductDetail} of the product on
 * the coded path.
 */
public class WhoDrugDictionary extends TerminologyDictionary {

	private final WhoDrugHierarchyStore whoDrugStore;

	public WhoDrugDictionary(WhoDrugHierarchyStore store, VersionManager versions, DictionaryImporter importer,
			SearchEngine searchEngine) {
		super(store, versions, importer, searchEngine);
		this.whoDrugStore = store;
	}

	/**
	 * Product columns and ingredient strengths for one drug code.
	 *
	 * @return empty when the code is not in the version or no version applies
	 */
	public Optional<ProductDetail> productByCode(String drugCode, Long versionId) {
		if (StringUtils.isBlank(drugCode)) {
			throw new IllegalArgumentException("Drug code is required");
		}
		Optional<Long> version = versions().effectiveVersionId(versionId);
		if (version.isEmpty()) {
			return Optional.empty();
		}
		return whoDrugStore.productDetail(version.get(), drugCode.trim());
	}

	/** Attaches the product on the coded path, for product and ingredient codings alike. */
	@Override
	protected Coding complete(Coding coding) {
		Optional<CodedTerm> product = coding.termAt(HierarchyLevel.PRODUCT);
		if (product.isEmpty()) {
			return coding;
		}
		return whoDrugStore.productDetail(coding.getVersionId(), product.get().getCode())
				.map(coding::withProduct)
				.orElse(coding);
	}

	/** Products coded to {@code atcPrefix} or any class below it. */
	public List<HierarchyNode> productsUnderAtc(String atcPrefix, Integer limit, Long versionId) {
		if (StringUtils.isBlank(atcPrefix)) {
			throw new IllegalArgumentException("ATC code is required");
		}
		Optional<Long> version = versions().effectiveVersionId(versionId);
		if (version.isEmpty()) {
			return List.of();
		}
		return whoDrugStore.productsUnderAtc(version.get(), atcPrefix.trim().toUpperCase(Locale.ROOT),
				searchEngine().effectiveLimit(limit));
	}

	/** Ingredients of one product, by name. */
	public List<HierarchyNode> ingredientsOf(String drugCode, Long versionId) {
		if (StringUtils.isBlank(drugCode)) {
			throw new IllegalArgumentException("Drug code is required");
		}
		Optional<Long> version = versions().effectiveVersionId(versionId);
		if (version.isEmpty()) {
			return List.of();
		}
		return whoDrugStore.childrenOf(HierarchyLevel.PRODUCT, VersionedCode.of(version.get(), drugCode));
	}

	public List<HierarchyNode> searchIngredients(String query, Integer limit, Long versionId) {
		String q = StringUtils.trimToEmpty(query);
		if (q.length() < SearchEngine.MIN_QUERY_LENGTH) {
			return List.of();
		}
		Optional<Long> version = versions().effectiveVersionId(versionId);
		if (version.isEmpty()) {
			return List.of();
		}
		return whoDrugStore.searchIngredients(version.get(), q.toLowerCase(Locale.ROOT),
				searchEngine().effectiveLimit(limit));
	}
}
