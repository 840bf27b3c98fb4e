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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import lombok.Value;
import lombok.With;

/**
 * The immutable result of coding a verbatim term against one dictionary version.
 * Re-coding produces a new instance; nothing here is ever updated in place.
 */
@Value
public class Coding {

	String verbatim;
	DictionaryType dictionary;
	long versionId;
	String versionLabel;
	/** Top level first, coded node last. */
	List<CodedTerm> terms;
	boolean primaryPath;
	String coderId;
	Instant codedAt;
	/** WHO Drug only: the product on the coded path, {@code null} otherwise. */
	@With
	ProductDetail product;

	public Coding(String verbatim, DictionaryType dictionary, long versionId, String versionLabel,
			List<CodedTerm> terms, boolean primaryPath, String coderId, Instant codedAt, ProductDetail product) {
		this.verbatim = verbatim;
		this.dictionary = dictionary;
		this.versionId = versionId;
		this.versionLabel = versionLabel;
		this.terms = List.copyOf(terms);
		this.primaryPath = primaryPath;
		this.coderId = coderId;
		this.codedAt = codedAt;
		this.product = product;
	}

	public Optional<CodedTerm> termAt(HierarchyLevel level) {
		return terms.stream().filter(t -> t.getLevel() == level).findFirst();
	}

	/** The node the verbatim was coded to. */
	public CodedTerm codedTerm() {
		return terms.get(terms.size() - 1);
	}
}
