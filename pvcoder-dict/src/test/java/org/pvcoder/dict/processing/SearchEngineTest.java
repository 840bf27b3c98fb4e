package org.pvcoder.dict.processing;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pvcoder.dict.DictionaryFixtures;
import org.pvcoder.dict.TerminologyDictionary;
import org.pvcoder.dict.om.DictionaryVersion;
import org.pvcoder.dict.om.MatchTier;
import org.pvcoder.dict.om.SearchRequest;
import org.pvcoder.dict.om.SearchResult;
import org.pvcoder.dict.store.HierarchyStore;

class SearchEngineTest {

	@TempDir
	Path tmp;

	private TerminologyDictionary meddra;
	private DictionaryVersion version;

	@BeforeEach
	void setUp() throws Exception {
		meddra = DictionaryFixtures.engine("search").meddra();
		version = meddra.importDictionary("27.0", null, null, DictionaryFixtures.writeMeddra(tmp.resolve("27.0")));
		meddra.activateVersion(version.getId());
	}

	private static List<String> names(List<SearchResult> results) {
		return results.stream().map(SearchResult::getName).toList();
	}

	@Test
	@DisplayName("An LLT found only through its PT ranks last with PT and primary SOC context")
	void related_match_carries_context() {
		List<SearchResult> results = meddra.search("tachy");

		assertEquals(List.of("Tachyarrhythmia", "Tachycardia", "Sinus tachycardia", "Heart racing"), names(results));
		assertEquals(List.of(MatchTier.STARTS_WITH, MatchTier.STARTS_WITH, MatchTier.CONTAINS,
				MatchTier.RELATED_CONTAINS), results.stream().map(SearchResult::getTier).toList());

		SearchResult racing = results.get(3);
		assertEquals(DictionaryFixtures.HEART_RACING_LLT, racing.getCode());
		assertEquals(DictionaryFixtures.TACHYCARDIA_PT, racing.getParentCode());
		assertEquals("Tachycardia", racing.getParentName());
		assertEquals(DictionaryFixtures.CARDIAC_SOC, racing.getTopCode());
		assertEquals("Cardiac disorders", racing.getTopName());
		assertEquals(Boolean.TRUE, racing.getCurrent());
	}

	@Test
	@DisplayName("Exact match ranks first; matching is case-insensitive")
	void exact_match_first() {
		List<SearchResult> results = meddra.search("TACHYCARDIA");

		assertEquals("Tachycardia", results.get(0).getName());
		assertEquals(MatchTier.EXACT, results.get(0).getTier());
		assertEquals(List.of("Tachycardia", "Sinus tachycardia", "Heart racing", "Tachyarrhythmia"), names(results));
	}

	@Test
	@DisplayName("Non-current LLTs appear only on request")
	void non_current_terms() {
		SearchRequest all = SearchRequest.builder().query("paroxysmal").includeNonCurrent(true).build();

		assertTrue(meddra.search("paroxysmal").isEmpty());
		List<SearchResult> results = meddra.search(all);
		assertEquals(1, results.size());
		assertEquals(DictionaryFixtures.TACHY_PAROXYSMAL_LLT, results.get(0).getCode());
		assertEquals(Boolean.FALSE, results.get(0).getCurrent());
	}

	@Test
	void same_query_same_results() {
		assertEquals(meddra.search("ar"), meddra.search("ar"));
	}

	@Test
	@DisplayName("LIKE wildcards in the query are matched literally")
	void wildcards_are_literal() {
		assertTrue(meddra.search("t%").isEmpty());
		assertTrue(meddra.search("_a").isEmpty());
		assertTrue(meddra.search("t!").isEmpty());
	}

	@Test
	void limit_truncates_in_rank_order() {
		List<SearchResult> results = meddra.search(SearchRequest.builder().query("tachy").limit(2).build());

		assertEquals(List.of("Tachyarrhythmia", "Tachycardia"), names(results));
	}

	@Test
	@DisplayName("An explicit version is searched even when another is active")
	void version_override() throws Exception {
		DictionaryVersion next = meddra.importDictionary("27.1", null, null,
				DictionaryFixtures.writeMeddra(tmp.resolve("27.1")));

		List<SearchResult> results = meddra.search(SearchRequest.builder().query("af").versionId(next.getId()).build());

		assertTrue(results.stream().allMatch(r -> r.getVersionId() == next.getId()));
		assertEquals("AF", results.get(0).getName());
	}

	// ---- unit level -----------------------------------------------------------

	@Test
	@DisplayName("Queries under two characters never reach storage")
	void short_query_touches_nothing() {
		HierarchyStore store = mock(HierarchyStore.class);
		VersionManager versions = mock(VersionManager.class);
		SearchEngine engine = new SearchEngine(store, versions, 20, 100);

		assertTrue(engine.search(SearchRequest.of("t")).isEmpty());
		assertTrue(engine.search(SearchRequest.of("  x  ")).isEmpty());
		assertTrue(engine.search(SearchRequest.of(null)).isEmpty());

		verifyNoInteractions(store, versions);
	}

	@Test
	void no_active_version_returns_empty() {
		HierarchyStore store = mock(HierarchyStore.class);
		VersionManager versions = mock(VersionManager.class);
		when(versions.effectiveVersionId(null)).thenReturn(Optional.empty());
		SearchEngine engine = new SearchEngine(store, versions, 20, 100);

		assertTrue(engine.search(SearchRequest.of("tachy")).isEmpty());
		verify(store, never()).search(anyLong(), anyString(), anyBoolean(), any(), anyInt());
	}

	@Test
	void effective_limit_defaults_and_caps() {
		SearchEngine engine = new SearchEngine(mock(HierarchyStore.class), mock(VersionManager.class), 20, 100);

		assertEquals(20, engine.effectiveLimit(null));
		assertEquals(20, engine.effectiveLimit(0));
		assertEquals(7, engine.effectiveLimit(7));
		assertEquals(100, engine.effectiveLimit(1_000));
	}
}
