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

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.pvcoder.dict.om.Coding;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.DictionaryVersion;
import org.pvcoder.dict.om.DistributionFile;
import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.HierarchyPath;
import org.pvcoder.dict.om.ImportProgress;
import org.pvcoder.dict.om.SearchRequest;
import org.pvcoder.dict.om.SearchResult;
import org.pvcoder.dict.om.TreeNode;
import org.pvcoder.dict.processing.CodingResolver;
import org.pvcoder.dict.processing.DictionaryImporter;
import org.pvcoder.dict.processing.SearchEngine;
import org.pvcoder.dict.processing.TreeBrowser;
import org.pvcoder.dict.processing.VersionManager;
import org.pvcoder.dict.store.HierarchyStore;

/**
 * Entry point for one dictionary type: version administration, import,
 * search, browsing and coding. Obtain instances from {@link TerminologyEngine}.
 *
 * <p>Operations that take a {@code versionId} use the active version when it is
 * {@code null}.</p>
 */
public class TerminologyDictionary {

	private final HierarchyStore store;
	private final VersionManager versions;
	private final DictionaryImporter importer;
	private final SearchEngine searchEngine;
	private final TreeBrowser browser;
	private final CodingResolver resolver;

	public TerminologyDictionary(HierarchyStore store, VersionManager versions, DictionaryImporter importer,
			SearchEngine searchEngine) {
		if (store.getDictionary() != versions.getDictionary() || importer.getDictionary() != versions.getDictionary()) {
			throw new IllegalArgumentException("Store, versions and importer must serve the same dictionary");
		}
		this.store = store;
		this.versions = versions;
		this.importer = importer;
		this.searchEngine = searchEngine;
		this.browser = new TreeBrowser(store, versions);
		this.resolver = new CodingResolver(store, versions);
	}

	public DictionaryType getDictionary() {
		return store.getDictionary();
	}

	// ---- Versions -------------------------------------------------------------

	public List<DictionaryVersion> listVersions() {
		return versions.list();
	}

	public Optional<DictionaryVersion> getActiveVersion() {
		return versions.getActive();
	}

	public Optional<DictionaryVersion> getVersion(long versionId) {
		return versions.getById(versionId);
	}

	public void activateVersion(long versionId) {
		versions.activate(versionId);
	}

	public void deleteVersion(long versionId) {
		versions.delete(versionId);
	}

	// ---- Import ---------------------------------------------------------------

	public DictionaryVersion importDictionary(String label, LocalDate releaseDate, String importedBy,
			Map<DistributionFile, Path> files) {
		return importer.importFiles(label, releaseDate, importedBy, files);
	}

	/** Imports the standard distribution files found in {@code directory}. */
	public DictionaryVersion importDirectory(String label, LocalDate releaseDate, String importedBy, Path directory) {
		return importer.importDirectory(label, releaseDate, importedBy, directory);
	}

	/** @return the running or last import's progress, or {@code null} if there has been none */
	public ImportProgress getImportProgress() {
		return importer.getProgress();
	}

	// ---- Search, browse, code -------------------------------------------------

	public List<SearchResult> search(SearchRequest request) {
		return searchEngine.search(request);
	}

	public List<SearchResult> search(String query) {
		return search(SearchRequest.of(query));
	}

	/** Top level of the active version. */
	public List<TreeNode> browse() {
		return browser.browse(null, null, null);
	}

	public List<TreeNode> browse(HierarchyLevel parentLevel, String parentCode, Long versionId) {
		return browser.browse(parentLevel, parentCode, versionId);
	}

	public Coding resolveCoding(String code, String verbatim, String coderId) {
		return complete(resolver.resolve(code, verbatim, coderId, null));
	}

	public Coding resolveCoding(String code, String verbatim, String coderId, Long versionId) {
		return complete(resolver.resolve(code, verbatim, coderId, versionId));
	}

	public Coding resolveCoding(HierarchyLevel level, String code, String verbatim, String coderId, Long versionId) {
		return complete(resolver.resolve(level, code, verbatim, coderId, versionId));
	}

	public List<HierarchyPath> paths(HierarchyLevel level, String code, Long versionId) {
		return resolver.paths(level, code, versionId);
	}

	// ---- For subclasses -------------------------------------------------------

	/** Adds dictionary-specific context to a fresh coding; the default adds nothing. */
	protected Coding complete(Coding coding) {
		return coding;
	}

	protected VersionManager versions() {
		return versions;
	}

	protected SearchEngine searchEngine() {
		return searchEngine;
	}
}
