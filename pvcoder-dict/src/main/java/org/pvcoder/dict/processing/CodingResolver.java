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

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.om.CodedTerm;
import org.pvcoder.dict.om.Coding;
import org.pvcoder.dict.om.DictionaryVersion;
import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.HierarchyNode;
import org.pvcoder.dict.om.HierarchyPath;
import org.pvcoder.dict.store.HierarchyStore;
import org.pvcoder.dict.util.Logger;

/**
 * Turns a code plus verbatim text into a {@link Coding}.
 * <p>
 * All complete paths from the code up to the top level are enumerated at call
 * time. A path is primary when its top node equals the nearest primary-parent
 * attribute along it (a PT's primary SOC). The primary path is coded; without
 * one, the first enumerated path is.
 * <p>
 * Paths are enumerated in the order the store returns parents, by name and then
 * code. A WHO Drug ingredient therefore codes through the first of its products
 * in that order, and the result is stable for a given version.
 * <p>
 * WHO Drug products may carry a blank ATC code or one missing from the ATC
 * file. When such a node has no complete path, the longest partial path ending
 * at it is used instead, down to the node on its own, and is never primary.
 * MedDRA nodes without a complete path are reported as not found.
 */
public class CodingResolver {

	/** Guards against fan-out blow-up, e.g. an ingredient contained in thousands of products. */
	static final int MAX_PATHS = 256;

	private final HierarchyStore store;
	private final VersionManager versions;
	private final Clock clock;

	public CodingResolver(HierarchyStore store, VersionManager versions) {
		this(store, versions, Clock.systemUTC());
	}

	CodingResolver(HierarchyStore store, VersionManager versions, Clock clock) {
		this.store = store;
		this.versions = versions;
		this.clock = clock;
	}

	/**
	 * @throws DictionaryException NOT_FOUND when the code is absent from the version,
	 *                             NO_ACTIVE_VERSION when no version is given and none is active
	 */
	public List<HierarchyPath> paths(HierarchyLevel level, String code, Long versionId) {
		DictionaryVersion version = versions.resolve(versionId);
		HierarchyNode start = store.byCode(level, level.key(version.getId(), code))
				.orElseThrow(() -> notFound(level, code, version));
		return enumerate(start);
	}

	/** Codes against the first of the dictionary's coding levels that knows {@code code}. */
	public Coding resolve(String code, String verbatim, String coderId, Long versionId) {
		DictionaryVersion version = versions.resolve(versionId);
		for (HierarchyLevel level : store.getDictionary().codingLevels()) {
			Optional<HierarchyNode> node = store.byCode(level, level.key(version.getId(), code));
			if (node.isPresent()) {
				return code(node.get(), verbatim, coderId, version);
			}
		}
		throw DictionaryException.notFound(store.getDictionary().getDisplayName() + " code " + code
				+ " not found in version " + version.getLabel() + " (" + version.getId() + ")");
	}

	public Coding resolve(HierarchyLevel level, String code, String verbatim, String coderId, Long versionId) {
		DictionaryVersion version = versions.resolve(versionId);
		HierarchyNode node = store.byCode(level, level.key(version.getId(), code))
				.orElseThrow(() -> notFound(level, code, version));
		return code(node, verbatim, coderId, version);
	}

	private Coding code(HierarchyNode node, String verbatim, String coderId, DictionaryVersion version) {
		if (StringUtils.isBlank(verbatim)) {
			throw new IllegalArgumentException("Verbatim text is required");
		}
		List<HierarchyPath> paths = enumerate(node);
		HierarchyPath selected = paths.stream().filter(HierarchyPath::isPrimary).findFirst().orElse(paths.get(0));
		if (!selected.isPrimary()) {
			Logger.debug("No primary path for {} {}; using the first of {}", node.getLevel(), node.getCode(),
					paths.size());
		}
		List<CodedTerm> terms = selected.getNodes().stream()
				.map(n -> new CodedTerm(n.getLevel(), n.getCode(), n.getName()))
				.toList();
		return new Coding(verbatim, version.getDictionary(), version.getId(), version.getLabel(), terms,
				selected.isPrimary(), StringUtils.trimToNull(coderId), clock.instant(), null);
	}

	private List<HierarchyPath> enumerate(HierarchyNode start) {
		List<List<HierarchyNode>> found = new ArrayList<>();
		List<HierarchyNode> longestPartial = new ArrayList<>();
		walk(start, new ArrayDeque<>(), found, longestPartial);
		if (found.isEmpty()) {
			if (store.getDictionary().codesPartialPaths() && !longestPartial.isEmpty()) {
				Logger.debug("{} {} has no complete path; using a partial path of {} node(s)", start.getLevel(),
						start.getCode(), longestPartial.size());
				return List.of(new HierarchyPath(longestPartial, false));
			}
			throw DictionaryException.notFound(start.getLevel() + " " + start.getCode()
					+ " has no complete path to the top of the hierarchy");
		}
		if (found.size() >= MAX_PATHS) {
			Logger.warn("Path enumeration for {} {} stopped at {} paths", start.getLevel(), start.getCode(), MAX_PATHS);
		}
		List<HierarchyPath> paths = new ArrayList<>(found.size());
		for (List<HierarchyNode> nodes : found) {
			paths.add(new HierarchyPath(nodes, isPrimary(nodes)));
		}
		return paths;
	}

	/**
	 * Depth-first up the parents; the head of {@code trail} is the highest node reached so far.
	 * Trails that stop below the top level are kept in {@code longestPartial} when longer than the last one.
	 */
	private void walk(HierarchyNode node, Deque<HierarchyNode> trail, List<List<HierarchyNode>> found,
			List<HierarchyNode> longestPartial) {
		if (found.size() >= MAX_PATHS) {
			return;
		}
		trail.push(node);
		if (node.getLevel().isTop()) {
			found.add(new ArrayList<>(trail));
		} else {
			List<HierarchyNode> parents = store.parentsOf(node.getLevel(), node.getKey());
			if (parents.isEmpty() && trail.size() > longestPartial.size()) {
				longestPartial.clear();
				longestPartial.addAll(trail);
			}
			for (HierarchyNode parent : parents) {
				walk(parent, trail, found, longestPartial);
			}
		}
		trail.pop();
	}

	/** {@code nodes} runs top first; the nearest primary-parent attribute is the lowest one set. */
	static boolean isPrimary(List<HierarchyNode> nodes) {
		for (int i = nodes.size() - 1; i >= 0; i--) {
			String primaryParent = nodes.get(i).getPrimaryParentCode();
			if (primaryParent != null) {
				return primaryParent.equals(nodes.get(0).getCode());
			}
		}
		return false;
	}

	private DictionaryException notFound(HierarchyLevel level, String code, DictionaryVersion version) {
		return DictionaryException.notFound(level + " " + code + " not found in "
				+ version.getDictionary().getDisplayName() + " version " + version.getLabel()
				+ " (" + version.getId() + ")");
	}
}
