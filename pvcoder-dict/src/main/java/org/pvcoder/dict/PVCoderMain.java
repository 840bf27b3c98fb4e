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

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.pvcoder.dict.conf.ConfigLoader;
import org.pvcoder.dict.om.CodedTerm;
import org.pvcoder.dict.om.Coding;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.DictionaryVersion;
import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.ImportProgress;
import org.pvcoder.dict.om.ProductDetail;
import org.pvcoder.dict.om.ProductIngredient;
import org.pvcoder.dict.om.SearchRequest;
import org.pvcoder.dict.om.SearchResult;
import org.pvcoder.dict.om.TreeNode;
import org.pvcoder.dict.util.Logger;

/**
 * Command-line front end.
 *
 * <pre>
 * pvcoder [--config FILE] &lt;meddra|whodrug&gt; versions
 * pvcoder [--config FILE] &lt;meddra|whodrug&gt; activate ID
 * pvcoder [--config FILE] &lt;meddra|whodrug&gt; delete ID
 * pvcoder [--config FILE] &lt;meddra|whodrug&gt; import LABEL DIR [--date YYYY-MM-DD] [--by USER]
 * pvcoder [--config FILE] &lt;meddra|whodrug&gt; search QUERY... [--all] [--limit N] [--version ID] [--country CC]
 * pvcoder [--config FILE] &lt;meddra|whodrug&gt; browse [LEVEL CODE] [--version ID]
 * pvcoder [--config FILE] &lt;meddra|whodrug&gt; code CODE VERBATIM... [--level LEVEL] [--coder ID] [--version ID]
 * </pre>
 *
 * Exit codes: 0 success, 1 dictionary error, 2 usage error.
 */
public class PVCoderMain {

	static final int EXIT_OK = 0;
	static final int EXIT_FAILED = 1;
	static final int EXIT_USAGE = 2;

	private static final Set<String> FLAGS = Set.of("all");
	private static final Set<String> OPTIONS = Set.of("config", "date", "by", "limit", "version", "country",
			"level", "coder");

	private TerminologyEngine engine;

	public PVCoderMain() {
	}

	/** Uses an already-built engine; {@code --config} is then ignored. */
	PVCoderMain(TerminologyEngine engine) {
		this.engine = engine;
	}

	public static void main(String[] args) {
		System.exit(new PVCoderMain().run(args, System.out));
	}

	/** Parses and runs one command. Never calls {@link System#exit(int)}. */
	public int run(String[] args, PrintStream out) {
		List<String> positional = new ArrayList<>();
		Map<String, String> options = new HashMap<>();
		try {
			parse(args, positional, options);
			if (positional.size() < 2) {
				usage(out);
				return EXIT_USAGE;
			}
			DictionaryType type = DictionaryType.parse(positional.get(0));
			String command = positional.get(1);
			List<String> rest = positional.subList(2, positional.size());

			TerminologyDictionary dictionary = engine(options).dictionary(type);
			switch (command) {
			case "versions":
				versions(dictionary, out);
				return EXIT_OK;
			case "activate":
				dictionary.activateVersion(requireId(rest, "activate"));
				out.println("Activated version " + rest.get(0));
				return EXIT_OK;
			case "delete":
				dictionary.deleteVersion(requireId(rest, "delete"));
				out.println("Deleted version " + rest.get(0));
				return EXIT_OK;
			case "import":
				importDirectory(dictionary, rest, options, out);
				return EXIT_OK;
			case "search":
				search(dictionary, rest, options, out);
				return EXIT_OK;
			case "browse":
				browse(dictionary, rest, options, out);
				return EXIT_OK;
			case "code":
				code(dictionary, rest, options, out);
				return EXIT_OK;
			default:
				out.println("Unknown command: " + command);
				usage(out);
				return EXIT_USAGE;
			}
		} catch (IllegalArgumentException ex) {
			out.println("Error: " + ex.getMessage());
			return EXIT_USAGE;
		} catch (DictionaryException ex) {
			out.println("Error [" + ex.getKind() + "]: " + ex.getMessage());
			Logger.debug("Command failed", ex);
			return EXIT_FAILED;
		} catch (IllegalStateException ex) {
			// configuration problems
			out.println("Error: " + ex.getMessage());
			return EXIT_FAILED;
		}
	}

	// -------------------------- Commands ---------------------------------------

	private static void versions(TerminologyDictionary dictionary, PrintStream out) {
		List<DictionaryVersion> all = dictionary.listVersions();
		if (all.isEmpty()) {
			out.println("No " + dictionary.getDictionary().getDisplayName() + " versions");
			return;
		}
		for (DictionaryVersion v : all) {
			out.println(String.format("%s%-5d %-16s %-12s %-12s leaf=%d terms=%d", v.isActive() ? "*" : " ",
					v.getId(), v.getLabel(), v.getLoadState(),
					v.getReleaseDate() == null ? "-" : v.getReleaseDate().toString(), v.getLeafCount(),
					v.getTermCount()));
		}
	}

	private static void importDirectory(TerminologyDictionary dictionary, List<String> rest,
			Map<String, String> options, PrintStream out) {
		if (rest.size() != 2) {
			throw new IllegalArgumentException("import needs LABEL and DIR");
		}
		LocalDate releaseDate = null;
		if (options.containsKey("date")) {
			try {
				releaseDate = LocalDate.parse(options.get("date"));
			} catch (DateTimeParseException ex) {
				throw new IllegalArgumentException("Invalid --date: " + options.get("date"), ex);
			}
		}
		try {
			DictionaryVersion v = dictionary.importDirectory(rest.get(0), releaseDate, options.get("by"),
					Path.of(rest.get(1)));
			ImportProgress progress = dictionary.getImportProgress();
			out.println("Imported version " + v.getId() + " (" + v.getLabel() + "): " + v.getLeafCount()
					+ " leaf terms, " + v.getTermCount() + " terms, " + progress.getLinesSkipped()
					+ " lines skipped");
			out.println("Run 'activate " + v.getId() + "' to make it the active version.");
		} catch (DictionaryException ex) {
			ImportProgress progress = dictionary.getImportProgress();
			if (progress != null && progress.getVersionId() != null) {
				out.println("Version " + progress.getVersionId() + " is " + progress.getStatus()
						+ "; delete it before retrying.");
			}
			throw ex;
		}
	}

	private static void search(TerminologyDictionary dictionary, List<String> rest, Map<String, String> options,
			PrintStream out) {
		SearchRequest request = SearchRequest.builder()
				.query(String.join(" ", rest))
				.limit(optionalInt(options, "limit"))
				.includeNonCurrent(options.containsKey("all"))
				.versionId(optionalLong(options, "version"))
				.countryCode(options.get("country"))
				.build();
		List<SearchResult> results = dictionary.search(request);
		for (SearchResult r : results) {
			StringBuilder line = new StringBuilder();
			line.append(String.format("%-16s %-10s %s", r.getTier(), r.getCode(), r.getName()));
			if (Boolean.FALSE.equals(r.getCurrent())) {
				line.append(" (non-current)");
			}
			if (r.getParentCode() != null) {
				line.append(" | ").append(r.getParentCode()).append(' ').append(r.getParentName());
			}
			if (r.getTopCode() != null) {
				line.append(" | ").append(r.getTopCode()).append(' ').append(r.getTopName());
			}
			out.println(line);
		}
		out.println(results.size() + " result(s)");
	}

	private static void browse(TerminologyDictionary dictionary, List<String> rest, Map<String, String> options,
			PrintStream out) {
		if (rest.size() != 0 && rest.size() != 2) {
			throw new IllegalArgumentException("browse takes either nothing or LEVEL CODE");
		}
		HierarchyLevel level = rest.isEmpty() ? null : HierarchyLevel.parse(rest.get(0));
		String code = rest.isEmpty() ? null : rest.get(1);
		for (TreeNode n : dictionary.browse(level, code, optionalLong(options, "version"))) {
			out.println((n.isLeaf() ? "  " : "+ ") + n.getKey() + " " + n.getName());
		}
	}

	private static void code(TerminologyDictionary dictionary, List<String> rest, Map<String, String> options,
			PrintStream out) {
		if (rest.size() < 2) {
			throw new IllegalArgumentException("code needs CODE and VERBATIM");
		}
		String code = rest.get(0);
		String verbatim = String.join(" ", rest.subList(1, rest.size()));
		Long versionId = optionalLong(options, "version");
		Coding coding = options.containsKey("level")
				? dictionary.resolveCoding(HierarchyLevel.parse(options.get("level")), code, verbatim,
						options.get("coder"), versionId)
				: dictionary.resolveCoding(code, verbatim, options.get("coder"), versionId);

		out.println("Verbatim: " + coding.getVerbatim());
		out.println("Version:  " + coding.getVersionLabel() + " (" + coding.getVersionId() + ")");
		for (CodedTerm t : coding.getTerms()) {
			out.println(String.format("  %-11s %-10s %s", t.getLevel(), t.getCode(), t.getName()));
		}
		out.println("Primary path: " + (coding.isPrimaryPath() ? "yes" : "no"));
		ProductDetail product = coding.getProduct();
		if (product != null) {
			out.println("Product:  " + product.getDrugCode() + " " + product.getDrugName() + " ["
					+ StringUtils.defaultString(product.getCountryCode(), "-") + ", "
					+ StringUtils.defaultString(product.getFormulation(), "-") + "]");
			for (ProductIngredient i : product.getIngredients()) {
				out.println("  " + i.getIngredientName() + (i.getStrength() == null ? "" : " " + i.getStrength()));
			}
		}
	}

	// -------------------------- Internals --------------------------------------

	private TerminologyEngine engine(Map<String, String> options) {
		if (engine == null) {
			ConfigLoader cfg = options.containsKey("config") ? new ConfigLoader(Path.of(options.get("config")))
					: new ConfigLoader();
			engine = new TerminologyEngine(cfg);
		}
		return engine;
	}

	static void parse(String[] args, List<String> positional, Map<String, String> options) {
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if (!arg.startsWith("--")) {
				positional.add(arg);
				continue;
			}
			String name = arg.substring(2);
			if (FLAGS.contains(name)) {
				options.put(name, "true");
			} else if (OPTIONS.contains(name)) {
				if (i + 1 >= args.length) {
					throw new IllegalArgumentException("Missing value for " + arg);
				}
				options.put(name, args[++i]);
			} else {
				throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}
	}

	private static long requireId(List<String> rest, String command) {
		if (rest.size() != 1 || !NumberUtils.isDigits(rest.get(0))) {
			throw new IllegalArgumentException(command + " needs a numeric version id");
		}
		return Long.parseLong(rest.get(0));
	}

	private static Integer optionalInt(Map<String, String> options, String key) {
		String raw = options.get(key);
		if (raw == null) {
			return null;
		}
		if (!NumberUtils.isDigits(raw)) {
			throw new IllegalArgumentException("--" + key + " must be a number: " + raw);
		}
		return Integer.valueOf(raw);
	}

	private static Long optionalLong(Map<String, String> options, String key) {
		String raw = options.get(key);
		if (StringUtils.isBlank(raw)) {
			return null;
		}
		if (!NumberUtils.isDigits(raw)) {
			throw new IllegalArgumentException("--" + key + " must be a number: " + raw);
		}
		return Long.valueOf(raw);
	}

	private static void usage(PrintStream out) {
		out.println("Usage: pvcoder [--config FILE] <meddra|whodrug> <command> [args]");
		out.println("  versions");
		out.println("  activate ID");
		out.println("  delete ID");
		out.println("  import LABEL DIR [--date YYYY-MM-DD] [--by USER]");
		out.println("  search QUERY... [--all] [--limit N] [--version ID] [--country CC]");
		out.println("  browse [LEVEL CODE] [--version ID]");
		out.println("  code CODE VERBATIM... [--level LEVEL] [--coder ID] [--version ID]");
	}
}
