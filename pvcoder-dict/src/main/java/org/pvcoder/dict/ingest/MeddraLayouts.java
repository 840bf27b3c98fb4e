package org.pvcoder.dict.ingest;

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

import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * Column layouts of the MedDRA ASCII distribution ({@code $}-delimited, no header).
 *
 * <pre>
 * soc.asc       soc_code$soc_name$soc_abbrev$...
 * hlgt.asc      hlgt_code$hlgt_name$...
 * hlt.asc       hlt_code$hlt_name$...
 * pt.asc        pt_code$pt_name$null_field$pt_soc_code$...
 * llt.asc       llt_code$llt_name$pt_code$...$llt_currency (column 10)$...
 * soc_hlgt.asc  soc_code$hlgt_code$  (likewise hlgt_hlt.asc, hlt_pt.asc)
 * </pre>
 */
public final class MeddraLayouts {

	static final char DELIMITER = '$';

	private static final int LLT_CURRENCY_COLUMN = 9;

	public static final FileLayout<SocRecord> SOC = new FileLayout<>("soc", DELIMITER, false, 3, line -> {
		Integer code = code(line.get(0));
		String name = line.get(1);
		if (code == null || StringUtils.isBlank(name)) {
			return null;
		}
		return new SocRecord(code, name, StringUtils.trimToNull(line.get(2)));
	});

	public static final FileLayout<TermRecord> HLGT = term("hlgt");
	public static final FileLayout<TermRecord> HLT = term("hlt");

	public static final FileLayout<PtRecord> PT = new FileLayout<>("pt", DELIMITER, false, 4, line -> {
		Integer code = code(line.get(0));
		String name = line.get(1);
		if (code == null || StringUtils.isBlank(name)) {
			return null;
		}
		String soc = line.get(3);
		Integer primarySoc = null;
		if (StringUtils.isNotBlank(soc)) {
			primarySoc = code(soc);
			if (primarySoc == null) {
				return null;
			}
		}
		return new PtRecord(code, name, primarySoc);
	});

	public static final FileLayout<LltRecord> LLT = new FileLayout<>("llt", DELIMITER, false, 10, line -> {
		Integer code = code(line.get(0));
		Integer pt = code(line.get(2));
		String name = line.get(1);
		if (code == null || pt == null || StringUtils.isBlank(name)) {
			return null;
		}
		return new LltRecord(code, name, pt, "Y".equalsIgnoreCase(line.get(LLT_CURRENCY_COLUMN)));
	});

	public static final FileLayout<RelationRecord> SOC_HLGT = relation("soc_hlgt");
	public static final FileLayout<RelationRecord> HLGT_HLT = relation("hlgt_hlt");
	public static final FileLayout<RelationRecord> HLT_PT = relation("hlt_pt");

	private MeddraLayouts() {
	}

	private static FileLayout<TermRecord> term(String name) {
		return new FileLayout<>(name, DELIMITER, false, 2, line -> {
			Integer code = code(line.get(0));
			String termName = line.get(1);
			return code == null || StringUtils.isBlank(termName) ? null : new TermRecord(code, termName);
		});
	}

	private static FileLayout<RelationRecord> relation(String name) {
		return new FileLayout<>(name, DELIMITER, false, 2, (CSVRecord line) -> {
			Integer parent = code(line.get(0));
			Integer child = code(line.get(1));
			return parent == null || child == null ? null : new RelationRecord(parent, child);
		});
	}

	/** MedDRA codes are 8-digit integers; anything else is malformed. */
	static Integer code(String raw) {
		String s = StringUtils.trimToEmpty(raw);
		if (s.isEmpty() || s.length() > 9 || !StringUtils.isNumeric(s)) {
			return null;
		}
		return Integer.valueOf(s);
	}
}
