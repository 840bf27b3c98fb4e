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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

import org.pvcoder.dict.conf.ConfigLoader;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.DistributionFile;
import org.pvcoder.dict.store.DictionaryDatabase;
import org.pvcoder.dict.store.SchemaInitializer;

/**
 * Small but structurally complete MedDRA and WHO Drug releases written to a
 * temp directory, plus per-test in-memory databases.
 *
 * <pre>
 * SOC 10007541 Cardiac disorders
 *   HLGT 10007521 Cardiac arrhythmias
 *     HLT 10042600 Supraventricular arrhythmias
 *       PT 10043071 Tachycardia (primary SOC 10007541)
 *       PT 10003658 Atrial fibrillation
 * SOC 10047065 Vascular disorders
 *   HLGT 10047066 Vascular hypertensive disorders
 *     HLT 10020775 Vascular hypertensive disorders NEC
 *       PT 10020772 Hypertension
 *     HLT 10047067 Rate and rhythm disorders NEC
 *       PT 10043071 Tachycardia (secondary)
 *       PT 10033557 Palpitations (no primary SOC)
 * </pre>
 */
public final class DictionaryFixtures {

	public static final String CARDIAC_SOC = "10007541";
	public static final String VASCULAR_SOC = "10047065";
	public static final String ARRHYTHMIAS_HLGT = "10007521";
	public static final String SUPRAVENTRICULAR_HLT = "10042600";
	public static final String RATE_RHYTHM_HLT = "10047067";
	public static final String TACHYCARDIA_PT = "10043071";
	public static final String PALPITATIONS_PT = "10033557";
	public static final String HEART_RACING_LLT = "10019305";
	public static final String TACHY_PAROXYSMAL_LLT = "10043074";

	/** LLT rows in the MedDRA fixture, current or not. */
	public static final int MEDDRA_LLT_COUNT = 10;
	public static final int MEDDRA_PT_COUNT = 4;

	private DictionaryFixtures() {
	}

	// ---- Databases ------------------------------------------------------------

	public static String uniqueUrl(String prefix) {
		return "jdbc:h2:mem:" + prefix + "_" + UUID.randomUUID().toString().replace("-", "")
				+ ";MODE=MySQL;DATABASE_TO_UPPER=false;DB_CLOSE_DELAY=-1";
	}

	public static Properties properties(String url) {
		Properties p = new Properties();
		p.setProperty("DB_URL", url);
		p.setProperty("DB_USER", "sa");
		p.setProperty("DB_PASS", "");
		p.setProperty("DB_CONNECT_RETRIES", "0");
		p.setProperty("IMPORT_BATCH_SIZE", "2");
		p.setProperty("IMPORT_QUEUE_CAPACITY", "2");
		p.setProperty("SEARCH_DEFAULT_LIMIT", "20");
		p.setProperty("SEARCH_MAX_LIMIT", "100");
		return p;
	}

	public static TerminologyEngine engine(String prefix) {
		return new TerminologyEngine(new ConfigLoader(properties(uniqueUrl(prefix))));
	}

	/** A fresh database with the schema applied. */
	public static DictionaryDatabase database(String prefix) {
		DictionaryDatabase db = new DictionaryDatabase(uniqueUrl(prefix), "sa", "", null, 0);
		SchemaInitializer.apply(db);
		return db;
	}

	// ---- MedDRA ---------------------------------------------------------------

	public static Map<DistributionFile, Path> writeMeddra(Path dir) throws IOException {
		Files.createDirectories(dir);
		write(dir, "soc.asc",
				CARDIAC_SOC + "$Cardiac disorders$Card$",
				VASCULAR_SOC + "$Vascular disorders$Vasc$");
		write(dir, "hlgt.asc",
				ARRHYTHMIAS_HLGT + "$Cardiac arrhythmias$",
				"10047066$Vascular hypertensive disorders$");
		write(dir, "hlt.asc",
				SUPRAVENTRICULAR_HLT + "$Supraventricular arrhythmias$",
				"10020775$Vascular hypertensive disorders NEC$",
				RATE_RHYTHM_HLT + "$Rate and rhythm disorders NEC$");
		write(dir, "pt.asc",
				pt(TACHYCARDIA_PT, "Tachycardia", CARDIAC_SOC),
				pt("10003658", "Atrial fibrillation", CARDIAC_SOC),
				pt("10020772", "Hypertension", VASCULAR_SOC),
				pt(PALPITATIONS_PT, "Palpitations", ""));
		write(dir, "llt.asc",
				llt(TACHYCARDIA_PT, "Tachycardia", TACHYCARDIA_PT, true),
				llt(HEART_RACING_LLT, "Heart racing", TACHYCARDIA_PT, true),
				llt(TACHY_PAROXYSMAL_LLT, "Tachycardia paroxysmal", TACHYCARDIA_PT, false),
				llt("10040752", "Sinus tachycardia", TACHYCARDIA_PT, true),
				llt("10043068", "Tachyarrhythmia", TACHYCARDIA_PT, true),
				llt("10020772", "Hypertension", "10020772", true),
				llt("10005750", "High blood pressure", "10020772", true),
				llt("10003658", "Atrial fibrillation", "10003658", true),
				llt("10003662", "AF", "10003658", true),
				llt(PALPITATIONS_PT, "Palpitations", PALPITATIONS_PT, true));
		write(dir, "soc_hlgt.asc",
				CARDIAC_SOC + "$" + ARRHYTHMIAS_HLGT + "$",
				VASCULAR_SOC + "$10047066$");
		write(dir, "hlgt_hlt.asc",
				ARRHYTHMIAS_HLGT + "$" + SUPRAVENTRICULAR_HLT + "$",
				"10047066$10020775$",
				"10047066$" + RATE_RHYTHM_HLT + "$");
		write(dir, "hlt_pt.asc",
				SUPRAVENTRICULAR_HLT + "$" + TACHYCARDIA_PT + "$",
				SUPRAVENTRICULAR_HLT + "$10003658$",
				"10020775$10020772$",
				RATE_RHYTHM_HLT + "$" + TACHYCARDIA_PT + "$",
				RATE_RHYTHM_HLT + "$" + PALPITATIONS_PT + "$");
		return files(DictionaryType.MEDDRA, dir);
	}

	public static String pt(String code, String name, String primarySoc) {
		return String.join("$", code, name, "", primarySoc, "");
	}

	/** Ten columns with the currency flag in the tenth. */
	public static String llt(String code, String name, String ptCode, boolean current) {
		return String.join("$", code, name, ptCode, "", "", "", "", "", "", current ? "Y" : "N", "");
	}

	// ---- WHO Drug -------------------------------------------------------------

	/**
	 * ATC tree N (nervous system) / N02 / N02B / N02BE / N02BE01 with products
	 * Panadol (GB) and Tylenol (US) coded to N02BE01 and a combination product
	 * coded directly to level 4 class N02BE.
	 */
	public static Map<DistributionFile, Path> writeWhoDrug(Path dir) throws IOException {
		Files.createDirectories(dir);
		write(dir, "atc.txt",
				"atc_code|atc_name",
				"N|NERVOUS SYSTEM",
				"N02|ANALGESICS",
				"N02B|OTHER ANALGESICS AND ANTIPYRETICS",
				"N02BE|Anilides",
				"N02BE01|Paracetamol",
				"N0|broken level");
		write(dir, "ingredients.txt",
				"ingredient_id|ingredient_name",
				"ING1|Paracetamol",
				"ING2|Caffeine",
				"ING3|Codeine phosphate");
		write(dir, "products.txt",
				"drug_code|drug_name|drug_name_english|country_code|company|atc_code|formulation|marketing_status",
				"000200010010|Panadol|Panadol|GB|GSK|N02BE01|Tablet|Marketed",
				"000200010020|Tylenol|Tylenol|US|McNeil|N02BE01|Tablet|Marketed",
				"000200010030|Panadol Extra|Panadol Extra|GB|GSK|N02BE|Tablet|Marketed");
		write(dir, "product_ingredients.txt",
				"drug_code|ingredient_id|strength",
				"000200010010|ING1|500 mg",
				"000200010020|ING1|325 mg",
				"000200010030|ING1|500 mg",
				"000200010030|ING2|65 mg");
		return files(DictionaryType.WHODRUG, dir);
	}

	// ---- helpers --------------------------------------------------------------

	public static Path write(Path dir, String name, String... lines) throws IOException {
		Path f = dir.resolve(name);
		Files.write(f, List.of(lines), StandardCharsets.UTF_8);
		return f;
	}

	public static Map<DistributionFile, Path> files(DictionaryType type, Path dir) {
		Map<DistributionFile, Path> out = new EnumMap<>(DistributionFile.class);
		for (DistributionFile f : DistributionFile.forDictionary(type)) {
			Path p = dir.resolve(f.getDefaultFileName());
			if (Files.exists(p)) {
				out.put(f, p);
			}
		}
		return out;
	}
}
