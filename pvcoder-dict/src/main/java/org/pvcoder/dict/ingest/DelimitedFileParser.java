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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.DictionaryException.ErrorKind;

/**
 * Opens distribution files as {@link ParsedFile}s.
 * <p>
 * Vendor files are not quoted, so quoting is switched off and a stray {@code "}
 * in a term name is kept as-is. Input is decoded as UTF-8 with bad bytes
 * replaced, so one Latin-1 character does not abort a whole file.
 */
public final class DelimitedFileParser {

	/** Whole {@code _}-separated tokens that mark a WHO Drug header line. */
	private static final Set<String> HEADER_TOKENS = Set.of("code", "id", "name");

	private DelimitedFileParser() {
	}

	public static <T> ParsedFile<T> open(Path file, FileLayout<T> layout) {
		if (file == null || !Files.isRegularFile(file) || !Files.isReadable(file)) {
			throw new DictionaryException(ErrorKind.FILE_NOT_FOUND,
					"File not found or not readable for " + layout.getName() + ": " + file);
		}
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(layout.getDelimiter())
				.setQuote(null)
				.setIgnoreEmptyLines(true)
				.setTrim(true)
				.build();

		Reader reader = null;
		try {
			reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), lenientUtf8()));
			return new ParsedFile<>(file, layout, CSVParser.parse(reader, format));
		} catch (IOException ex) {
			closeQuietly(reader, ex);
			throw new DictionaryException(ErrorKind.FILE_NOT_FOUND, "Cannot open " + file + ": " + ex.getMessage(), ex);
		}
	}

	/**
	 * A first line is a header when one of its fields contains {@code code},
	 * {@code id} or {@code name} as a whole token, e.g. {@code drug_code} or
	 * {@code ingredient_name}.
	 */
	static boolean looksLikeHeader(CSVRecord line) {
		for (String field : line) {
			if (StringUtils.isBlank(field)) {
				continue;
			}
			for (String token : field.trim().toLowerCase(Locale.ROOT).split("_")) {
				if (HEADER_TOKENS.contains(token)) {
					return true;
				}
			}
		}
		return false;
	}

	private static CharsetDecoder lenientUtf8() {
		return StandardCharsets.UTF_8.newDecoder()
				.onMalformedInput(CodingErrorAction.REPLACE)
				.onUnmappableCharacter(CodingErrorAction.REPLACE);
	}

	private static void closeQuietly(Reader reader, Exception primary) {
		if (reader == null) {
			return;
		}
		try {
			reader.close();
		} catch (IOException closeFailure) {
			primary.addSuppressed(closeFailure);
		}
	}
}
