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

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.pvcoder.dict.util.Logger;

/**
 * Lazy, one-shot sequence of records read from a distribution file.
 * <p>
 * Lines that do not map to a record are dropped and counted. The counters are
 * safe to read from another thread while iteration is in progress.
 */
public final class ParsedFile<T> implements Iterable<T>, AutoCloseable {

	private final Path source;
	private final FileLayout<T> layout;
	private final CSVParser parser;

	private final AtomicBoolean iterated = new AtomicBoolean();
	private final AtomicLong accepted = new AtomicLong();
	private final AtomicLong skipped = new AtomicLong();
	private volatile boolean headerSkipped;

	ParsedFile(Path source, FileLayout<T> layout, CSVParser parser) {
		this.source = source;
		this.layout = layout;
		this.parser = parser;
	}

	/**
	 * @throws IllegalStateException on a second call; the underlying reader cannot rewind
	 */
	@Override
	public Iterator<T> iterator() {
		if (!iterated.compareAndSet(false, true)) {
			throw new IllegalStateException("Parsed file can only be iterated once: " + source);
		}
		Iterator<CSVRecord> lines = parser.iterator();
		return new Iterator<T>() {
			private T pending;
			private boolean first = true;

			@Override
			public boolean hasNext() {
				while (pending == null && lines.hasNext()) {
					pending = accept(lines.next(), first);
					first = false;
				}
				return pending != null;
			}

			@Override
			public T next() {
				if (!hasNext()) {
					throw new NoSuchElementException();
				}
				T out = pending;
				pending = null;
				return out;
			}
		};
	}

	private T accept(CSVRecord line, boolean first) {
		if (first && layout.isOptionalHeader() && DelimitedFileParser.looksLikeHeader(line)) {
			headerSkipped = true;
			Logger.debug("Skipping header line in {}", source.getFileName());
			return null;
		}
		T rec = line.size() >= layout.getMinColumns() ? layout.getMapper().map(line) : null;
		if (rec == null) {
			skipped.incrementAndGet();
			Logger.trace("Skipped malformed {} line {}", layout.getName(), line.getRecordNumber());
		} else {
			accepted.incrementAndGet();
		}
		return rec;
	}

	public Path getSource() {
		return source;
	}

	public FileLayout<T> getLayout() {
		return layout;
	}

	public long getAcceptedLines() {
		return accepted.get();
	}

	public long getSkippedLines() {
		return skipped.get();
	}

	public boolean isHeaderSkipped() {
		return headerSkipped;
	}

	@Override
	public void close() throws IOException {
		parser.close();
	}
}
