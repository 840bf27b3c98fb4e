package org.pvcoder.dict.store;

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

import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;

import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.DictionaryException.ErrorKind;
import org.pvcoder.dict.util.Db;
import org.pvcoder.dict.util.Logger;

/**
 * Streams records from a source into one table, one transaction per call.
 * <p>
 * A reader thread pulls records from the source and hands them over in chunks
 * through a bounded queue; the calling thread drains the queue into JDBC
 * batches on a single connection. Memory stays bounded at
 * {@code queueCapacity * batchSize} records however large the file is. If
 * either side fails the transaction rolls back and the other side is stopped.
 */
public class BulkLoader {

	private static final long READER_SHUTDOWN_SECONDS = 5;

	private final DictionaryDatabase database;
	private final int batchSize;
	private final int queueCapacity;

	public BulkLoader(DictionaryDatabase database, int batchSize, int queueCapacity) {
		if (batchSize <= 0 || queueCapacity <= 0) {
			throw new IllegalArgumentException("batchSize and queueCapacity must be positive");
		}
		this.database = database;
		this.batchSize = batchSize;
		this.queueCapacity = queueCapacity;
	}

	/** A hand-off between reader and writer. Exactly one chunk per load is {@code last} or carries an error. */
	private static final class Chunk<T> {
		final List<T> rows;
		final boolean last;
		final Exception error;

		Chunk(List<T> rows, boolean last, Exception error) {
			this.rows = rows;
			this.last = last;
			this.error = error;
		}
	}

	/**
	 * Loads every record of {@code source} into {@code target} for {@code versionId}.
	 *
	 * @param onBatch receives the row count of each executed batch, for progress reporting
	 * @return rows inserted
	 */
	public <T> long load(long versionId, Iterable<T> source, LoadTarget<T> target, LongConsumer onBatch) {
		BlockingQueue<Chunk<T>> queue = new ArrayBlockingQueue<>(queueCapacity);
		ExecutorService reader = Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "bulk-load-reader");
			t.setDaemon(true);
			return t;
		});
		Future<?> producer = reader.submit(() -> {
			produce(source, queue);
			return null;
		});

		AtomicLong loaded = new AtomicLong();
		long started = System.currentTimeMillis();
		try (Connection conn = database.open()) {
			Db.withTransaction(conn, () -> {
				try (PreparedStatement ps = conn.prepareStatement(target.getInsertSql())) {
					while (true) {
						Chunk<T> chunk = queue.take();
						if (chunk.error != null) {
							throw chunk.error;
						}
						for (T row : chunk.rows) {
							target.getBinder().bind(ps, versionId, row);
							ps.addBatch();
						}
						if (!chunk.rows.isEmpty()) {
							ps.executeBatch();
							loaded.addAndGet(chunk.rows.size());
							if (onBatch != null) {
								onBatch.accept(chunk.rows.size());
							}
						}
						if (chunk.last) {
							break;
						}
					}
				}
			});
		} catch (DictionaryException ex) {
			throw ex;
		} catch (UncheckedIOException ex) {
			throw new DictionaryException(ErrorKind.FILE_NOT_FOUND,
					"Reading source for " + target.getTable() + " failed: " + ex.getMessage(), ex);
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw DictionaryException.storage("Load into " + target.getTable() + " interrupted", ex);
		} catch (Exception ex) {
			throw DictionaryException.storage("Load into " + target.getTable() + " failed: " + ex.getMessage(), ex);
		} finally {
			producer.cancel(true);
			reader.shutdownNow();
			awaitReader(reader);
		}

		Logger.debug("Loaded {} rows into {} for version {} in {} ms", loaded.get(), target.getTable(), versionId,
				System.currentTimeMillis() - started);
		return loaded.get();
	}

	private <T> void produce(Iterable<T> source, BlockingQueue<Chunk<T>> queue) throws InterruptedException {
		try {
			List<T> batch = new ArrayList<>(batchSize);
			for (T row : source) {
				batch.add(row);
				if (batch.size() == batchSize) {
					queue.put(new Chunk<>(batch, false, null));
					batch = new ArrayList<>(batchSize);
				}
			}
			queue.put(new Chunk<>(batch, true, null));
		} catch (RuntimeException ex) {
			queue.put(new Chunk<>(List.of(), true, ex));
		}
	}

	private static void awaitReader(ExecutorService reader) {
		try {
			if (!reader.awaitTermination(READER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
				Logger.warn("Bulk load reader did not stop within {} s", READER_SHUTDOWN_SECONDS);
			}
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
		}
	}
}
