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

/**
 * Typed failure raised by the dictionary engine. Callers switch on
 * {@link #getKind()} to tell "no data" apart from "wrong version" and
 * "nothing active yet".
 */
public class DictionaryException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public enum ErrorKind {
		/** A distribution file is missing or unreadable. */
		FILE_NOT_FOUND,
		/** A file belongs to another dictionary or contains no parseable line. */
		UNSUPPORTED_FORMAT,
		/** The operation is not legal for the version's current state. */
		INVALID_STATE,
		/** No version was given and none is active. */
		NO_ACTIVE_VERSION,
		/** The version or code does not exist. */
		NOT_FOUND,
		/** The database rejected or failed an operation. */
		STORAGE
	}

	private final ErrorKind kind;

	public DictionaryException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public DictionaryException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	public ErrorKind getKind() {
		return kind;
	}

	public static DictionaryException notFound(String message) {
		return new DictionaryException(ErrorKind.NOT_FOUND, message);
	}

	public static DictionaryException invalidState(String message) {
		return new DictionaryException(ErrorKind.INVALID_STATE, message);
	}

	public static DictionaryException storage(String message, Throwable cause) {
		return new DictionaryException(ErrorKind.STORAGE, message, cause);
	}
}
