package org.hxlens.history.io;

/*
 * This file is part of HxLens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * HxLens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * HxLens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with HxLens.  If not, see <https://www.gnu.org/licenses/>.
 */

/**
 * A request body that cannot be read: empty, not JSON, or not a JSON object.
 * The message is reported to the caller behind the "Invalid request" prefix.
 */
public class PayloadException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public PayloadException(String message) {
		super(message);
	}

	public PayloadException(String message, Throwable cause) {
		super(message, cause);
	}
}
