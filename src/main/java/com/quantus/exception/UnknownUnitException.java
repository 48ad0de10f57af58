/*
 * Copyright 2026 The Quantus Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.quantus.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a unit token cannot be resolved to a known unit, either directly or after stripping an SI prefix.
 * <p>
 * For example, {@code "zz9"} has basis {@code "zz"}, which is neither a registered unit nor a prefixed one.
 *
 * @author Quantus Authors
 */
@NotThreadSafe
public final class UnknownUnitException extends UnitConversionException {
	@NonNull
	private final String unit;

	public UnknownUnitException(@Nullable String message,
															@NonNull String unit) {
		super(message);
		this.unit = requireNonNull(unit);
	}

	public UnknownUnitException(@Nullable String message,
															@Nullable Throwable cause,
															@NonNull String unit) {
		super(message, cause);
		this.unit = requireNonNull(unit);
	}

	/**
	 * The unit token (or basis) that could not be resolved.
	 *
	 * @return the unresolvable unit
	 */
	@NonNull
	public String getUnit() {
		return this.unit;
	}
}
