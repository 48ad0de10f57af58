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
import java.util.Optional;

/**
 * Exception thrown when two unit expressions have different dimension signatures and no change-of-base function
 * bridges the difference, or when an expression mixes more than one nonlinear unit.
 *
 * @author Quantus Authors
 */
@NotThreadSafe
public final class UnsupportedConversionException extends UnitConversionException {
	@Nullable
	private final String fromUnit;
	@Nullable
	private final String toUnit;

	public UnsupportedConversionException(@Nullable String message,
																				@Nullable String fromUnit,
																				@Nullable String toUnit) {
		super(message);
		this.fromUnit = fromUnit;
		this.toUnit = toUnit;
	}

	/**
	 * The unit expression being converted from, if known.
	 *
	 * @return the 'from' unit expression
	 */
	@NonNull
	public Optional<String> getFromUnit() {
		return Optional.ofNullable(this.fromUnit);
	}

	/**
	 * The unit expression being converted to, if known.
	 *
	 * @return the 'to' unit expression
	 */
	@NonNull
	public Optional<String> getToUnit() {
		return Optional.ofNullable(this.toUnit);
	}
}
