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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Abstract superclass for exceptions that indicate a unit conversion could not be performed because of caller input.
 *
 * @author Quantus Authors
 */
@NotThreadSafe
public abstract class UnitConversionException extends RuntimeException {
	public UnitConversionException(@Nullable String message) {
		super(message);
	}

	public UnitConversionException(@Nullable String message,
																 @Nullable Throwable cause) {
		super(message, cause);
	}
}
