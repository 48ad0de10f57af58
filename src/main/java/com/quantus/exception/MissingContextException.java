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

import com.quantus.ChangeOfBase;
import com.quantus.ContextKey;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Exception thrown when a change-of-base conversion needs an auxiliary quantity (for example, a reference wavelength)
 * and none of the quantities it accepts were supplied.
 *
 * @author Quantus Authors
 */
@NotThreadSafe
public final class MissingContextException extends UnitConversionException {
	@NonNull
	private final ChangeOfBase changeOfBase;
	@NonNull
	private final Set<ContextKey> acceptedContextKeys;

	public MissingContextException(@Nullable String message,
																 @NonNull ChangeOfBase changeOfBase,
																 @NonNull Set<ContextKey> acceptedContextKeys) {
		super(message);

		requireNonNull(changeOfBase);
		requireNonNull(acceptedContextKeys);

		this.changeOfBase = changeOfBase;
		this.acceptedContextKeys = acceptedContextKeys.isEmpty()
				? Collections.emptySet()
				: Collections.unmodifiableSet(EnumSet.copyOf(acceptedContextKeys));
	}

	@NonNull
	public ChangeOfBase getChangeOfBase() {
		return this.changeOfBase;
	}

	/**
	 * The context quantities, any one of which would have satisfied the conversion.
	 *
	 * @return the accepted context keys
	 */
	@NonNull
	public Set<ContextKey> getAcceptedContextKeys() {
		return this.acceptedContextKeys;
	}
}
