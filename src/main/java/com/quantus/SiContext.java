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

package com.quantus;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Context quantities reduced to SI values (meters, hertz, cycles), as consumed by {@link ChangeOfBase} functions.
 *
 * @author Quantus Authors
 */
@ThreadSafe
public final class SiContext {
	@NonNull
	private static final SiContext EMPTY;

	static {
		EMPTY = new SiContext(Map.of());
	}

	@NonNull
	private final Map<ContextKey, Double> siValuesByContextKey;

	@NonNull
	public static SiContext empty() {
		return EMPTY;
	}

	@NonNull
	public static SiContext of(@NonNull Map<ContextKey, Double> siValuesByContextKey) {
		requireNonNull(siValuesByContextKey);
		return siValuesByContextKey.isEmpty() ? EMPTY : new SiContext(siValuesByContextKey);
	}

	private SiContext(@NonNull Map<ContextKey, Double> siValuesByContextKey) {
		requireNonNull(siValuesByContextKey);

		this.siValuesByContextKey = siValuesByContextKey.isEmpty()
				? Collections.emptyMap()
				: Collections.unmodifiableMap(new EnumMap<>(siValuesByContextKey));
	}

	@NonNull
	public Optional<Double> getSiValue(@NonNull ContextKey contextKey) {
		requireNonNull(contextKey);
		return Optional.ofNullable(this.siValuesByContextKey.get(contextKey));
	}

	@NonNull
	public Map<ContextKey, Double> getSiValuesByContextKey() {
		return this.siValuesByContextKey;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{siValuesByContextKey=%s}", getClass().getSimpleName(), getSiValuesByContextKey());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof SiContext siContext))
			return false;

		return Objects.equals(getSiValuesByContextKey(), siContext.getSiValuesByContextKey());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSiValuesByContextKey());
	}
}
