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

import javax.annotation.concurrent.Immutable;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A compound unit expression reduced to its total factor to SI and its {@link DimensionSignature}.
 * <p>
 * For example, {@code "erg s-1 cm-2 A-1"} breaks down to factor {@code 1.0e7} and signature {@code "kg1 m-1 s-3"}.
 *
 * @author Quantus Authors
 */
@Immutable
public final class UnitBreakdown {
	@NonNull
	private final UnitFactor factor;
	@NonNull
	private final DimensionSignature signature;

	public UnitBreakdown(@NonNull UnitFactor factor,
											 @NonNull DimensionSignature signature) {
		requireNonNull(factor);
		requireNonNull(signature);

		this.factor = factor;
		this.signature = signature;
	}

	@NonNull
	public UnitFactor getFactor() {
		return this.factor;
	}

	@NonNull
	public DimensionSignature getSignature() {
		return this.signature;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{factor=%s, signature=%s}", getClass().getSimpleName(), getFactor(), getSignature().getStringValue());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof UnitBreakdown unitBreakdown))
			return false;

		return Objects.equals(getFactor(), unitBreakdown.getFactor())
				&& Objects.equals(getSignature(), unitBreakdown.getSignature());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getFactor(), getSignature());
	}
}
