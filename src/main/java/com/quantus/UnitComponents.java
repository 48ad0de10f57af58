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
 * A single unit token decomposed into its factor to SI, its SI base string and its power.
 * <p>
 * For example, {@code "g2"} decomposes to factor {@code 0.001}, basis {@code "kg"}, power {@code 2}, and {@code "W3"}
 * to factor {@code 1.0}, basis {@code "kg m2 s-3"}, power {@code 3}. The factor is not yet raised to the power.
 *
 * @author Quantus Authors
 */
@Immutable
public final class UnitComponents {
	@NonNull
	private final UnitFactor factor;
	@NonNull
	private final String basis;
	private final int power;

	public UnitComponents(@NonNull UnitFactor factor,
												@NonNull String basis,
												int power) {
		requireNonNull(factor);
		requireNonNull(basis);

		this.factor = factor;
		this.basis = basis;
		this.power = power;
	}

	@NonNull
	public UnitFactor getFactor() {
		return this.factor;
	}

	/**
	 * The SI base string of the resolved unit. May consist of several space-separated base tokens.
	 *
	 * @return the SI base string
	 */
	@NonNull
	public String getBasis() {
		return this.basis;
	}

	public int getPower() {
		return this.power;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{factor=%s, basis=%s, power=%s}", getClass().getSimpleName(), getFactor(), getBasis(), getPower());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof UnitComponents unitComponents))
			return false;

		return Objects.equals(getFactor(), unitComponents.getFactor())
				&& Objects.equals(getBasis(), unitComponents.getBasis())
				&& getPower() == unitComponents.getPower();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getFactor(), getBasis(), getPower());
	}
}
