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
 * A numeric value paired with the unit expression it is written in, e.g. {@code (4552.0, "A")}.
 *
 * @author Quantus Authors
 */
@Immutable
public final class Quantity {
	private final double value;
	@NonNull
	private final String unit;

	@NonNull
	public static Quantity of(double value,
														@NonNull String unit) {
		requireNonNull(unit);
		return new Quantity(value, unit);
	}

	private Quantity(double value,
									 @NonNull String unit) {
		requireNonNull(unit);

		this.value = value;
		this.unit = unit;
	}

	public double getValue() {
		return this.value;
	}

	@NonNull
	public String getUnit() {
		return this.unit;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{value=%s, unit=%s}", getClass().getSimpleName(), getValue(), getUnit());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Quantity quantity))
			return false;

		return Double.compare(getValue(), quantity.getValue()) == 0
				&& Objects.equals(getUnit(), quantity.getUnit());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getValue(), getUnit());
	}
}
