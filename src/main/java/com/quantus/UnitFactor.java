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
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The factor that takes a value expressed in some unit to SI: either a plain scalar or a {@link NonlinearConverter}.
 * <p>
 * Scalars compose by multiplication and exponentiation. Composing with a nonlinear factor folds the scalar into the
 * converter's prefix, so a compound expression carries at most one nonlinear converter.
 *
 * @author Quantus Authors
 */
@Immutable
public final class UnitFactor {
	@NonNull
	private static final UnitFactor ONE;

	static {
		ONE = new UnitFactor(1.0, null);
	}

	private final double scale;
	@Nullable
	private final NonlinearConverter nonlinearConverter;

	@NonNull
	public static UnitFactor one() {
		return ONE;
	}

	@NonNull
	public static UnitFactor of(double scale) {
		return new UnitFactor(scale, null);
	}

	@NonNull
	public static UnitFactor of(@NonNull NonlinearConverter nonlinearConverter) {
		requireNonNull(nonlinearConverter);
		return new UnitFactor(1.0, nonlinearConverter);
	}

	private UnitFactor(double scale,
										 @Nullable NonlinearConverter nonlinearConverter) {
		this.scale = scale;
		this.nonlinearConverter = nonlinearConverter;
	}

	@NonNull
	public Boolean isNonlinear() {
		return this.nonlinearConverter != null;
	}

	/**
	 * The scalar value of this factor.
	 *
	 * @return the scalar
	 * @throws IllegalStateException if this factor is nonlinear
	 */
	public double getScale() {
		if (isNonlinear())
			throw new IllegalStateException(format("%s has no scalar value", this));

		return this.scale;
	}

	@NonNull
	public Optional<NonlinearConverter> getNonlinearConverter() {
		return Optional.ofNullable(this.nonlinearConverter);
	}

	/**
	 * Multiplies this factor by a scalar.
	 *
	 * @param factor the scalar
	 * @return the product
	 */
	@NonNull
	public UnitFactor times(double factor) {
		if (this.nonlinearConverter != null)
			return of(this.nonlinearConverter.scaledBy(factor));

		return of(this.scale * factor);
	}

	/**
	 * Multiplies this factor by another.
	 *
	 * @param other the other factor
	 * @return the product
	 * @throws IllegalStateException if both factors are nonlinear
	 */
	@NonNull
	public UnitFactor times(@NonNull UnitFactor other) {
		requireNonNull(other);

		if (this.nonlinearConverter != null && other.nonlinearConverter != null)
			throw new IllegalStateException(format("Cannot compose two nonlinear factors %s and %s", this, other));

		if (other.nonlinearConverter != null)
			return of(other.nonlinearConverter.scaledBy(this.scale));

		return times(other.scale);
	}

	/**
	 * Raises this factor to an integer power.
	 *
	 * @param power the power
	 * @return the scalar raised to {@code power}, or the nonlinear converter with {@code power} added to its tracked power
	 */
	@NonNull
	public UnitFactor pow(int power) {
		if (this.nonlinearConverter != null)
			return of(this.nonlinearConverter.raisedTo(power));

		return of(Math.pow(this.scale, power));
	}

	/**
	 * Takes a value expressed in this factor's unit to SI.
	 *
	 * @param value the value in the native unit
	 * @return the SI value
	 */
	public double toSi(double value) {
		if (this.nonlinearConverter != null)
			return this.nonlinearConverter.apply(value, false);

		return this.scale * value;
	}

	/**
	 * Takes an SI value to this factor's unit.
	 *
	 * @param value the SI value
	 * @return the value in the native unit
	 */
	public double fromSi(double value) {
		if (this.nonlinearConverter != null)
			return this.nonlinearConverter.apply(value, true);

		return value / this.scale;
	}

	@Override
	@NonNull
	public String toString() {
		if (this.nonlinearConverter != null)
			return format("%s{nonlinearConverter=%s}", getClass().getSimpleName(), this.nonlinearConverter);

		return format("%s{scale=%s}", getClass().getSimpleName(), this.scale);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof UnitFactor unitFactor))
			return false;

		return Double.compare(this.scale, unitFactor.scale) == 0
				&& Objects.equals(this.nonlinearConverter, unitFactor.nonlinearConverter);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.scale, this.nonlinearConverter);
	}
}
