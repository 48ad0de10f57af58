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
 * A {@link NonlinearScale} together with the prefix factor and power accumulated while a unit token was parsed.
 * <p>
 * For example, {@code "kF"} decomposes to {@link NonlinearScale#FAHRENHEIT} with prefix {@code 1000.0}, so that
 * {@code 0.123 kF} maps to the same Kelvin value as {@code 123 F}.
 * <p>
 * Instances are immutable; {@link #scaledBy(double)} and {@link #raisedTo(int)} return new instances.
 *
 * @author Quantus Authors
 */
@Immutable
public final class NonlinearConverter {
	@NonNull
	private final NonlinearScale scale;
	private final double prefix;
	private final int power;

	@NonNull
	public static NonlinearConverter forScale(@NonNull NonlinearScale scale) {
		requireNonNull(scale);
		return new NonlinearConverter(scale, 1.0, 1);
	}

	private NonlinearConverter(@NonNull NonlinearScale scale,
														 double prefix,
														 int power) {
		requireNonNull(scale);

		this.scale = scale;
		this.prefix = prefix;
		this.power = power;
	}

	/**
	 * Composes this converter with a scalar, multiplying its prefix.
	 *
	 * @param factor the scalar to fold into the prefix
	 * @return a new converter with the scaled prefix
	 */
	@NonNull
	public NonlinearConverter scaledBy(double factor) {
		return new NonlinearConverter(getScale(), getPrefix() * factor, getPower());
	}

	/**
	 * Composes this converter with an integer power, which is added to the tracked power.
	 * <p>
	 * None of the scales in {@link NonlinearScale} consume the power; it is tracked so composition stays lossless.
	 *
	 * @param power the power to add
	 * @return a new converter with the adjusted power
	 */
	@NonNull
	public NonlinearConverter raisedTo(int power) {
		return new NonlinearConverter(getScale(), getPrefix(), getPower() + power);
	}

	/**
	 * Evaluates the transform.
	 *
	 * @param value   the value to transform
	 * @param inverse {@code false} to go from this converter's native scale to SI (source side of a conversion),
	 *                {@code true} to go from SI back to the native scale (target side)
	 * @return the transformed value
	 */
	public double apply(double value,
											boolean inverse) {
		return inverse ? getScale().fromSi(value, getPrefix()) : getScale().toSi(value, getPrefix());
	}

	@NonNull
	public NonlinearScale getScale() {
		return this.scale;
	}

	public double getPrefix() {
		return this.prefix;
	}

	public int getPower() {
		return this.power;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{scale=%s, prefix=%s, power=%s}", getClass().getSimpleName(), getScale(), getPrefix(), getPower());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof NonlinearConverter nonlinearConverter))
			return false;

		return Objects.equals(getScale(), nonlinearConverter.getScale())
				&& Double.compare(getPrefix(), nonlinearConverter.getPrefix()) == 0
				&& getPower() == nonlinearConverter.getPower();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getScale(), getPrefix(), getPower());
	}
}
