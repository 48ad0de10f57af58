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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Auxiliary quantities supplied by the caller for change-of-base conversions, each in a unit of the caller's choosing.
 * <p>
 * For example, converting a wavelength to a Doppler velocity needs a reference wavelength:
 * <pre>{@code
 * ConversionContext context = ConversionContext.builder()
 *     .wave(4552.0, "A")
 *     .build();
 *
 * double velocity = unitConverter.convert("A", "km/s", 4553.0, context);
 * }</pre>
 * Quantities are reduced to SI by the converter before use.
 *
 * @author Quantus Authors
 */
@ThreadSafe
public final class ConversionContext {
	@NonNull
	private static final ConversionContext EMPTY;

	static {
		EMPTY = new Builder().build();
	}

	@NonNull
	private final Map<ContextKey, Quantity> quantitiesByContextKey;

	@NonNull
	public static ConversionContext empty() {
		return EMPTY;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	private ConversionContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.quantitiesByContextKey = builder.quantitiesByContextKey.isEmpty()
				? Collections.emptyMap()
				: Collections.unmodifiableMap(new EnumMap<>(builder.quantitiesByContextKey));
	}

	@NonNull
	public Optional<Quantity> getQuantity(@NonNull ContextKey contextKey) {
		requireNonNull(contextKey);
		return Optional.ofNullable(this.quantitiesByContextKey.get(contextKey));
	}

	@NonNull
	public Map<ContextKey, Quantity> getQuantitiesByContextKey() {
		return this.quantitiesByContextKey;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{quantitiesByContextKey=%s}", getClass().getSimpleName(), getQuantitiesByContextKey());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ConversionContext conversionContext))
			return false;

		return Objects.equals(getQuantitiesByContextKey(), conversionContext.getQuantitiesByContextKey());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getQuantitiesByContextKey());
	}

	/**
	 * Builder used to construct instances of {@link ConversionContext}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<ContextKey, Quantity> quantitiesByContextKey;

		private Builder() {
			this.quantitiesByContextKey = new EnumMap<>(ContextKey.class);
		}

		@NonNull
		public Builder wave(double value,
												@NonNull String unit) {
			return quantity(ContextKey.WAVE, Quantity.of(value, unit));
		}

		@NonNull
		public Builder freq(double value,
												@NonNull String unit) {
			return quantity(ContextKey.FREQ, Quantity.of(value, unit));
		}

		@NonNull
		public Builder diam(double value,
												@NonNull String unit) {
			return quantity(ContextKey.DIAM, Quantity.of(value, unit));
		}

		@NonNull
		public Builder radius(double value,
													@NonNull String unit) {
			return quantity(ContextKey.RADIUS, Quantity.of(value, unit));
		}

		@NonNull
		public Builder pix(double value,
											 @NonNull String unit) {
			return quantity(ContextKey.PIX, Quantity.of(value, unit));
		}

		@NonNull
		public Builder quantity(@NonNull ContextKey contextKey,
														@NonNull Quantity quantity) {
			requireNonNull(contextKey);
			requireNonNull(quantity);

			this.quantitiesByContextKey.put(contextKey, quantity);
			return this;
		}

		/**
		 * Adds a quantity by keyword, for callers that pass context by name.
		 *
		 * @param name  the keyword, one of {@code wave}, {@code freq}, {@code diam}, {@code radius} or {@code pix}
		 * @param value the value
		 * @param unit  the unit expression of the value
		 * @return this builder
		 * @throws IllegalArgumentException if {@code name} is not a recognized keyword
		 */
		@NonNull
		public Builder quantity(@NonNull String name,
														double value,
														@NonNull String unit) {
			requireNonNull(name);
			requireNonNull(unit);

			ContextKey contextKey = ContextKey.fromName(name).orElseThrow(() ->
					new IllegalArgumentException(format("Unrecognized context quantity '%s'", name)));

			return quantity(contextKey, Quantity.of(value, unit));
		}

		@NonNull
		public ConversionContext build() {
			return new ConversionContext(this);
		}
	}
}
