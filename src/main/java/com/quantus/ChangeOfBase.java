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

import com.quantus.exception.MissingContextException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.quantus.PhysicalConstants.SPEED_OF_LIGHT;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Conversions between physically related quantities whose dimension signatures differ, such as wavelength and Doppler
 * velocity, or flux density per unit wavelength and per unit frequency.
 * <p>
 * Each constant is keyed by the signature tokens found only in the source and only in the target, concatenated in
 * sorted order: converting {@code "A"} ({@code m1}) to {@code "km/s"} ({@code m1 s-1}) leaves nothing only in the
 * source and {@code s-1} only in the target, which is {@link #DISTANCE_TO_VELOCITY}'s key {@code "_to_s-1"}.
 * <p>
 * Values passed to {@link #apply(double, SiContext)} and returned from it are in SI.
 *
 * @author Quantus Authors
 */
@ThreadSafe
public enum ChangeOfBase {
	/**
	 * Wavelength to Doppler velocity relative to the reference wavelength.
	 */
	DISTANCE_TO_VELOCITY("", "s-1", EnumSet.of(ContextKey.WAVE)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			double wave = requireWave(siContext, this);
			return (value - wave) / wave * SPEED_OF_LIGHT;
		}
	},
	/**
	 * Doppler velocity to wavelength around the reference wavelength.
	 */
	VELOCITY_TO_DISTANCE("s-1", "", EnumSet.of(ContextKey.WAVE)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			double wave = requireWave(siContext, this);
			return wave / SPEED_OF_LIGHT * value + wave;
		}
	},
	DISTANCE_TO_FREQUENCY("m1", "cy1s-1", EnumSet.noneOf(ContextKey.class)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			return SPEED_OF_LIGHT / value;
		}
	},
	FREQUENCY_TO_DISTANCE("cy1s-1", "m1", EnumSet.noneOf(ContextKey.class)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			return SPEED_OF_LIGHT / value;
		}
	},
	/**
	 * Baseline length to spatial frequency, for interferometry.
	 */
	DISTANCE_TO_SPATIAL_FREQUENCY("m1", "", EnumSet.of(ContextKey.WAVE, ContextKey.FREQ)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			Optional<Double> wave = siContext.getSiValue(ContextKey.WAVE);

			if (wave.isPresent())
				return 2 * Math.PI * value / wave.get();

			Optional<Double> freq = siContext.getSiValue(ContextKey.FREQ);

			if (freq.isPresent())
				return 2 * Math.PI * value * SPEED_OF_LIGHT * freq.get();

			throw missingContext(this);
		}
	},
	/**
	 * Spatial frequency to baseline length, for interferometry.
	 */
	SPATIAL_FREQUENCY_TO_DISTANCE("", "m1", EnumSet.of(ContextKey.WAVE, ContextKey.FREQ)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			Optional<Double> wave = siContext.getSiValue(ContextKey.WAVE);

			if (wave.isPresent())
				return wave.get() * value / (2 * Math.PI);

			Optional<Double> freq = siContext.getSiValue(ContextKey.FREQ);

			if (freq.isPresent())
				return SPEED_OF_LIGHT / freq.get() * value / (2 * Math.PI);

			throw missingContext(this);
		}
	},
	/**
	 * Flux density per unit frequency (W m-2 Hz-1) to per unit wavelength (W m-2 m-1).
	 */
	FNU_TO_FLAMBDA("cy-1s-2", "m-1s-3", EnumSet.of(ContextKey.WAVE, ContextKey.FREQ)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			Optional<Double> wave = siContext.getSiValue(ContextKey.WAVE);

			if (wave.isPresent())
				return SPEED_OF_LIGHT / (wave.get() * wave.get()) * value;

			Optional<Double> freq = siContext.getSiValue(ContextKey.FREQ);

			if (freq.isPresent())
				return freq.get() * freq.get() / SPEED_OF_LIGHT * value;

			throw missingContext(this);
		}
	},
	/**
	 * Flux density per unit wavelength (W m-2 m-1) to per unit frequency (W m-2 Hz-1).
	 */
	FLAMBDA_TO_FNU("m-1s-3", "cy-1s-2", EnumSet.of(ContextKey.WAVE, ContextKey.FREQ)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			Optional<Double> wave = siContext.getSiValue(ContextKey.WAVE);

			if (wave.isPresent())
				return wave.get() * wave.get() / SPEED_OF_LIGHT * value;

			Optional<Double> freq = siContext.getSiValue(ContextKey.FREQ);

			if (freq.isPresent())
				return SPEED_OF_LIGHT / (freq.get() * freq.get()) * value;

			throw missingContext(this);
		}
	},
	/**
	 * Flux density per unit frequency (W m-2 Hz-1) to {@code nu Fnu} (W m-2).
	 */
	FNU_TO_NUFNU("cy-1s-2", "s-3", EnumSet.of(ContextKey.WAVE, ContextKey.FREQ)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			Optional<Double> wave = siContext.getSiValue(ContextKey.WAVE);

			if (wave.isPresent())
				return SPEED_OF_LIGHT / wave.get() * value;

			Optional<Double> freq = siContext.getSiValue(ContextKey.FREQ);

			if (freq.isPresent())
				return freq.get() / SPEED_OF_LIGHT * value;

			throw missingContext(this);
		}
	},
	/**
	 * {@code nu Fnu} (W m-2) to flux density per unit frequency (W m-2 Hz-1).
	 */
	NUFNU_TO_FNU("s-3", "cy-1s-2", EnumSet.of(ContextKey.WAVE, ContextKey.FREQ)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			Optional<Double> wave = siContext.getSiValue(ContextKey.WAVE);

			if (wave.isPresent())
				return wave.get() / SPEED_OF_LIGHT * value;

			Optional<Double> freq = siContext.getSiValue(ContextKey.FREQ);

			if (freq.isPresent())
				return SPEED_OF_LIGHT / freq.get() * value;

			throw missingContext(this);
		}
	},
	/**
	 * {@code [Q]} to {@code [Q] sr-1}, dividing by the solid angle of the source or pixel.
	 */
	PER_STERADIAN("", "sr-1", EnumSet.of(ContextKey.DIAM, ContextKey.RADIUS, ContextKey.PIX)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			return value / surface(siContext, this);
		}
	},
	/**
	 * {@code [Q] sr-1} to {@code [Q]}, multiplying by the solid angle of the source or pixel.
	 */
	TIMES_STERADIAN("sr-1", "", EnumSet.of(ContextKey.DIAM, ContextKey.RADIUS, ContextKey.PIX)) {
		@Override
		public double apply(double value,
												@NonNull SiContext siContext) {
			return value * surface(siContext, this);
		}
	};

	/**
	 * The signature token peeled off before dispatch and handled by {@link #PER_STERADIAN} or {@link #TIMES_STERADIAN}.
	 */
	@NonNull
	public static final String PER_STERADIAN_TOKEN = "sr-1";

	@NonNull
	private static final Map<String, ChangeOfBase> CHANGES_OF_BASE_BY_DISPATCH_KEY;

	static {
		Map<String, ChangeOfBase> changesOfBaseByDispatchKey = new HashMap<>();

		for (ChangeOfBase changeOfBase : values())
			changesOfBaseByDispatchKey.put(changeOfBase.getDispatchKey(), changeOfBase);

		CHANGES_OF_BASE_BY_DISPATCH_KEY = Collections.unmodifiableMap(changesOfBaseByDispatchKey);
	}

	@NonNull
	private final String dispatchKey;
	@NonNull
	private final Set<ContextKey> acceptedContextKeys;

	ChangeOfBase(@NonNull String onlyFrom,
							 @NonNull String onlyTo,
							 @NonNull Set<ContextKey> acceptedContextKeys) {
		requireNonNull(onlyFrom);
		requireNonNull(onlyTo);
		requireNonNull(acceptedContextKeys);

		this.dispatchKey = dispatchKey(onlyFrom, onlyTo);
		this.acceptedContextKeys = Collections.unmodifiableSet(acceptedContextKeys);
	}

	/**
	 * Performs the change of base.
	 *
	 * @param value     the SI value in the source dimension
	 * @param siContext the caller's context quantities in SI
	 * @return the SI value in the target dimension
	 * @throws MissingContextException if none of {@link #getAcceptedContextKeys()} is present when one is needed
	 */
	public abstract double apply(double value,
															 @NonNull SiContext siContext);

	/**
	 * Builds the dispatch key for a pair of signature differences.
	 *
	 * @param onlyFrom tokens present only in the source signature, sorted and concatenated without separators
	 * @param onlyTo   tokens present only in the target signature, sorted and concatenated without separators
	 * @return the dispatch key, e.g. {@code "cy-1s-2_to_m-1s-3"}
	 */
	@NonNull
	public static String dispatchKey(@NonNull String onlyFrom,
																	 @NonNull String onlyTo) {
		requireNonNull(onlyFrom);
		requireNonNull(onlyTo);

		return onlyFrom + "_to_" + onlyTo;
	}

	@NonNull
	public static Optional<ChangeOfBase> forDispatchKey(@NonNull String dispatchKey) {
		requireNonNull(dispatchKey);
		return Optional.ofNullable(CHANGES_OF_BASE_BY_DISPATCH_KEY.get(dispatchKey));
	}

	@NonNull
	public String getDispatchKey() {
		return this.dispatchKey;
	}

	/**
	 * Context quantities this change of base can use. Any one of them suffices; when several are present, the first in
	 * declaration order of {@link ContextKey} wins.
	 *
	 * @return the accepted context keys, empty if none are needed
	 */
	@NonNull
	public Set<ContextKey> getAcceptedContextKeys() {
		return this.acceptedContextKeys;
	}

	private static double requireWave(@NonNull SiContext siContext,
																		@NonNull ChangeOfBase changeOfBase) {
		requireNonNull(siContext);
		requireNonNull(changeOfBase);

		return siContext.getSiValue(ContextKey.WAVE).orElseThrow(() -> missingContext(changeOfBase));
	}

	// Solid angle as pi (2 pi r)^2 for a disk of angular radius r, or (2 pi p)^2 for a square pixel of side p
	private static double surface(@NonNull SiContext siContext,
																@NonNull ChangeOfBase changeOfBase) {
		requireNonNull(siContext);
		requireNonNull(changeOfBase);

		Optional<Double> diam = siContext.getSiValue(ContextKey.DIAM);

		if (diam.isPresent()) {
			double radius = diam.get() / 2.0;
			return Math.PI * Math.pow(2 * Math.PI * radius, 2);
		}

		Optional<Double> radius = siContext.getSiValue(ContextKey.RADIUS);

		if (radius.isPresent())
			return Math.PI * Math.pow(2 * Math.PI * radius.get(), 2);

		Optional<Double> pix = siContext.getSiValue(ContextKey.PIX);

		if (pix.isPresent())
			return Math.pow(2 * Math.PI * pix.get(), 2);

		throw missingContext(changeOfBase);
	}

	@NonNull
	private static MissingContextException missingContext(@NonNull ChangeOfBase changeOfBase) {
		requireNonNull(changeOfBase);

		String contextKeyNames = changeOfBase.getAcceptedContextKeys().stream()
				.map(ContextKey::getName)
				.collect(Collectors.joining(", "));

		return new MissingContextException(format("Unable to perform %s: one of the context quantities [%s] is required but none was given",
				changeOfBase.name(), contextKeyNames), changeOfBase, changeOfBase.getAcceptedContextKeys());
	}
}
