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

import javax.annotation.concurrent.ThreadSafe;

/**
 * The closed set of non-affine scales the engine understands.
 * <p>
 * Temperature scales convert to and from Kelvin. Magnitude systems convert to and from SI flux densities:
 * {@link #VEGA_MAGNITUDE} and {@link #ST_MAGNITUDE} to W m-2 m-1, {@link #AB_MAGNITUDE} to W m-2 Hz-1.
 * <p>
 * Magnitude zero points are fixed; the accumulated prefix only applies to temperature scales.
 * <p>
 * {@link #ST_MAGNITUDE} goes forward as {@code F0 * 10^(+m/2.5)} but back as {@code -2.5 * log10(F / F0)}, following
 * the established ST zero-point convention. The two directions are not inverses of each other, so a round trip from
 * {@code m} yields {@code -m}.
 *
 * @author Quantus Authors
 */
@ThreadSafe
public enum NonlinearScale {
	FAHRENHEIT {
		@Override
		double toSi(double value, double prefix) {
			return (value * prefix + 459.67) * 5.0 / 9.0;
		}

		@Override
		double fromSi(double value, double prefix) {
			return (value * 9.0 / 5.0 - 459.67) / prefix;
		}
	},
	CELSIUS {
		@Override
		double toSi(double value, double prefix) {
			return value * prefix + 273.15;
		}

		@Override
		double fromSi(double value, double prefix) {
			return (value - 273.15) / prefix;
		}
	},
	VEGA_MAGNITUDE {
		@Override
		double toSi(double value, double prefix) {
			return Math.pow(10.0, -value / 2.5) * VEGA_ZERO_POINT;
		}

		@Override
		double fromSi(double value, double prefix) {
			return -2.5 * Math.log10(value / VEGA_ZERO_POINT);
		}
	},
	AB_MAGNITUDE {
		@Override
		double toSi(double value, double prefix) {
			return Math.pow(10.0, -value / 2.5) * AB_ZERO_POINT;
		}

		@Override
		double fromSi(double value, double prefix) {
			return -2.5 * Math.log10(value / AB_ZERO_POINT);
		}
	},
	ST_MAGNITUDE {
		@Override
		double toSi(double value, double prefix) {
			return Math.pow(10.0, value / 2.5) * ST_ZERO_POINT;
		}

		@Override
		double fromSi(double value, double prefix) {
			return -2.5 * Math.log10(value / ST_ZERO_POINT);
		}
	};

	// Zero-magnitude fluxes (W m-2 m-1 for Vega and ST, W m-2 Hz-1 for AB)
	private static final double VEGA_ZERO_POINT = 1e-09;
	private static final double AB_ZERO_POINT = 3.6307805477010024e-23;
	private static final double ST_ZERO_POINT = 0.036307805477010027;

	abstract double toSi(double value, double prefix);

	abstract double fromSi(double value, double prefix);

	/**
	 * Creates a converter for this scale with prefix {@code 1.0} and power {@code 1}.
	 *
	 * @return a new converter for this scale
	 */
	@NonNull
	public NonlinearConverter converter() {
		return NonlinearConverter.forScale(this);
	}
}
