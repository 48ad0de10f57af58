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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Physical constants used by the default unit table and the change-of-base functions, in SI units.
 *
 * @author Quantus Authors
 */
@ThreadSafe
public final class PhysicalConstants {
	/**
	 * Speed of light in vacuum (m s-1).
	 */
	public static final double SPEED_OF_LIGHT = 299792458.0;
	/**
	 * Astronomical unit (m).
	 */
	public static final double ASTRONOMICAL_UNIT = 1.49597870691e11;
	/**
	 * Parsec (m).
	 */
	public static final double PARSEC = 3.08568025e16;
	/**
	 * Light year (m).
	 */
	public static final double LIGHT_YEAR = 9.460730472e15;
	/**
	 * Solar radius (m).
	 */
	public static final double SOLAR_RADIUS = 6.955e8;
	/**
	 * Solar mass (kg).
	 */
	public static final double SOLAR_MASS = 1.98892e30;

	private PhysicalConstants() {
		// Cannot instantiate
	}
}
