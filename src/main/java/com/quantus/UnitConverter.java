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
import com.quantus.exception.UnknownUnitException;
import com.quantus.exception.UnsupportedConversionException;
import org.jspecify.annotations.NonNull;

import static java.util.Objects.requireNonNull;

/**
 * Contract for converting numeric values between free-form compound unit expressions.
 * <p>
 * Unit expressions are space-separated tokens of the form {@code <optional factor><optional prefix><unit><optional power>},
 * with {@code /} accepted as division: {@code "erg s-1 cm-2 A-1"}, {@code "erg/s/cm2/A"} and {@code "10mW m-2/nm"} are
 * all valid. Parentheses are not.
 * <p>
 * Conversions between expressions of the same dimension are plain scalings (or a nonlinear transform, for temperature
 * scales and magnitudes). Conversions between related dimensions, such as wavelength and velocity, go through a
 * {@link ChangeOfBase} and may need auxiliary quantities from a {@link ConversionContext}:
 * <pre>{@code
 * UnitConverter unitConverter = UnitConverter.withDefaults();
 *
 * unitConverter.convert("km", "cm", 1.0); // 100000.0
 * unitConverter.convert("F", "K", 123.0); // 323.705...
 * unitConverter.convert("erg/s/cm2/A", "Jy", 1e-10,
 *     ConversionContext.builder().wave(10000.0, "angstrom").build()); // 333.564...
 * }</pre>
 * <p>
 * Standard threadsafe implementations can be acquired via these factory methods:
 * <ul>
 *   <li>{@link #withDefaults()}</li>
 *   <li>{@link #withTables(UnitTables)}</li>
 * </ul>
 *
 * @author Quantus Authors
 */
public interface UnitConverter {
	/**
	 * Target unit expression meaning "whatever the source reduces to in SI".
	 */
	@NonNull
	String SI = "SI";

	/**
	 * Converts {@code value} from one unit expression to another.
	 *
	 * @param fromUnit the unit expression of {@code value}
	 * @param toUnit   the unit expression to convert to, or {@link #SI}
	 * @param value    the value to convert
	 * @param context  auxiliary quantities for change-of-base conversions
	 * @return the converted value
	 * @throws UnknownUnitException           if either expression (or a context quantity's unit) contains an unknown unit
	 * @throws UnsupportedConversionException if the dimensions differ and no {@link ChangeOfBase} bridges them
	 * @throws MissingContextException        if a change of base needs a context quantity that was not supplied
	 */
	double convert(@NonNull String fromUnit,
								 @NonNull String toUnit,
								 double value,
								 @NonNull ConversionContext context);

	/**
	 * Converts {@code value} without auxiliary context.
	 *
	 * @param fromUnit the unit expression of {@code value}
	 * @param toUnit   the unit expression to convert to, or {@link #SI}
	 * @param value    the value to convert
	 * @return the converted value
	 */
	default double convert(@NonNull String fromUnit,
												 @NonNull String toUnit,
												 double value) {
		requireNonNull(fromUnit);
		requireNonNull(toUnit);

		return convert(fromUnit, toUnit, value, ConversionContext.empty());
	}

	/**
	 * Converts every element of {@code values}, breaking down the unit expressions only once.
	 *
	 * @param fromUnit the unit expression of {@code values}
	 * @param toUnit   the unit expression to convert to, or {@link #SI}
	 * @param values   the values to convert; not modified
	 * @param context  auxiliary quantities for change-of-base conversions
	 * @return a new array holding the converted values
	 */
	@NonNull
	double[] convert(@NonNull String fromUnit,
									 @NonNull String toUnit,
									 @NonNull double[] values,
									 @NonNull ConversionContext context);

	/**
	 * Reduces a compound unit expression to its total factor to SI and its dimension signature.
	 *
	 * @param unit the unit expression, e.g. {@code "erg s-1 cm-2 A-1"}
	 * @return the breakdown, e.g. factor {@code 1.0e7} and signature {@code "kg1 m-1 s-3"}
	 * @throws UnknownUnitException if the expression contains an unknown unit
	 */
	@NonNull
	UnitBreakdown breakdown(@NonNull String unit);

	/**
	 * Decomposes a single unit token.
	 *
	 * @param token the token, e.g. {@code "g2"}
	 * @return its factor to SI, SI base string and power, e.g. {@code (0.001, "kg", 2)}
	 * @throws UnknownUnitException if the token does not resolve to a known unit
	 */
	@NonNull
	UnitComponents components(@NonNull String token);

	/**
	 * Applies spelling aliases and rewrites division as negative powers.
	 *
	 * @param unit the unit expression, e.g. {@code "erg/s/cm2/angstrom"}
	 * @return the canonical expression, e.g. {@code "erg s-1 cm-2 A-1"}
	 */
	@NonNull
	String resolveAliases(@NonNull String unit);

	/**
	 * The tables this converter reads.
	 *
	 * @return the unit tables
	 */
	@NonNull
	UnitTables getUnitTables();

	/**
	 * Acquires a threadsafe {@link UnitConverter} backed by {@link UnitTables#withDefaults()}.
	 *
	 * @return a converter with the default tables
	 */
	@NonNull
	static UnitConverter withDefaults() {
		return DefaultUnitConverter.defaultInstance();
	}

	/**
	 * Acquires a threadsafe {@link UnitConverter} backed by the given tables.
	 * <p>
	 * This method is guaranteed to return a new instance.
	 *
	 * @param unitTables the tables to read
	 * @return a converter with the given tables
	 */
	@NonNull
	static UnitConverter withTables(@NonNull UnitTables unitTables) {
		requireNonNull(unitTables);
		return new DefaultUnitConverter(unitTables);
	}
}
