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
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A named unit as registered in {@link UnitTables}: its factor to SI and the SI base string it reduces to.
 * <p>
 * The SI base string is one or more space-separated tokens of the form {@code <base symbol><optional power>}, where the
 * base symbol is one of {@link #getBaseSymbols()}. For example, {@code W} is registered as {@code (1.0, "kg m2 s-3")}.
 *
 * @author Quantus Authors
 */
@Immutable
public final class UnitDefinition {
	@NonNull
	private static final Set<String> BASE_SYMBOLS;
	@NonNull
	private static final Pattern BASE_TOKEN_PATTERN;
	@NonNull
	private static final Pattern UNIT_NAME_PATTERN;

	static {
		BASE_SYMBOLS = Set.of("m", "kg", "s", "cy", "sr", "K");
		UNIT_NAME_PATTERN = Pattern.compile("^[A-Za-z]+$");
		BASE_TOKEN_PATTERN = Pattern.compile("^([A-Za-z]+)(-?\\d+)?$");
	}

	@NonNull
	private final String name;
	@NonNull
	private final UnitFactor factor;
	@NonNull
	private final String siBase;

	/**
	 * Defines a unit that is a plain multiple of its SI base.
	 *
	 * @param name   the unit name, e.g. {@code "erg"}
	 * @param factor the value of one unit in SI, e.g. {@code 1e-7}
	 * @param siBase the SI base string, e.g. {@code "kg m2 s-2"}
	 * @return the definition
	 * @throws IllegalArgumentException if the name is not alphabetic, the factor is not finite and positive, or the SI base string is invalid
	 */
	@NonNull
	public static UnitDefinition linear(@NonNull String name,
																			double factor,
																			@NonNull String siBase) {
		requireNonNull(name);
		requireNonNull(siBase);

		if (!Double.isFinite(factor) || factor <= 0)
			throw new IllegalArgumentException(format("Factor for unit '%s' must be finite and positive, but was %s", name, factor));

		return new UnitDefinition(name, UnitFactor.of(factor), siBase);
	}

	/**
	 * Defines a unit that maps to its SI base through a {@link NonlinearScale}.
	 *
	 * @param name   the unit name, e.g. {@code "F"}
	 * @param scale  the nonlinear scale
	 * @param siBase the SI base string of the scale's SI side, e.g. {@code "K"}
	 * @return the definition
	 */
	@NonNull
	public static UnitDefinition nonlinear(@NonNull String name,
																				 @NonNull NonlinearScale scale,
																				 @NonNull String siBase) {
		requireNonNull(name);
		requireNonNull(scale);
		requireNonNull(siBase);

		return new UnitDefinition(name, UnitFactor.of(scale.converter()), siBase);
	}

	@NonNull
	public static Set<String> getBaseSymbols() {
		return BASE_SYMBOLS;
	}

	private UnitDefinition(@NonNull String name,
												 @NonNull UnitFactor factor,
												 @NonNull String siBase) {
		requireNonNull(name);
		requireNonNull(factor);
		requireNonNull(siBase);

		if (!UNIT_NAME_PATTERN.matcher(name).matches())
			throw new IllegalArgumentException(format("Illegal unit name '%s'. Unit names must be alphabetic", name));

		this.name = name;
		this.factor = factor;
		this.siBase = normalizeSiBase(name, siBase);
	}

	@NonNull
	private static String normalizeSiBase(@NonNull String name,
																				@NonNull String siBase) {
		requireNonNull(name);
		requireNonNull(siBase);

		String[] baseTokens = siBase.trim().split("\\s+");

		if (baseTokens.length == 0 || baseTokens[0].length() == 0)
			throw new IllegalArgumentException(format("SI base for unit '%s' must not be blank", name));

		for (String baseToken : baseTokens) {
			Matcher matcher = BASE_TOKEN_PATTERN.matcher(baseToken);

			if (!matcher.matches() || !BASE_SYMBOLS.contains(matcher.group(1)))
				throw new IllegalArgumentException(format("Illegal SI base token '%s' for unit '%s'. Base symbols must be one of %s",
						baseToken, name, BASE_SYMBOLS));
		}

		return String.join(" ", baseTokens);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public UnitFactor getFactor() {
		return this.factor;
	}

	@NonNull
	public String getSiBase() {
		return this.siBase;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, factor=%s, siBase=%s}", getClass().getSimpleName(), getName(), getFactor(), getSiBase());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof UnitDefinition unitDefinition))
			return false;

		return Objects.equals(getName(), unitDefinition.getName())
				&& Objects.equals(getFactor(), unitDefinition.getFactor())
				&& Objects.equals(getSiBase(), unitDefinition.getSiBase());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getFactor(), getSiBase());
	}
}
