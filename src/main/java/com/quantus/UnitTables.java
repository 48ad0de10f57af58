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
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.quantus.PhysicalConstants.ASTRONOMICAL_UNIT;
import static com.quantus.PhysicalConstants.LIGHT_YEAR;
import static com.quantus.PhysicalConstants.PARSEC;
import static com.quantus.PhysicalConstants.SOLAR_MASS;
import static com.quantus.PhysicalConstants.SOLAR_RADIUS;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The static tables a {@link UnitConverter} reads: registered units, SI prefixes and spelling aliases.
 * <p>
 * Instances are immutable. The default tables are built once and shared; custom tables can be acquired by supplementing
 * the defaults:
 * <pre>{@code
 * UnitTables unitTables = UnitTables.builderWithDefaults()
 *     .unit("Lsun", 3.828e26, "kg m2 s-3")
 *     .prefix("T", 1e12)
 *     .alias("lsol", "Lsun")
 *     .build();
 * }</pre>
 * Order matters for both prefixes and aliases. Prefixes are tried in insertion order and the first prefix whose
 * remainder is a registered unit wins. Aliases are applied in insertion order by literal substring replacement, so a
 * later alias sees the output of earlier ones.
 *
 * @author Quantus Authors
 */
@ThreadSafe
public final class UnitTables {
	@NonNull
	private static final UnitTables DEFAULT_INSTANCE;
	@NonNull
	private static final Pattern PREFIX_SYMBOL_PATTERN;

	static {
		PREFIX_SYMBOL_PATTERN = Pattern.compile("^[A-Za-z]+$");
		DEFAULT_INSTANCE = createDefaultBuilder().build();
	}

	@NonNull
	private final Map<String, UnitDefinition> unitDefinitionsByName;
	@NonNull
	private final Map<String, Double> prefixScalingsBySymbol;
	@NonNull
	private final List<Alias> aliases;

	/**
	 * The default tables: SI and astronomical units, prefixes from nano to giga, and common spelling aliases.
	 *
	 * @return the shared default tables
	 */
	@NonNull
	public static UnitTables withDefaults() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Acquires a builder seeded with the default tables, for supplementing them with custom units, prefixes or aliases.
	 *
	 * @return a builder with the default tables
	 */
	@NonNull
	public static Builder builderWithDefaults() {
		return withDefaults().copy();
	}

	/**
	 * Acquires a builder with empty tables.
	 *
	 * @return a blank-slate builder
	 */
	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	private static Builder createDefaultBuilder() {
		return new Builder()
				// Distance
				.unit("m", 1e+00, "m")
				.unit("A", 1e-10, "m")
				.unit("AU", ASTRONOMICAL_UNIT, "m")
				.unit("pc", PARSEC, "m")
				.unit("ly", LIGHT_YEAR, "m")
				.unit("Rsun", SOLAR_RADIUS, "m")
				.unit("ft", 0.3048, "m")
				.unit("in", 0.0254, "m")
				.unit("mi", 1609.344, "m")
				// Mass
				.unit("g", 1e-03, "kg")
				.unit("Msun", SOLAR_MASS, "kg")
				// Time
				.unit("s", 1e+00, "s")
				.unit("min", 60.0, "s")
				.unit("h", 3600.0, "s")
				.unit("d", 24 * 3600.0, "s")
				.unit("yr", 365 * 24 * 3600.0, "s")
				.unit("cr", 100 * 365 * 24 * 3600.0, "s")
				.unit("hz", 1e+00, "cy s-1")
				// Angles
				.unit("rad", 0.15915494309189535, "cy")
				.unit("cy", 1e+00, "cy")
				.unit("deg", 1.0 / 360.0, "cy")
				.unit("am", 1.0 / 360.0 / 60.0, "cy")
				.unit("as", 1.0 / 360.0 / 3600.0, "cy")
				.unit("sr", 1e+00, "sr")
				// Force
				.unit("N", 1e+00, "kg m s-2")
				.unit("dy", 1e-05, "kg m s-2")
				// Temperature
				.unit("K", 1e+00, "K")
				.unit(UnitDefinition.nonlinear("F", NonlinearScale.FAHRENHEIT, "K"))
				.unit(UnitDefinition.nonlinear("C", NonlinearScale.CELSIUS, "K"))
				// Energy and power
				.unit("J", 1e+00, "kg m2 s-2")
				.unit("W", 1e+00, "kg m2 s-3")
				.unit("erg", 1e-07, "kg m2 s-2")
				.unit("eV", 1.60217646e-19, "kg m2 s-2")
				.unit("cal", 4.184, "kg m2 s-2")
				// Pressure
				.unit("Pa", 1e+00, "kg m-1 s-2")
				.unit("bar", 1e+05, "kg m-1 s-2")
				.unit("at", 98066.5, "kg m-1 s-2")
				.unit("atm", 101325.0, "kg m-1 s-2")
				.unit("torr", 133.322, "kg m-1 s-2")
				.unit("psi", 6894.0, "kg m-1 s-2")
				// Flux: Flambda in W m-2 m-1, Fnu in W m-2 Hz-1
				.unit("Jy", 1e-26, "kg s-2 cy-1")
				.unit(UnitDefinition.nonlinear("vegamag", NonlinearScale.VEGA_MAGNITUDE, "kg m-1 s-3"))
				.unit(UnitDefinition.nonlinear("STmag", NonlinearScale.ST_MAGNITUDE, "kg m-1 s-3"))
				.unit(UnitDefinition.nonlinear("ABmag", NonlinearScale.AB_MAGNITUDE, "kg s-2 cy-1"))

				.prefix("n", 1e-09)
				.prefix("mu", 1e-06)
				.prefix("m", 1e-03)
				.prefix("c", 1e-02)
				.prefix("d", 1e-01)
				.prefix("da", 1e+01)
				.prefix("h", 1e+02)
				.prefix("k", 1e+03)
				.prefix("M", 1e+06)
				.prefix("G", 1e+09)

				.alias("micron", "mum")
				.alias("micro", "mu")
				.alias("milli", "m")
				.alias("kilo", "k")
				.alias("mega", "M")
				.alias("giga", "G")
				.alias("nano", "n")
				.alias("watt", "W")
				.alias("Watt", "W")
				.alias("Hz", "hz")
				.alias("joule", "J")
				.alias("Joule", "J")
				.alias("jansky", "Jy")
				.alias("Jansky", "Jy")
				.alias("arcsec", "as")
				.alias("arcmin", "am")
				.alias("cycles", "cy")
				.alias("cycle", "cy")
				.alias("cyc", "cy")
				.alias("angstrom", "A")
				.alias("Angstrom", "A")
				// Leading space and slash keep these away from ABmag and STmag
				.alias(" mag", " vegamag")
				.alias("/mag", " /vegamag")
				.alias("inch", "in")
				.alias("^", "")
				.alias("**", "");
	}

	private UnitTables(@NonNull Builder builder) {
		requireNonNull(builder);

		this.unitDefinitionsByName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.unitDefinitionsByName));
		this.prefixScalingsBySymbol = Collections.unmodifiableMap(new LinkedHashMap<>(builder.prefixScalingsBySymbol));
		this.aliases = Collections.unmodifiableList(new ArrayList<>(builder.aliases));
	}

	/**
	 * Vends a mutable copier seeded with this instance's tables, suitable for building new instances.
	 *
	 * @return a builder seeded with this instance's tables
	 */
	@NonNull
	public Builder copy() {
		Builder builder = new Builder();
		builder.unitDefinitionsByName.putAll(this.unitDefinitionsByName);
		builder.prefixScalingsBySymbol.putAll(this.prefixScalingsBySymbol);
		builder.aliases.addAll(this.aliases);
		return builder;
	}

	@NonNull
	public Optional<UnitDefinition> getUnitDefinition(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.unitDefinitionsByName.get(name));
	}

	@NonNull
	public Map<String, UnitDefinition> getUnitDefinitionsByName() {
		return this.unitDefinitionsByName;
	}

	/**
	 * SI prefix scalings in the order they are tried.
	 *
	 * @return prefix scalings keyed by prefix symbol
	 */
	@NonNull
	public Map<String, Double> getPrefixScalingsBySymbol() {
		return this.prefixScalingsBySymbol;
	}

	/**
	 * Aliases in the order they are applied.
	 *
	 * @return the aliases
	 */
	@NonNull
	public List<Alias> getAliases() {
		return this.aliases;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{units=%s, prefixes=%s, aliases=%s}", getClass().getSimpleName(),
				getUnitDefinitionsByName().keySet(), getPrefixScalingsBySymbol().keySet(), getAliases().size());
	}

	/**
	 * A literal substring replacement applied to unit expressions before they are parsed.
	 */
	@Immutable
	public static final class Alias {
		@NonNull
		private final String pattern;
		@NonNull
		private final String replacement;

		public Alias(@NonNull String pattern,
								 @NonNull String replacement) {
			requireNonNull(pattern);
			requireNonNull(replacement);

			if (pattern.length() == 0)
				throw new IllegalArgumentException("Alias pattern must not be empty");

			this.pattern = pattern;
			this.replacement = replacement;
		}

		@NonNull
		public String getPattern() {
			return this.pattern;
		}

		@NonNull
		public String getReplacement() {
			return this.replacement;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s{pattern='%s', replacement='%s'}", getClass().getSimpleName(), getPattern(), getReplacement());
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Alias alias))
				return false;

			return Objects.equals(getPattern(), alias.getPattern())
					&& Objects.equals(getReplacement(), alias.getReplacement());
		}

		@Override
		public int hashCode() {
			return Objects.hash(getPattern(), getReplacement());
		}
	}

	/**
	 * Builder used to construct instances of {@link UnitTables}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Map<String, UnitDefinition> unitDefinitionsByName;
		@NonNull
		private final Map<String, Double> prefixScalingsBySymbol;
		@NonNull
		private final List<Alias> aliases;

		private Builder() {
			this.unitDefinitionsByName = new LinkedHashMap<>();
			this.prefixScalingsBySymbol = new LinkedHashMap<>();
			this.aliases = new ArrayList<>();
		}

		/**
		 * Registers a unit, replacing any unit already registered under the same name.
		 *
		 * @param unitDefinition the unit to register
		 * @return this builder
		 */
		@NonNull
		public Builder unit(@NonNull UnitDefinition unitDefinition) {
			requireNonNull(unitDefinition);
			this.unitDefinitionsByName.put(unitDefinition.getName(), unitDefinition);
			return this;
		}

		@NonNull
		public Builder unit(@NonNull String name,
												double factor,
												@NonNull String siBase) {
			requireNonNull(name);
			requireNonNull(siBase);

			return unit(UnitDefinition.linear(name, factor, siBase));
		}

		/**
		 * Registers a prefix. A new symbol is tried after those already registered; re-registering a symbol keeps its
		 * position and replaces its scaling.
		 *
		 * @param symbol  the prefix symbol, e.g. {@code "T"}
		 * @param scaling the multiplicative scaling, e.g. {@code 1e12}
		 * @return this builder
		 */
		@NonNull
		public Builder prefix(@NonNull String symbol,
													double scaling) {
			requireNonNull(symbol);

			if (!PREFIX_SYMBOL_PATTERN.matcher(symbol).matches())
				throw new IllegalArgumentException(format("Illegal prefix symbol '%s'. Prefix symbols must be alphabetic", symbol));

			if (!Double.isFinite(scaling) || scaling <= 0)
				throw new IllegalArgumentException(format("Scaling for prefix '%s' must be finite and positive, but was %s", symbol, scaling));

			this.prefixScalingsBySymbol.put(symbol, scaling);
			return this;
		}

		/**
		 * Appends an alias, applied after all aliases already registered.
		 *
		 * @param pattern     the literal text to replace
		 * @param replacement the replacement text
		 * @return this builder
		 */
		@NonNull
		public Builder alias(@NonNull String pattern,
												 @NonNull String replacement) {
			requireNonNull(pattern);
			requireNonNull(replacement);

			this.aliases.add(new Alias(pattern, replacement));
			return this;
		}

		@NonNull
		public UnitTables build() {
			return new UnitTables(this);
		}
	}
}
