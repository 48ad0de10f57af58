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

import com.quantus.exception.UnknownUnitException;
import com.quantus.exception.UnsupportedConversionException;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decomposes unit tokens and compound unit expressions into SI factors and dimension signatures.
 *
 * @author Quantus Authors
 */
@ThreadSafe
final class UnitDecomposer {
	@NonNull
	private static final Pattern BASE_TOKEN_PATTERN;

	static {
		BASE_TOKEN_PATTERN = Pattern.compile("^([A-Za-z]+)(-?\\d+)?$");
	}

	@NonNull
	private final UnitTables unitTables;
	@NonNull
	private final AliasResolver aliasResolver;

	UnitDecomposer(@NonNull UnitTables unitTables) {
		requireNonNull(unitTables);

		this.unitTables = unitTables;
		this.aliasResolver = new AliasResolver(unitTables);
	}

	@NonNull
	String resolveAliases(@NonNull String unit) {
		requireNonNull(unit);
		return getAliasResolver().resolve(unit);
	}

	/**
	 * Decomposes a single token of the form {@code <optional digits factor><optional prefix><unit><optional signed power>}.
	 * <p>
	 * A unit name registered as-is takes precedence over a prefixed reading, so {@code "min"} is a minute and
	 * {@code "Pa"} a pascal. Otherwise prefixes are tried in table order.
	 */
	@NonNull
	UnitComponents components(@NonNull String token) {
		requireNonNull(token);

		if (token.length() == 0)
			throw new UnknownUnitException("Unit token must not be empty", token);

		String normalizedToken = Character.isDigit(token.charAt(token.length() - 1)) ? token : token + "1";
		Matcher matcher = AliasResolver.TOKEN_PATTERN.matcher(normalizedToken);

		double factor = 1.0;
		String basis = normalizedToken;
		int power = 1;

		if (matcher.find()) {
			try {
				if (matcher.group(1).length() > 0)
					factor = Double.parseDouble(matcher.group(1));

				power = Integer.parseInt(matcher.group(3));
			} catch (NumberFormatException e) {
				throw new UnknownUnitException(format("Unable to parse unit token '%s'", token), e, token);
			}

			basis = matcher.group(2);
		}

		UnitDefinition unitDefinition = getUnitTables().getUnitDefinition(basis).orElse(null);

		if (unitDefinition == null) {
			for (Entry<String, Double> prefixScaling : getUnitTables().getPrefixScalingsBySymbol().entrySet()) {
				String prefixSymbol = prefixScaling.getKey();

				if (!basis.startsWith(prefixSymbol))
					continue;

				unitDefinition = getUnitTables().getUnitDefinition(basis.substring(prefixSymbol.length())).orElse(null);

				if (unitDefinition != null) {
					factor *= prefixScaling.getValue();
					break;
				}
			}
		}

		if (unitDefinition == null)
			throw new UnknownUnitException(format("Unknown unit '%s'", basis), basis);

		return new UnitComponents(unitDefinition.getFactor().times(factor), unitDefinition.getSiBase(), power);
	}

	/**
	 * Reduces a compound unit expression to its total factor and dimension signature.
	 */
	@NonNull
	UnitBreakdown breakdown(@NonNull String unit) {
		requireNonNull(unit);

		String resolvedUnit = resolveAliases(unit).trim();

		if (resolvedUnit.length() == 0)
			return new UnitBreakdown(UnitFactor.one(), DimensionSignature.dimensionless());

		UnitFactor totalFactor = UnitFactor.one();
		Map<String, Integer> powersByBaseSymbol = new LinkedHashMap<>();

		for (String token : resolvedUnit.split("\\s+")) {
			UnitComponents unitComponents = components(token);
			UnitFactor tokenFactor = unitComponents.getFactor().pow(unitComponents.getPower());

			if (totalFactor.isNonlinear() && tokenFactor.isNonlinear())
				throw new UnsupportedConversionException(format("Unit '%s' mixes more than one nonlinear unit", unit), unit, null);

			totalFactor = totalFactor.times(tokenFactor);

			for (String baseToken : unitComponents.getBasis().split(" ")) {
				Matcher matcher = BASE_TOKEN_PATTERN.matcher(baseToken);

				if (!matcher.matches())
					throw new IllegalStateException(format("Malformed SI base token '%s' for unit token '%s'", baseToken, token));

				int basePower = matcher.group(2) == null ? 1 : Integer.parseInt(matcher.group(2));
				powersByBaseSymbol.merge(matcher.group(1), basePower * unitComponents.getPower(), Integer::sum);
			}
		}

		return new UnitBreakdown(totalFactor, DimensionSignature.fromPowers(powersByBaseSymbol));
	}

	@NonNull
	UnitTables getUnitTables() {
		return this.unitTables;
	}

	@NonNull
	private AliasResolver getAliasResolver() {
		return this.aliasResolver;
	}
}
