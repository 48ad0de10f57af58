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
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Rewrites a unit expression into canonical multiplicative form.
 * <p>
 * First every {@link UnitTables.Alias} is applied in order by literal substring replacement. Then division is rewritten
 * as negative powers: in {@code "erg/s/cm2/A"} every segment after a {@code /} has its power negated, giving
 * {@code "erg s-1 cm-2 A-1"}. A leading integer factor on a divided segment is kept in front of the rewritten token.
 * The result is trimmed and its tokens separated by single spaces.
 * <p>
 * Malformed input is passed through untouched and fails later when decomposed.
 *
 * @author Quantus Authors
 */
@ThreadSafe
final class AliasResolver {
	@NonNull
	static final Pattern TOKEN_PATTERN;

	static {
		// <leading digits factor><basis><signed power>
		TOKEN_PATTERN = Pattern.compile("(\\d*)(.+?)(-?\\d+)");
	}

	@NonNull
	private final List<UnitTables.Alias> aliases;

	AliasResolver(@NonNull UnitTables unitTables) {
		requireNonNull(unitTables);
		this.aliases = unitTables.getAliases();
	}

	@NonNull
	String resolve(@NonNull String unit) {
		requireNonNull(unit);

		String resolvedUnit = unit;

		for (UnitTables.Alias alias : getAliases())
			resolvedUnit = resolvedUnit.replace(alias.getPattern(), alias.getReplacement());

		List<String> tokens = new ArrayList<>();

		for (String field : resolvedUnit.trim().split("\\s+")) {
			String[] segments = field.split("/", -1);

			if (segments[0].length() > 0)
				tokens.add(segments[0]);

			for (int i = 1; i < segments.length; ++i)
				if (segments[i].length() > 0)
					tokens.add(negatePower(segments[i]));
		}

		return String.join(" ", tokens);
	}

	@NonNull
	private String negatePower(@NonNull String segment) {
		requireNonNull(segment);

		String normalizedSegment = Character.isDigit(segment.charAt(segment.length() - 1)) ? segment : segment + "1";
		Matcher matcher = TOKEN_PATTERN.matcher(normalizedSegment);

		if (!matcher.find())
			return normalizedSegment + "-1";

		String factor = matcher.group(1);
		String basis = matcher.group(2);
		BigInteger power = new BigInteger(matcher.group(3));
		String negated = basis + power.negate();

		if (factor.length() > 0 && !BigInteger.ONE.equals(new BigInteger(factor)))
			negated = new BigInteger(factor) + negated;

		return negated;
	}

	@NonNull
	private List<UnitTables.Alias> getAliases() {
		return this.aliases;
	}
}
