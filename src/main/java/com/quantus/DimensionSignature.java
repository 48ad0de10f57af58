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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Canonical encoding of a compound unit's net power per base dimension.
 * <p>
 * Rendered as the lexicographically sorted list of {@code "<base><power>"} tokens with zero powers removed, for
 * example {@code "kg1 m-1 s-3"} for {@code "erg s-1 cm-2 A-1"}. Two unit expressions are dimensionally equal iff their
 * signatures contain the same tokens.
 *
 * @author Quantus Authors
 */
@Immutable
public final class DimensionSignature {
	@NonNull
	private static final DimensionSignature DIMENSIONLESS;

	static {
		DIMENSIONLESS = new DimensionSignature(List.of());
	}

	@NonNull
	private final List<String> tokens;

	@NonNull
	public static DimensionSignature dimensionless() {
		return DIMENSIONLESS;
	}

	/**
	 * Builds a signature from net powers keyed by base symbol. Zero powers are dropped.
	 *
	 * @param powersByBaseSymbol net power per base symbol
	 * @return the signature
	 */
	@NonNull
	public static DimensionSignature fromPowers(@NonNull Map<String, Integer> powersByBaseSymbol) {
		requireNonNull(powersByBaseSymbol);

		List<String> tokens = new ArrayList<>(powersByBaseSymbol.size());

		for (Entry<String, Integer> entry : powersByBaseSymbol.entrySet())
			if (entry.getValue() != 0)
				tokens.add(entry.getKey() + entry.getValue());

		if (tokens.isEmpty())
			return DIMENSIONLESS;

		Collections.sort(tokens);
		return new DimensionSignature(tokens);
	}

	private DimensionSignature(@NonNull List<String> tokens) {
		requireNonNull(tokens);
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
	}

	/**
	 * The sorted {@code "<base><power>"} tokens of this signature.
	 *
	 * @return the tokens, never containing a zero power
	 */
	@NonNull
	public List<String> getTokens() {
		return this.tokens;
	}

	/**
	 * Tokens of this signature that the other signature does not contain, in sorted order.
	 * <p>
	 * The returned set is a fresh mutable copy.
	 *
	 * @param other the signature to compare against
	 * @return tokens present here but not in {@code other}
	 */
	@NonNull
	public SortedSet<String> tokensNotIn(@NonNull DimensionSignature other) {
		requireNonNull(other);

		SortedSet<String> difference = new TreeSet<>(getTokens());
		difference.removeAll(other.getTokens());
		return difference;
	}

	@NonNull
	public Boolean isDimensionless() {
		return this.tokens.isEmpty();
	}

	/**
	 * The canonical string form, tokens joined by single spaces.
	 *
	 * @return the canonical signature string, empty for a dimensionless quantity
	 */
	@NonNull
	public String getStringValue() {
		return String.join(" ", getTokens());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{%s}", getClass().getSimpleName(), getStringValue());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DimensionSignature dimensionSignature))
			return false;

		return getTokens().equals(dimensionSignature.getTokens());
	}

	@Override
	public int hashCode() {
		return getTokens().hashCode();
	}
}
