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

import com.quantus.exception.UnsupportedConversionException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.EnumMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedSet;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.FINER;

/**
 * {@link UnitConverter} implementation that breaks both unit expressions down to SI, bridges differing dimensions with a
 * {@link ChangeOfBase} and scales back out to the target unit.
 *
 * @author Quantus Authors
 */
@ThreadSafe
final class DefaultUnitConverter implements UnitConverter {
	@NonNull
	private static final DefaultUnitConverter DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultUnitConverter(UnitTables.withDefaults());
	}

	@NonNull
	private final UnitTables unitTables;
	@NonNull
	private final UnitDecomposer unitDecomposer;
	@NonNull
	private final Logger logger;

	@NonNull
	public static DefaultUnitConverter defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	DefaultUnitConverter(@NonNull UnitTables unitTables) {
		requireNonNull(unitTables);

		this.unitTables = unitTables;
		this.unitDecomposer = new UnitDecomposer(unitTables);
		this.logger = Logger.getLogger(DefaultUnitConverter.class.getName());
	}

	@Override
	public double convert(@NonNull String fromUnit,
												@NonNull String toUnit,
												double value,
												@NonNull ConversionContext context) {
		requireNonNull(fromUnit);
		requireNonNull(toUnit);
		requireNonNull(context);

		return createConversionPlan(fromUnit, toUnit, context).apply(value);
	}

	@Override
	@NonNull
	public double[] convert(@NonNull String fromUnit,
													@NonNull String toUnit,
													@NonNull double[] values,
													@NonNull ConversionContext context) {
		requireNonNull(fromUnit);
		requireNonNull(toUnit);
		requireNonNull(values);
		requireNonNull(context);

		ConversionPlan conversionPlan = createConversionPlan(fromUnit, toUnit, context);
		double[] convertedValues = new double[values.length];

		for (int i = 0; i < values.length; ++i)
			convertedValues[i] = conversionPlan.apply(values[i]);

		return convertedValues;
	}

	@Override
	@NonNull
	public UnitBreakdown breakdown(@NonNull String unit) {
		requireNonNull(unit);
		return getUnitDecomposer().breakdown(unit);
	}

	@Override
	@NonNull
	public UnitComponents components(@NonNull String token) {
		requireNonNull(token);
		return getUnitDecomposer().components(token);
	}

	@Override
	@NonNull
	public String resolveAliases(@NonNull String unit) {
		requireNonNull(unit);
		return getUnitDecomposer().resolveAliases(unit);
	}

	@Override
	@NonNull
	public UnitTables getUnitTables() {
		return this.unitTables;
	}

	@NonNull
	protected ConversionPlan createConversionPlan(@NonNull String fromUnit,
																								@NonNull String toUnit,
																								@NonNull ConversionContext context) {
		requireNonNull(fromUnit);
		requireNonNull(toUnit);
		requireNonNull(context);

		UnitBreakdown fromBreakdown = breakdown(fromUnit);
		UnitBreakdown toBreakdown = SI.equals(toUnit)
				? new UnitBreakdown(UnitFactor.one(), fromBreakdown.getSignature())
				: breakdown(toUnit);

		SiContext siContext = toSiContext(context);

		if (fromBreakdown.getSignature().equals(toBreakdown.getSignature())) {
			if (getLogger().isLoggable(FINE))
				getLogger().fine(format("Converting '%s' to '%s' with matching signature '%s'", fromUnit, toUnit,
						fromBreakdown.getSignature().getStringValue()));

			return new ConversionPlan(fromBreakdown, toBreakdown, siContext, false, false, null);
		}

		SortedSet<String> onlyFrom = fromBreakdown.getSignature().tokensNotIn(toBreakdown.getSignature());
		SortedSet<String> onlyTo = toBreakdown.getSignature().tokensNotIn(fromBreakdown.getSignature());

		boolean perSteradian = onlyTo.remove(ChangeOfBase.PER_STERADIAN_TOKEN);
		boolean timesSteradian = onlyFrom.remove(ChangeOfBase.PER_STERADIAN_TOKEN);

		ChangeOfBase changeOfBase = null;

		// A pure solid-angle difference is fully handled by the steradian steps
		if (!onlyFrom.isEmpty() || !onlyTo.isEmpty()) {
			String dispatchKey = ChangeOfBase.dispatchKey(String.join("", onlyFrom), String.join("", onlyTo));

			changeOfBase = ChangeOfBase.forDispatchKey(dispatchKey).orElseThrow(() ->
					new UnsupportedConversionException(format("Unable to convert '%s' (%s) to '%s' (%s): no change of base for '%s'",
							fromUnit, fromBreakdown.getSignature().getStringValue(), toUnit,
							toBreakdown.getSignature().getStringValue(), dispatchKey), fromUnit, toUnit));
		}

		if (getLogger().isLoggable(FINE))
			getLogger().fine(format("Converting '%s' (%s) to '%s' (%s) via %s%s%s", fromUnit,
					fromBreakdown.getSignature().getStringValue(), toUnit, toBreakdown.getSignature().getStringValue(),
					changeOfBase == null ? "no change of base" : changeOfBase.name(),
					perSteradian ? " after " + ChangeOfBase.PER_STERADIAN.name() : "",
					timesSteradian ? " after " + ChangeOfBase.TIMES_STERADIAN.name() : ""));

		return new ConversionPlan(fromBreakdown, toBreakdown, siContext, perSteradian, timesSteradian, changeOfBase);
	}

	@NonNull
	protected SiContext toSiContext(@NonNull ConversionContext context) {
		requireNonNull(context);

		if (context.getQuantitiesByContextKey().isEmpty())
			return SiContext.empty();

		Map<ContextKey, Double> siValuesByContextKey = new EnumMap<>(ContextKey.class);

		for (Entry<ContextKey, Quantity> entry : context.getQuantitiesByContextKey().entrySet()) {
			Quantity quantity = entry.getValue();
			double siValue = breakdown(quantity.getUnit()).getFactor().toSi(quantity.getValue());

			if (getLogger().isLoggable(FINER))
				getLogger().finer(format("Context quantity %s=%s %s is %s in SI", entry.getKey().getName(),
						quantity.getValue(), quantity.getUnit(), siValue));

			siValuesByContextKey.put(entry.getKey(), siValue);
		}

		return SiContext.of(siValuesByContextKey);
	}

	@NonNull
	private UnitDecomposer getUnitDecomposer() {
		return this.unitDecomposer;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	/**
	 * Everything about a conversion that does not depend on the value being converted.
	 */
	@ThreadSafe
	protected static final class ConversionPlan {
		@NonNull
		private final UnitBreakdown fromBreakdown;
		@NonNull
		private final UnitBreakdown toBreakdown;
		@NonNull
		private final SiContext siContext;
		private final boolean perSteradian;
		private final boolean timesSteradian;
		@Nullable
		private final ChangeOfBase changeOfBase;

		ConversionPlan(@NonNull UnitBreakdown fromBreakdown,
									 @NonNull UnitBreakdown toBreakdown,
									 @NonNull SiContext siContext,
									 boolean perSteradian,
									 boolean timesSteradian,
									 @Nullable ChangeOfBase changeOfBase) {
			requireNonNull(fromBreakdown);
			requireNonNull(toBreakdown);
			requireNonNull(siContext);

			this.fromBreakdown = fromBreakdown;
			this.toBreakdown = toBreakdown;
			this.siContext = siContext;
			this.perSteradian = perSteradian;
			this.timesSteradian = timesSteradian;
			this.changeOfBase = changeOfBase;
		}

		double apply(double value) {
			double siValue = this.fromBreakdown.getFactor().toSi(value);

			if (this.perSteradian)
				siValue = ChangeOfBase.PER_STERADIAN.apply(siValue, this.siContext);

			if (this.timesSteradian)
				siValue = ChangeOfBase.TIMES_STERADIAN.apply(siValue, this.siContext);

			if (this.changeOfBase != null)
				siValue = this.changeOfBase.apply(siValue, this.siContext);

			return this.toBreakdown.getFactor().fromSi(siValue);
		}
	}
}
