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
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Set;

import static com.quantus.PhysicalConstants.SPEED_OF_LIGHT;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author Quantus Authors
 */
@ThreadSafe
public class UnitConverterTests {
	private static final UnitConverter UNIT_CONVERTER = UnitConverter.withDefaults();

	@Test
	public void plainScaling() {
		assertClose(100000.0, convert("km", "cm", 1.0));
		assertClose(0.39939292275740873, convert("km h-1", "nRsun s-1", 1.0));
		assertClose(1e7, convert("erg s-1 cm-2 A-1", UnitConverter.SI, 1.0));
		assertClose(1.0, convert("10mW m-2 nm-1", "erg s-1 cm-2 A-1", 1.0));
		assertClose(1.0, convert("10mW m-2/nm", "erg s-1 cm-2 A-1", 1.0));
		assertClose(1e-26, convert("Jy", "W/m2/Hz", 1.0));
		assertClose(1e-23, convert("Jy", "erg/cm2/s/Hz", 1.0));
		assertClose(11.574074074074074, convert("cy/d", "muHz", 1.0));
		assertClose(1.0, convert("muhz", "cy/d", 11.574074074074074));
	}

	@Test
	public void namedUnits() {
		assertClose(101325.0, convert("atm", "Pa", 1.0));
		assertClose(Math.PI, convert("deg", "rad", 180.0));
		assertClose(1.609344, convert("mi", "km", 1.0));
		assertClose(4.184, convert("cal", "J", 1.0));
		assertClose(365.0, convert("yr", "d", 1.0));
		assertClose(206264.98463828993, convert("pc", "AU", 1.0));
		assertClose(12.0, convert("ft", "in", 1.0));
		assertClose(12.0, convert("ft", "inch", 1.0));
		assertClose(1e5, convert("N", "dy", 1.0));
		assertClose(60.0, convert("min", "s", 1.0), "'min' must be the minute, not a milli-inch");
	}

	@Test
	public void siTargetKeepsSignature() {
		assertClose(1609.344, convert("mi", UnitConverter.SI, 1.0));
		assertClose(1e-3, convert("g", UnitConverter.SI, 1.0));
		assertClose(283.15, convert("C", UnitConverter.SI, 10.0));
	}

	@Test
	public void distanceToFrequency() {
		assertClose(299792.458, convert("nm", "Ghz", 1000.0));
		assertClose(1000.0, convert("Ghz", "nm", 299792.458));
	}

	@Test
	public void wavelengthAndVelocity() {
		ConversionContext context = ConversionContext.builder().wave(4552.0, "A").build();

		assertClose(65.859503075576129, convert("A", "km/s", 4553.0, context));
		assertClose(4553.0, convert("km/s", "A", 65.859503075576129, context));

		ConversionContext micronContext = ConversionContext.builder().wave(0.4552, "mum").build();

		assertClose(65859.503075645873, convert("nm", "m/s", 455.3, micronContext));
	}

	@Test
	public void fluxDensityChangeOfBase() {
		ConversionContext waveContext = ConversionContext.builder().wave(10000.0, "angstrom").build();

		assertClose(333.56409519815202, convert("erg/s/cm2/A", "Jy", 1e-10, waveContext));
		assertClose(1e-10, convert("Jy", "erg/s/cm2/A", 333.56409519815202, waveContext));

		ConversionContext freqContext = ConversionContext.builder().freq(SPEED_OF_LIGHT, "Mhz").build();

		assertClose(333.56409519815202, convert("erg/s/cm2/A", "Jy", 1e-10, freqContext),
				"Frequency context should give the same result as the equivalent wavelength");
		assertClose(1e-10, convert("Jy", "erg/s/cm2/A", 333.56409519815202, freqContext));
	}

	@Test
	public void fluxDensityToNuFnu() {
		ConversionContext context = ConversionContext.builder().wave(2.0, "micron").build();

		assertClose(1.49896229e-09, convert("Jy", "erg/s/cm2", 1.0, context));
		assertClose(1.0, convert("erg/s/cm2", "Jy", 1.49896229e-09, context));
	}

	@Test
	public void surfaceBrightness() {
		ConversionContext diamContext = ConversionContext.builder()
				.wave(2.0, "micron")
				.diam(3.0, "mas")
				.build();

		assertClose(4511059.8298101583, convert("Jy", "erg/s/cm2/micron/sr", 1.0, diamContext));
		assertClose(2.2167739682629828e-07, convert("erg/s/cm2/micron/sr", "Jy", 1.0, diamContext));

		ConversionContext pixContext = ConversionContext.builder()
				.wave(2.0, "micron")
				.pix(3.0, "mas")
				.build();

		assertClose(3542978.1053089043, convert("Jy", "erg/s/cm2/micron/sr", 1.0, pixContext));

		ConversionContext radiusContext = ConversionContext.builder()
				.wave(2.0, "micron")
				.radius(1.5, "mas")
				.build();

		assertClose(4511059.8298101583, convert("Jy", "erg/s/cm2/micron/sr", 1.0, radiusContext),
				"A radius should behave like a diameter twice as large");

		ConversionContext otherContext = ConversionContext.builder()
				.diam(2.0, "mas")
				.wave(1.0, "micron")
				.build();

		assertClose(40599538.4683, convert("Jy", "erg s-1 cm-2 micron-1 sr-1", 1.0, otherContext));
	}

	@Test
	public void pureSolidAngleDifference() {
		ConversionContext context = ConversionContext.builder().diam(3.0, "mas").build();
		double perSteradian = convert("Jy", "Jy sr-1", 1.0, context);

		assertClose(6018910362061421.0, perSteradian);
		assertClose(1.0, convert("Jy sr-1", "Jy", perSteradian, context));
	}

	@Test
	public void magnitudes() {
		assertClose(3630.7805477010024, convert("ABmag", "Jy", 0.0));
		assertEquals(0.0, convert("Jy", "ABmag", 3630.7805477010024), 1e-12);
		assertClose(1e-09, convert("vegamag", "W/m2/m", 0.0));
		assertClose(3.6307805477010028e-09, convert("STmag", "erg/s/cm2/A", 0.0));
		assertClose(-1.0, convert("erg/s/cm2/A", "STmag", convert("STmag", "erg/s/cm2/A", 1.0)),
				"ST magnitudes come back negated");

		ConversionContext context = ConversionContext.builder().wave(1.0, "micron").build();

		assertClose(1.08848062485e-09, convert("ABmag", "erg cm-2 s-1 A-1", 0.0, context));
		assertClose(1.08848062485e-09, convert("Jy", "erg cm-2 s-1 A-1", 3630.7805477, context));
	}

	@Test
	public void interferometry() {
		ConversionContext waveContext = ConversionContext.builder().wave(2.2, "micron").build();

		assertClose(187.3143767923207, convert("m", "cy/arcsec", 85.0, waveContext));
		assertClose(84.857341290055444, convert("cy/arcsec", "m", 187.0, waveContext));

		ConversionContext freqContext = ConversionContext.builder().freq(300000.0, "Ghz").build();

		assertClose(38.54483473437972, convert("cycles/arcsec", "m", 187.0, freqContext));
		assertClose(38.54483473437972, convert("cycles/mas", "m", 0.187, freqContext));
	}

	@Test
	public void temperatures() {
		assertClose(323.705555556, convert("F", "K", 123.0));
		assertClose(0.323705555556, convert("kF", "kK", 0.123));
		assertClose(122.99, convert("K", "F", 323.7));
		assertClose(283.15, convert("C", "K", 10.0));
		assertClose(50.0, convert("C", "F", 10.0));
		assertClose(0.05, convert("dC", "kF", 100.0));
	}

	@Test
	public void roundTrips() {
		List<List<String>> unitPairs = List.of(
				List.of("km", "mi"),
				List.of("erg/s/cm2/A", "W m-2 mum-1"),
				List.of("Jy", "W/m2/Hz"),
				List.of("Msun", "g"),
				List.of("deg2", "as2"),
				List.of("bar", "torr"),
				List.of("eV", "cal"),
				List.of("ly", "pc")
		);

		for (List<String> unitPair : unitPairs) {
			double converted = convert(unitPair.get(0), unitPair.get(1), 42.0);
			assertClose(42.0, convert(unitPair.get(1), unitPair.get(0), converted),
					"Round trip failed for " + unitPair);
		}
	}

	@Test
	public void arrayConversion() {
		double[] values = new double[]{1.0, 2.0, 3.5};
		double[] converted = UNIT_CONVERTER.convert("km", "m", values, ConversionContext.empty());

		assertArrayEquals(new double[]{1000.0, 2000.0, 3500.0}, converted, 1e-9);
		assertArrayEquals(new double[]{1.0, 2.0, 3.5}, values, "Input array must not be modified");

		ConversionContext context = ConversionContext.builder().wave(4552.0, "A").build();
		double[] velocities = UNIT_CONVERTER.convert("A", "km/s", new double[]{4552.0, 4553.0}, context);

		assertEquals(0.0, velocities[0], 1e-9);
		assertClose(65.859503075576129, velocities[1]);
		assertEquals(0, UNIT_CONVERTER.convert("km", "m", new double[0], ConversionContext.empty()).length);
	}

	@Test
	public void inspection() {
		assertEquals("erg s-1 cm-2 A-1", UNIT_CONVERTER.resolveAliases("erg/s/cm2/angstrom"));
		assertEquals("kg1 m-1 s-3", UNIT_CONVERTER.breakdown("erg/s/cm2/A").getSignature().getStringValue());
		assertEquals(new UnitComponents(UnitFactor.of(1.0), "kg m2 s-3", 3), UNIT_CONVERTER.components("W3"));
		assertEquals(UnitTables.withDefaults(), UNIT_CONVERTER.getUnitTables());
	}

	@Test
	public void contextByName() {
		ConversionContext context = ConversionContext.builder()
				.quantity("wave", 4552.0, "A")
				.build();

		assertClose(65.859503075576129, convert("A", "km/s", 4553.0, context));
		assertThrows(IllegalArgumentException.class, () -> ConversionContext.builder().quantity("wavelength", 1.0, "m"));
	}

	@Test
	public void missingContext() {
		MissingContextException velocityException = assertThrows(MissingContextException.class,
				() -> convert("A", "km/s", 4553.0));

		assertEquals(ChangeOfBase.DISTANCE_TO_VELOCITY, velocityException.getChangeOfBase());
		assertEquals(Set.of(ContextKey.WAVE), velocityException.getAcceptedContextKeys());

		MissingContextException solidAngleException = assertThrows(MissingContextException.class,
				() -> convert("Jy", "Jy sr-1", 1.0));

		assertEquals(ChangeOfBase.PER_STERADIAN, solidAngleException.getChangeOfBase());

		ConversionContext waveOnly = ConversionContext.builder().wave(2.0, "micron").build();

		assertThrows(MissingContextException.class, () -> convert("Jy", "erg/s/cm2/micron/sr", 1.0, waveOnly));
		assertThrows(MissingContextException.class, () -> convert("Jy", "erg/s/cm2/A", 1.0));
	}

	@Test
	public void unsupportedConversion() {
		UnsupportedConversionException exception = assertThrows(UnsupportedConversionException.class,
				() -> convert("m", "kg", 1.0));

		assertEquals("m", exception.getFromUnit().orElse(null));
		assertEquals("kg", exception.getToUnit().orElse(null));
		assertTrue(exception.getMessage().contains("m1_to_kg1"), "Message should name the dispatch key");

		assertThrows(UnsupportedConversionException.class, () -> convert("K", "s", 1.0));
		assertThrows(UnsupportedConversionException.class, () -> convert("ABmag F", "K", 1.0));
	}

	@Test
	public void unknownUnits() {
		UnknownUnitException exception = assertThrows(UnknownUnitException.class, () -> convert("furlong", "m", 1.0));

		assertEquals("furlong", exception.getUnit());
		assertThrows(UnknownUnitException.class, () -> convert("m", "zz9", 1.0));
		assertThrows(UnknownUnitException.class, () -> convert("Lsun", "W", 1.0));

		ConversionContext badContext = ConversionContext.builder().wave(1.0, "parsnip").build();

		assertThrows(UnknownUnitException.class, () -> convert("m", "km", 1.0, badContext),
				"Context units are broken down even when the conversion does not need them");
	}

	private static double convert(String fromUnit, String toUnit, double value) {
		return UNIT_CONVERTER.convert(fromUnit, toUnit, value);
	}

	private static double convert(String fromUnit, String toUnit, double value, ConversionContext context) {
		return UNIT_CONVERTER.convert(fromUnit, toUnit, value, context);
	}

	private static void assertClose(double expected, double actual) {
		assertClose(expected, actual, null);
	}

	private static void assertClose(double expected, double actual, String message) {
		assertEquals(expected, actual, Math.abs(expected) * 1e-9, message);
	}
}
