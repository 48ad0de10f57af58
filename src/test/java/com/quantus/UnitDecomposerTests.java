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
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author Quantus Authors
 */
@ThreadSafe
public class UnitDecomposerTests {
	private static final UnitDecomposer UNIT_DECOMPOSER = new UnitDecomposer(UnitTables.withDefaults());

	@Test
	public void components() {
		assertComponents(1.0, "m", 1, "m");
		assertComponents(0.001, "kg", 2, "g2");
		assertComponents(0.1, "kg", 3, "hg3");
		assertComponents(1000.0, "kg", 4, "Mg4");
		assertComponents(0.001, "m", 1, "mm");
		assertComponents(1.0, "kg m2 s-3", 3, "W3");
		assertComponents(1.0, "s", -2, "s-2");
		assertComponents(60.0, "s", 1, "min");
		assertComponents(0.01, "kg m2 s-3", 1, "10mW");
		assertComponents(1.0, "kg", 1, "kg");
	}

	@Test
	public void componentsPreferDirectLookup() {
		assertComponents(24 * 3600.0, "s", 1, "d");
		assertComponents(101325.0, "kg m-1 s-2", 1, "atm");
		assertComponents(1.0 / 360.0 / 3600.0 / 1000.0, "cy", 1, "mas");
		// "d" is tried before "da", so this is a deci-arcminute
		assertComponents(0.1 / 360.0 / 60.0, "cy", 1, "dam");
	}

	@Test
	public void componentsOfNonlinearUnits() {
		UnitComponents components = UNIT_DECOMPOSER.components("kF");

		assertTrue(components.getFactor().isNonlinear());
		assertEquals("K", components.getBasis());
		assertEquals(NonlinearScale.FAHRENHEIT, components.getFactor().getNonlinearConverter().get().getScale());
		assertEquals(1000.0, components.getFactor().getNonlinearConverter().get().getPrefix(), 1e-12);
		assertThrows(IllegalStateException.class, () -> components.getFactor().getScale());
	}

	@Test
	public void unknownComponents() {
		UnknownUnitException exception = assertThrows(UnknownUnitException.class, () -> UNIT_DECOMPOSER.components("zz9"));

		assertEquals("zz", exception.getUnit());
		assertThrows(UnknownUnitException.class, () -> UNIT_DECOMPOSER.components(""));
		assertThrows(UnknownUnitException.class, () -> UNIT_DECOMPOSER.components("m99999999999"));
	}

	@Test
	public void breakdown() {
		UnitBreakdown fluxDensity = UNIT_DECOMPOSER.breakdown("erg s-1 cm-2 A-1");

		assertEquals(1e7, fluxDensity.getFactor().getScale(), 1e-3);
		assertEquals("kg1 m-1 s-3", fluxDensity.getSignature().getStringValue());
		assertEquals(List.of("kg1", "m-1", "s-3"), fluxDensity.getSignature().getTokens());

		UnitBreakdown compound = UNIT_DECOMPOSER.breakdown("erg s-1 W2 kg2 cm-2");

		assertEquals(0.001, compound.getFactor().getScale(), 1e-15);
		assertEquals("kg5 m4 s-9", compound.getSignature().getStringValue());

		assertEquals("kg1 m-1 s-3", UNIT_DECOMPOSER.breakdown("W m-3").getSignature().getStringValue());
		assertEquals(UNIT_DECOMPOSER.breakdown("erg s-1 cm-2 A-1"), UNIT_DECOMPOSER.breakdown("erg/s/cm2/angstrom"));
	}

	@Test
	public void breakdownDropsCancelledDimensions() {
		UnitBreakdown breakdown = UNIT_DECOMPOSER.breakdown("m m-1");

		assertTrue(breakdown.getSignature().isDimensionless());
		assertEquals("", breakdown.getSignature().getStringValue());
		assertEquals(DimensionSignature.fromPowers(Map.of("kg", 1)), UNIT_DECOMPOSER.breakdown("kg s s-1").getSignature());
	}

	@Test
	public void blankBreakdown() {
		UnitBreakdown breakdown = UNIT_DECOMPOSER.breakdown("   ");

		assertFalse(breakdown.getFactor().isNonlinear());
		assertEquals(1.0, breakdown.getFactor().getScale());
		assertTrue(breakdown.getSignature().isDimensionless());
	}

	@Test
	public void breakdownOfNonlinearUnits() {
		UnitBreakdown breakdown = UNIT_DECOMPOSER.breakdown("ABmag");

		assertTrue(breakdown.getFactor().isNonlinear());
		assertEquals("cy-1 kg1 s-2", breakdown.getSignature().getStringValue());
		assertThrows(UnsupportedConversionException.class, () -> UNIT_DECOMPOSER.breakdown("ABmag F"));
	}

	private static void assertComponents(double expectedFactor, String expectedBasis, int expectedPower, String token) {
		UnitComponents components = UNIT_DECOMPOSER.components(token);

		assertEquals(expectedFactor, components.getFactor().getScale(), Math.abs(expectedFactor) * 1e-12, "Wrong factor for " + token);
		assertEquals(expectedBasis, components.getBasis(), "Wrong basis for " + token);
		assertEquals(expectedPower, components.getPower(), "Wrong power for " + token);
	}
}
