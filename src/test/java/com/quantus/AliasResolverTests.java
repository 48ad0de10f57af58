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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author Quantus Authors
 */
@ThreadSafe
public class AliasResolverTests {
	private static final AliasResolver ALIAS_RESOLVER = new AliasResolver(UnitTables.withDefaults());

	@Test
	public void divisionBecomesNegativePowers() {
		assertEquals("erg s-1 cm-2 A-1", ALIAS_RESOLVER.resolve("erg/s/cm2/angstrom"));
		assertEquals("10mW m-2 nm-1", ALIAS_RESOLVER.resolve("10mW m-2/nm"));
		assertEquals("km h-1", ALIAS_RESOLVER.resolve("km/h"));
		assertEquals("cy as-1", ALIAS_RESOLVER.resolve("cycles/arcsec"));
		assertEquals("erg cm-2 s-1 hz-1", ALIAS_RESOLVER.resolve("erg/cm2/s/Hz"));
	}

	@Test
	public void divisionKeepsLeadingFactor() {
		assertEquals("W m-2 10nm-1", ALIAS_RESOLVER.resolve("W/m2/10nm"));
		assertEquals("W m-2 nm-1", ALIAS_RESOLVER.resolve("W/m2/1nm"));
		assertEquals("m s2", ALIAS_RESOLVER.resolve("m/s-2"));
	}

	@Test
	public void emptySegmentsAreDropped() {
		assertEquals("m s-1", ALIAS_RESOLVER.resolve("m//s"));
		assertEquals("s-1", ALIAS_RESOLVER.resolve("/s"));
		assertEquals("m", ALIAS_RESOLVER.resolve("m/"));
	}

	@Test
	public void canonicalExpressionsAreUnchanged() {
		assertEquals("erg s-1 cm-2 A-1", ALIAS_RESOLVER.resolve("erg s-1 cm-2 A-1"));
		assertEquals("ABmag", ALIAS_RESOLVER.resolve("ABmag"));
		assertEquals("", ALIAS_RESOLVER.resolve(""));
	}

	@Test
	public void whitespaceIsNormalized() {
		assertEquals("km h-1", ALIAS_RESOLVER.resolve("  km   h-1 "));
		assertEquals("km h-1", ALIAS_RESOLVER.resolve("km\th-1"));
		assertEquals("km h-1", ALIAS_RESOLVER.resolve("  km/h "));
		assertEquals("", ALIAS_RESOLVER.resolve("   "));
	}

	@Test
	public void spellingAliases() {
		assertEquals("Jy vegamag", ALIAS_RESOLVER.resolve("Jy mag"));
		assertEquals("cm2", ALIAS_RESOLVER.resolve("cm^2"));
		assertEquals("m2", ALIAS_RESOLVER.resolve("m**2"));
		assertEquals("mum", ALIAS_RESOLVER.resolve("micron"));
		assertEquals("kW", ALIAS_RESOLVER.resolve("kilowatt"));
		assertEquals("erg s-1 cm-2 A-1 vegamag-1", ALIAS_RESOLVER.resolve("erg/s/cm2/A/mag"));
	}

	@Test
	public void aliasesApplyInOrder() {
		UnitTables unitTables = UnitTables.builder()
				.unit("m", 1.0, "m")
				.alias("foot", "feet")
				.alias("feet", "m")
				.build();

		assertEquals("m", new AliasResolver(unitTables).resolve("foot"));

		UnitTables reversedUnitTables = UnitTables.builder()
				.unit("m", 1.0, "m")
				.alias("feet", "m")
				.alias("foot", "feet")
				.build();

		assertEquals("feet", new AliasResolver(reversedUnitTables).resolve("foot"));
	}
}
