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
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * @author Quantus Authors
 */
@ThreadSafe
public class UnitTablesTests {
	@Test
	public void defaults() {
		UnitTables unitTables = UnitTables.withDefaults();

		assertEquals(List.of("n", "mu", "m", "c", "d", "da", "h", "k", "M", "G"),
				List.copyOf(unitTables.getPrefixScalingsBySymbol().keySet()));
		assertEquals(new UnitTables.Alias("micron", "mum"), unitTables.getAliases().get(0));
		assertEquals("kg m2 s-3", unitTables.getUnitDefinition("W").get().getSiBase());
		assertTrue(unitTables.getUnitDefinition("F").get().getFactor().isNonlinear());
		assertFalse(unitTables.getUnitDefinition("Lsun").isPresent());
	}

	@Test
	public void supplementedTables() {
		UnitTables unitTables = UnitTables.builderWithDefaults()
				.unit("Lsun", 3.828e26, "kg m2 s-3")
				.prefix("T", 1e12)
				.alias("lsol", "Lsun")
				.build();

		UnitConverter unitConverter = UnitConverter.withTables(unitTables);

		assertEquals(3.828e26, unitConverter.convert("Lsun", "W", 1.0), 1e14);
		assertEquals(382.8, unitConverter.convert("lsol", "TW", 1e-12), 1e-9);
		assertEquals(1e12, unitConverter.convert("Tm", "m", 1.0), 1e-3);

		assertFalse(UnitTables.withDefaults().getUnitDefinition("Lsun").isPresent(), "Defaults must not be modified");
		assertThrows(UnknownUnitException.class, () -> UnitConverter.withDefaults().convert("Lsun", "W", 1.0));
	}

	@Test
	public void copyIsIndependent() {
		UnitTables unitTables = UnitTables.withDefaults();
		UnitTables copy = unitTables.copy()
				.unit("furlong", 201.168, "m")
				.build();

		assertTrue(copy.getUnitDefinition("furlong").isPresent());
		assertFalse(unitTables.getUnitDefinition("furlong").isPresent());
		assertEquals(unitTables.getPrefixScalingsBySymbol(), copy.getPrefixScalingsBySymbol());
	}

	@Test
	public void invalidDefinitions() {
		UnitTables.Builder builder = UnitTables.builder();

		assertThrows(IllegalArgumentException.class, () -> builder.unit("parsec", 3.0e16, "m lightyears"));
		assertThrows(IllegalArgumentException.class, () -> builder.unit("parsec", 3.0e16, "mol"));
		assertThrows(IllegalArgumentException.class, () -> builder.unit("parsec", 3.0e16, " "));
		assertThrows(IllegalArgumentException.class, () -> builder.unit("par sec", 3.0e16, "m"));
		assertThrows(IllegalArgumentException.class, () -> builder.unit("pc2", 3.0e16, "m"));
		assertThrows(IllegalArgumentException.class, () -> builder.unit("parsec", -1.0, "m"));
		assertThrows(IllegalArgumentException.class, () -> builder.unit("parsec", Double.NaN, "m"));
		assertThrows(IllegalArgumentException.class, () -> builder.prefix("T2", 1e12));
		assertThrows(IllegalArgumentException.class, () -> builder.prefix("T", 0.0));
		assertThrows(IllegalArgumentException.class, () -> builder.alias("", "m"));
	}

	@Test
	public void unitTablesFile() throws Exception {
		Path unitTablesFile = Paths.get(getClass().getResource("/custom-units.properties").toURI());
		UnitTablesFileReader unitTablesFileReader = new UnitTablesFileReader(unitTablesFile);

		assertEquals("3.828e26 kg m2 s-3", unitTablesFileReader.properties().get("unit.Lsun"));

		UnitConverter unitConverter = UnitConverter.withTables(unitTablesFileReader.unitTables());

		assertEquals(3.828e26, unitConverter.convert("lsol", "W", 1.0), 1e14);
		// "watt" is rewritten by a default alias before "tera" is
		assertEquals(2.0, unitConverter.convert("terawatt", "kW", 2e-9), 1e-12);
		assertEquals(1e12, unitConverter.getUnitTables().getPrefixScalingsBySymbol().get("T"));
	}

	@Test
	public void invalidUnitTablesFiles() {
		assertThrows(IllegalArgumentException.class,
				() -> new UnitTablesFileReader(Paths.get("does-not-exist.properties")));
		assertThrows(IllegalArgumentException.class,
				() -> new UnitTablesFileReader(Paths.get(".")));
	}
}
