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
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Reads custom units, prefixes and aliases from a properties file and supplements a set of {@link UnitTables} with them.
 * <p>
 * Recognized keys:
 * <pre>
 * # Factor to SI, then the SI base string
 * unit.Lsun=3.828e26 kg m2 s-3
 *
 * # Prefix scalings, tried after existing prefixes in symbol order
 * prefix.T=1e12
 *
 * # Aliases, applied after existing aliases in index order
 * alias.1=lsol=&gt;Lsun
 * </pre>
 * Nonlinear units cannot be declared in a file. Files are read as UTF-8.
 *
 * @author Quantus Authors
 */
@ThreadSafe
public class UnitTablesFileReader {
	@NonNull
	private static final String UNIT_KEY_PREFIX = "unit.";
	@NonNull
	private static final String PREFIX_KEY_PREFIX = "prefix.";
	@NonNull
	private static final String ALIAS_KEY_PREFIX = "alias.";
	@NonNull
	private static final String ALIAS_SEPARATOR = "=>";

	@NonNull
	private final Path unitTablesFile;
	@NonNull
	private final Map<String, String> properties;
	@NonNull
	private final Logger logger = Logger.getLogger(UnitTablesFileReader.class.getName());

	public UnitTablesFileReader(@NonNull Path unitTablesFile) {
		requireNonNull(unitTablesFile);

		this.unitTablesFile = unitTablesFile;
		this.properties = Collections.unmodifiableMap(loadPropertiesForPath(unitTablesFile));
	}

	/**
	 * Supplements {@link UnitTables#withDefaults()} with this file's definitions.
	 *
	 * @return the supplemented tables
	 * @throws IllegalArgumentException if a definition in the file is malformed
	 */
	@NonNull
	public UnitTables unitTables() {
		return unitTablesSupplementing(UnitTables.withDefaults());
	}

	/**
	 * Supplements the given tables with this file's definitions.
	 *
	 * @param unitTables the tables to supplement
	 * @return the supplemented tables
	 * @throws IllegalArgumentException if a definition in the file is malformed
	 */
	@NonNull
	public UnitTables unitTablesSupplementing(@NonNull UnitTables unitTables) {
		requireNonNull(unitTables);

		UnitTables.Builder builder = unitTables.copy();
		Map<Integer, String> aliasesByIndex = new TreeMap<>();
		int unitCount = 0;
		int prefixCount = 0;

		for (Map.Entry<String, String> entry : properties().entrySet()) {
			String key = entry.getKey();
			String value = entry.getValue().trim();

			if (key.startsWith(UNIT_KEY_PREFIX)) {
				String name = key.substring(UNIT_KEY_PREFIX.length());
				String[] factorAndSiBase = value.split("\\s+", 2);

				if (factorAndSiBase.length != 2)
					throw new IllegalArgumentException(format("Unit '%s' in %s must be a factor followed by an SI base, but was '%s'",
							name, getUnitTablesFile().toAbsolutePath(), value));

				builder.unit(name, parseDouble(key, factorAndSiBase[0]), factorAndSiBase[1]);
				++unitCount;
			} else if (key.startsWith(PREFIX_KEY_PREFIX)) {
				builder.prefix(key.substring(PREFIX_KEY_PREFIX.length()), parseDouble(key, value));
				++prefixCount;
			} else if (key.startsWith(ALIAS_KEY_PREFIX)) {
				String index = key.substring(ALIAS_KEY_PREFIX.length());

				try {
					aliasesByIndex.put(Integer.parseInt(index), entry.getValue());
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException(format("Alias key '%s' in %s must end with an integer index",
							key, getUnitTablesFile().toAbsolutePath()), e);
				}
			} else {
				throw new IllegalArgumentException(format("Unrecognized key '%s' in %s", key, getUnitTablesFile().toAbsolutePath()));
			}
		}

		for (Map.Entry<Integer, String> entry : aliasesByIndex.entrySet()) {
			String alias = entry.getValue();
			int separatorIndex = alias.indexOf(ALIAS_SEPARATOR);

			if (separatorIndex <= 0)
				throw new IllegalArgumentException(format("Alias %d in %s must have the form <pattern>%s<replacement>, but was '%s'",
						entry.getKey(), getUnitTablesFile().toAbsolutePath(), ALIAS_SEPARATOR, alias));

			builder.alias(alias.substring(0, separatorIndex), alias.substring(separatorIndex + ALIAS_SEPARATOR.length()));
		}

		logger.info(format("Loaded %d unit(s), %d prefix(es) and %d alias(es) from %s", unitCount, prefixCount,
				aliasesByIndex.size(), getUnitTablesFile().toAbsolutePath()));

		return builder.build();
	}

	private double parseDouble(@NonNull String key,
														 @NonNull String value) {
		requireNonNull(key);
		requireNonNull(value);

		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(format("Value '%s' for key '%s' in %s is not a number", value, key,
					getUnitTablesFile().toAbsolutePath()), e);
		}
	}

	@NonNull
	protected Map<String, String> loadPropertiesForPath(@NonNull Path unitTablesFile) {
		requireNonNull(unitTablesFile);

		if (!Files.exists(unitTablesFile))
			throw new IllegalArgumentException(format("Unable to find unit tables file at %s", unitTablesFile.toAbsolutePath()));

		if (!Files.isRegularFile(unitTablesFile))
			throw new IllegalArgumentException(format("Unit tables file at %s is not a regular file", unitTablesFile.toAbsolutePath()));

		Properties properties = new Properties();

		try (InputStream inputStream = Files.newInputStream(unitTablesFile);
				 Reader reader = new InputStreamReader(inputStream, UTF_8)) {
			properties.load(reader);
		} catch (IOException | IllegalArgumentException e) {
			throw new IllegalArgumentException(format("Invalid format for unit tables file at %s",
					unitTablesFile.toAbsolutePath()), e);
		}

		// Sorted so that prefixes are registered in symbol order
		Map<String, String> propertiesMap = new TreeMap<>();

		for (String key : properties.stringPropertyNames())
			propertiesMap.put(key, properties.getProperty(key));

		return propertiesMap;
	}

	@NonNull
	public Path getUnitTablesFile() {
		return this.unitTablesFile;
	}

	@NonNull
	public Map<String, String> properties() {
		return this.properties;
	}
}
