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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Names of the auxiliary quantities a change-of-base conversion may need.
 *
 * @author Quantus Authors
 */
@ThreadSafe
public enum ContextKey {
	/**
	 * Reference wavelength.
	 */
	WAVE("wave"),
	/**
	 * Reference frequency.
	 */
	FREQ("freq"),
	/**
	 * Angular diameter of the source.
	 */
	DIAM("diam"),
	/**
	 * Angular radius of the source.
	 */
	RADIUS("radius"),
	/**
	 * Angular size of a pixel.
	 */
	PIX("pix");

	@NonNull
	private final String name;

	ContextKey(@NonNull String name) {
		requireNonNull(name);
		this.name = name;
	}

	/**
	 * The keyword under which callers pass this quantity, e.g. {@code "wave"}.
	 *
	 * @return the keyword
	 */
	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public static Optional<ContextKey> fromName(@NonNull String name) {
		requireNonNull(name);

		for (ContextKey contextKey : values())
			if (contextKey.getName().equals(name))
				return Optional.of(contextKey);

		return Optional.empty();
	}
}
