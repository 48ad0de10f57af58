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

/**
 * Conversion of numeric values between free-form compound physical-unit expressions.
 * <p>
 * The entry point is {@link com.quantus.UnitConverter}. Unit expressions are resolved against
 * {@link com.quantus.UnitTables}, broken down into a factor to SI and a {@link com.quantus.DimensionSignature}, and
 * bridged across dimensions by {@link com.quantus.ChangeOfBase} when the signatures differ.
 */
package com.quantus;
