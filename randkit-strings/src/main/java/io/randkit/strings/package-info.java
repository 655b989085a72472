/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// # Random strings without modulo bias
///
/// Generators in this package turn bytes from a secure source into strings
/// over a chosen alphabet.
///
/// ## Flow
///
/// ```text
///  AlphabetTag...  ──▶  AlphabetResolver  ──▶  CharacterSet (base, immutable)
///                                                   │
///  SecureByteSource ──▶ UnbiasedSampler ◀───────────┘
///                              │
///                              ▼
///                     RandomStringGenerator.generate(length, [override tags])
/// ```
///
/// ## Usage
///
/// ```java
/// RandomStringGenerator gen = RandomStrings.createGenerator(
///     AlphabetTag.UPPERCASE, AlphabetTag.DIGITS);
/// String code = gen.generate(8);
/// ```
///
/// ## Errors
///
/// | Exception | Raised when |
/// |-----------|-------------|
/// | ConfigurationException | empty alphabet, unknown symbol, no secure source |
/// | ValidationException | length is not positive |
///
/// @see io.randkit.strings.RandomStrings
/// @see io.randkit.strings.UnbiasedSampler
package io.randkit.strings;
