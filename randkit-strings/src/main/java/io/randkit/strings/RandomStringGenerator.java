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

package io.randkit.strings;

import java.util.List;
import java.util.Objects;

/// Generates random strings over a base [CharacterSet] fixed at construction.
///
/// A call may pass its own alphabet tags; these replace the base set for that
/// call only. Instances are immutable and can be shared between threads.
///
/// ```java
/// RandomStringGenerator gen = RandomStrings.createGenerator(AlphabetTag.LOWERCASE);
/// String id = gen.generate(16);
/// String pin = gen.generate(6, AlphabetTag.DIGITS);
/// ```
///
/// @see RandomStrings
public final class RandomStringGenerator {

    private final CharacterSet baseCharacterSet;
    private final UnbiasedSampler sampler;

    RandomStringGenerator(CharacterSet baseCharacterSet, UnbiasedSampler sampler) {
        this.baseCharacterSet = Objects.requireNonNull(baseCharacterSet, "baseCharacterSet");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
    }

    /// @param length number of characters, must be positive
    /// @param overrideTags tags replacing the base set for this call; none keeps the base set
    /// @return a string of exactly `length` characters
    /// @throws ValidationException if `length` is not positive
    public String generate(int length, AlphabetTag... overrideTags) {
        if (overrideTags == null || overrideTags.length == 0) {
            return generate(length, List.of());
        }
        return generate(length, List.of(overrideTags));
    }

    /// @param length number of characters, must be positive
    /// @param overrideTags tags replacing the base set for this call; empty keeps the base set
    /// @return a string of exactly `length` characters
    /// @throws ValidationException if `length` is not positive
    public String generate(int length, List<AlphabetTag> overrideTags) {
        if (length <= 0) {
            throw new ValidationException(UnbiasedSampler.INVALID_LENGTH_MESSAGE, length);
        }
        CharacterSet charSet = (overrideTags == null || overrideTags.isEmpty())
            ? baseCharacterSet
            : AlphabetResolver.expand(overrideTags);
        return sampler.sample(charSet, length);
    }

    /// @return the character set used when a call passes no tags
    public CharacterSet baseCharacterSet() {
        return baseCharacterSet;
    }

    @Override
    public String toString() {
        return "RandomStringGenerator{base=" + baseCharacterSet +
            ", batchMultiplier=" + sampler.batchMultiplier() + '}';
    }
}
