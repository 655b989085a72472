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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Entry point for creating [RandomStringGenerator] instances.
///
/// The base tags are resolved once, here. An empty result fails immediately
/// with a [ConfigurationException] rather than on the first call.
public final class RandomStrings {

    private static final Logger logger = LogManager.getLogger(RandomStrings.class);

    private RandomStrings() {
    }

    /// Creates a generator drawing from the platform default secure random.
    ///
    /// @param baseTags tags making up the base character set
    /// @return the generator
    /// @throws ConfigurationException if no characters result or no secure source exists
    public static RandomStringGenerator createGenerator(AlphabetTag... baseTags) {
        return createGenerator(RandomStringOptions.defaults(), baseTags);
    }

    /// @param symbols alphabet symbols like `a-z`, making up the base character set
    /// @return the generator
    /// @throws ConfigurationException if a symbol is unknown or no characters result
    public static RandomStringGenerator createGeneratorForSymbols(String... symbols) {
        List<AlphabetTag> tags = AlphabetResolver.toTags(symbols);
        return createGenerator(tags.toArray(new AlphabetTag[0]));
    }

    /// @param options generator options
    /// @param baseTags tags making up the base character set
    /// @return the generator
    /// @throws ConfigurationException if no characters result or the configured source is unavailable
    public static RandomStringGenerator createGenerator(RandomStringOptions options, AlphabetTag... baseTags) {
        CharacterSet base = AlphabetResolver.expand(baseTags);
        return build(base, options.byteSource(), options.batchMultiplier());
    }

    /// @param source the byte source to draw from
    /// @param baseTags tags making up the base character set
    /// @return the generator
    /// @throws ConfigurationException if no characters result or `source` is null
    public static RandomStringGenerator createGenerator(SecureByteSource source, AlphabetTag... baseTags) {
        CharacterSet base = AlphabetResolver.expand(baseTags);
        return build(base, source, UnbiasedSampler.DEFAULT_BATCH_MULTIPLIER);
    }

    private static RandomStringGenerator build(CharacterSet base, SecureByteSource source, int batchMultiplier) {
        UnbiasedSampler sampler = new UnbiasedSampler(source, batchMultiplier);
        logger.debug("Created generator over {} characters (threshold {})",
            base.length(), UnbiasedSampler.rejectionThreshold(base.length()));
        return new RandomStringGenerator(base, sampler);
    }
}
