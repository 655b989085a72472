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

import java.util.Properties;

/// Configuration options for random string generators.
///
/// # Overview
///
/// - **secureRandomAlgorithm**: the [java.security.SecureRandom] algorithm to
///   draw bytes from, or `null` for the platform default
/// - **batchMultiplier**: how many bytes to fetch per requested character
///
/// # Usage
///
/// ```java
/// RandomStringOptions options = RandomStringOptions.builder()
///     .secureRandomAlgorithm("DRBG")
///     .batchMultiplier(4)
///     .build();
///
/// RandomStringGenerator gen = RandomStrings.createGenerator(options, AlphabetTag.LOWERCASE);
/// ```
///
/// Options can also be read from [Properties] using the keys [#ALGORITHM_PROPERTY]
/// and [#BATCH_MULTIPLIER_PROPERTY].
public final class RandomStringOptions {

    /// Property naming the secure random algorithm.
    public static final String ALGORITHM_PROPERTY = "randkit.securerandom.algorithm";

    /// Property holding the batch multiplier.
    public static final String BATCH_MULTIPLIER_PROPERTY = "randkit.batch.multiplier";

    private final String secureRandomAlgorithm;
    private final int batchMultiplier;

    private RandomStringOptions(Builder builder) {
        this.secureRandomAlgorithm = builder.secureRandomAlgorithm;
        this.batchMultiplier = builder.batchMultiplier;
    }

    /// @return the secure random algorithm, or `null` for the platform default
    public String secureRandomAlgorithm() {
        return secureRandomAlgorithm;
    }

    /// @return the batch multiplier (default 2)
    public int batchMultiplier() {
        return batchMultiplier;
    }

    /// Creates the byte source these options describe.
    ///
    /// @return a secure byte source
    /// @throws ConfigurationException if the algorithm is not available
    public SecureByteSource byteSource() {
        return secureRandomAlgorithm == null
            ? SecureByteSources.system()
            : SecureByteSources.forAlgorithm(secureRandomAlgorithm);
    }

    /// Defaults: platform secure random, batch multiplier 2.
    ///
    /// @return the default options
    public static RandomStringOptions defaults() {
        return new Builder().build();
    }

    /// @return a new builder
    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder pre-populated with these values
    public Builder toBuilder() {
        return new Builder()
            .secureRandomAlgorithm(this.secureRandomAlgorithm)
            .batchMultiplier(this.batchMultiplier);
    }

    /// Reads options from properties. Missing keys keep their defaults.
    ///
    /// @param properties the properties to read
    /// @return the resulting options
    /// @throws ConfigurationException if a value cannot be parsed
    public static RandomStringOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String algorithm = properties.getProperty(ALGORITHM_PROPERTY);
        if (algorithm != null && !algorithm.isBlank()) {
            builder.secureRandomAlgorithm(algorithm.trim());
        }
        String multiplier = properties.getProperty(BATCH_MULTIPLIER_PROPERTY);
        if (multiplier != null && !multiplier.isBlank()) {
            try {
                builder.batchMultiplier(Integer.parseInt(multiplier.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(
                    "Invalid value for " + BATCH_MULTIPLIER_PROPERTY + ": " + multiplier, e);
            }
        }
        return builder.build();
    }

    /// @return options read from the JVM system properties
    public static RandomStringOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    @Override
    public String toString() {
        return "RandomStringOptions{" +
            "secureRandomAlgorithm=" + (secureRandomAlgorithm == null ? "default" : secureRandomAlgorithm) +
            ", batchMultiplier=" + batchMultiplier +
            '}';
    }

    /// Builder for RandomStringOptions.
    public static final class Builder {
        private String secureRandomAlgorithm;
        private int batchMultiplier = UnbiasedSampler.DEFAULT_BATCH_MULTIPLIER;

        Builder() {
        }

        /// @param algorithm a SecureRandom algorithm name, or `null` for the default
        /// @return this builder
        public Builder secureRandomAlgorithm(String algorithm) {
            this.secureRandomAlgorithm = algorithm;
            return this;
        }

        /// @param multiplier batch size per requested character (must be >= 1)
        /// @return this builder
        /// @throws ConfigurationException if multiplier < 1
        public Builder batchMultiplier(int multiplier) {
            if (multiplier < 1) {
                throw new ConfigurationException("Batch multiplier must be >= 1, got: " + multiplier);
            }
            this.batchMultiplier = multiplier;
            return this;
        }

        /// @return the configured options
        public RandomStringOptions build() {
            return new RandomStringOptions(this);
        }
    }
}
