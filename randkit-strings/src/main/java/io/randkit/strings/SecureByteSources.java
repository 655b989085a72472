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

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

/// Factory methods for the secure byte sources available on this JVM.
///
/// Nothing here falls back to a non-cryptographic generator. When a requested
/// source cannot be created a [ConfigurationException] is thrown.
public final class SecureByteSources {

    private static final Logger logger = LogManager.getLogger(SecureByteSources.class);

    private SecureByteSources() {
    }

    /// @return a source backed by the platform default [SecureRandom]
    /// @throws ConfigurationException if the platform offers none
    public static SecureRandomByteSource system() {
        SecureRandom random;
        try {
            random = new SecureRandom();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Secure random source unavailable: " + e.getMessage(), e);
        }
        logger.debug("Using default secure random algorithm {} from provider {}",
            random.getAlgorithm(), random.getProvider().getName());
        return new SecureRandomByteSource(random);
    }

    /// @param algorithm a [SecureRandom] algorithm name, like `DRBG` or `NativePRNGNonBlocking`
    /// @return a source backed by that algorithm
    /// @throws ConfigurationException if the algorithm is not available
    public static SecureRandomByteSource forAlgorithm(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new ConfigurationException("Secure random source unavailable: no algorithm named");
        }
        try {
            SecureRandom random = SecureRandom.getInstance(algorithm.trim());
            logger.debug("Using secure random algorithm {} from provider {}",
                random.getAlgorithm(), random.getProvider().getName());
            return new SecureRandomByteSource(random);
        } catch (NoSuchAlgorithmException e) {
            throw new ConfigurationException("Secure random source unavailable: " + algorithm, e);
        }
    }
}
