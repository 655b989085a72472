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

import java.security.SecureRandom;
import java.util.Objects;

/// [SecureByteSource] backed by a [SecureRandom] instance.
public final class SecureRandomByteSource implements SecureByteSource {

    private final SecureRandom random;

    public SecureRandomByteSource(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public void fill(byte[] buffer) {
        random.nextBytes(buffer);
    }

    /// @return the algorithm name reported by the underlying provider
    public String algorithm() {
        return random.getAlgorithm();
    }

    @Override
    public String toString() {
        return "SecureRandomByteSource{algorithm=" + random.getAlgorithm() +
            ", provider=" + random.getProvider().getName() + '}';
    }
}
