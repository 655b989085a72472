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

/// A capability which fills buffers with independent, uniformly distributed
/// random bytes.
///
/// Implementations used for real tokens must be cryptographically secure and
/// safe to call from several threads at once. Tests may bind a deterministic
/// implementation instead.
@FunctionalInterface
public interface SecureByteSource {

    /// Overwrites every element of `buffer` with a fresh random byte.
    ///
    /// @param buffer the buffer to fill
    void fill(byte[] buffer);
}
