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

import java.util.Objects;

/// Maps a stream of uniformly random bytes onto a [CharacterSet] without modulo bias.
///
/// # Rejection sampling
///
/// For a set of length `L` the rejection threshold is the largest multiple of
/// `L` not above 256:
///
/// ```
/// threshold = (256 / L) * L
/// ```
///
/// A byte `b` below the threshold selects `charSet[b % L]`; any other byte is
/// discarded and another is drawn. Every accepted byte is therefore equally
/// likely to land on each of the `L` positions. For `L = 10` the threshold is
/// 250 and 6 of 256 byte values are rejected; for `L = 1` or `L = 256`
/// nothing is ever rejected.
///
/// Each draw is accepted with probability `threshold / 256 >= 1/2` so the
/// loop ends almost surely.
///
/// # Batching
///
/// Bytes are fetched in batches of `batchMultiplier * length` (capped at
/// [#MAX_BATCH_BYTES]) and the batch is refilled in full once consumed.
/// Batching changes how often the source is called, never which characters
/// come out for a given byte sequence.
///
/// Instances hold no mutable state. Each call allocates its own buffer, so
/// one sampler can serve concurrent callers if its byte source can.
public final class UnbiasedSampler {

    private static final Logger logger = LogManager.getLogger(UnbiasedSampler.class);

    /// Number of distinct values of a byte.
    public static final int BYTE_RANGE = 256;

    /// Upper bound for a single batch fetched from the byte source.
    public static final int MAX_BATCH_BYTES = 1 << 16;

    /// Default ratio between batch size and requested length.
    public static final int DEFAULT_BATCH_MULTIPLIER = 2;

    public static final String INVALID_LENGTH_MESSAGE = "Length must be a positive integer.";

    private final SecureByteSource source;
    private final int batchMultiplier;

    /// Creates a sampler with the default batch multiplier.
    ///
    /// @param source the byte source to draw from
    public UnbiasedSampler(SecureByteSource source) {
        this(source, DEFAULT_BATCH_MULTIPLIER);
    }

    /// @param source the byte source to draw from
    /// @param batchMultiplier batch size as a multiple of the requested length, at least 1
    /// @throws ConfigurationException if the source is missing or the multiplier is below 1
    public UnbiasedSampler(SecureByteSource source, int batchMultiplier) {
        if (source == null) {
            throw new ConfigurationException("Secure random source unavailable: no byte source provided");
        }
        if (batchMultiplier < 1) {
            throw new ConfigurationException("Batch multiplier must be >= 1, got: " + batchMultiplier);
        }
        this.source = source;
        this.batchMultiplier = batchMultiplier;
    }

    /// Draws `length` characters uniformly and independently from `charSet`.
    ///
    /// @param charSet the characters to draw from, not empty
    /// @param length number of characters to produce
    /// @return a string of exactly `length` characters
    /// @throws ValidationException if `length` is not positive; no bytes are drawn in that case
    public String sample(CharacterSet charSet, int length) {
        if (length <= 0) {
            throw new ValidationException(INVALID_LENGTH_MESSAGE, length);
        }
        Objects.requireNonNull(charSet, "charSet");

        int setLength = charSet.length();
        int threshold = rejectionThreshold(setLength);
        byte[] batch = new byte[batchSize(length)];
        char[] out = new char[length];

        int filled = 0;
        int index = batch.length;
        long rejected = 0;
        while (filled < length) {
            if (index >= batch.length) {
                source.fill(batch);
                index = 0;
            }
            int value = batch[index++] & 0xFF;
            if (value < threshold) {
                out[filled++] = charSet.charAt(value % setLength);
            } else {
                rejected++;
            }
        }

        if (logger.isTraceEnabled()) {
            logger.trace("Sampled {} chars from a set of {} (threshold {}, rejected {} bytes)",
                length, setLength, threshold, rejected);
        }
        return new String(out);
    }

    /// Largest multiple of `setLength` which is not above 256.
    ///
    /// @param setLength alphabet size, in `[1, 256]`
    /// @return the exclusive upper bound for accepted byte values
    /// @throws ConfigurationException if `setLength` is outside `[1, 256]`
    public static int rejectionThreshold(int setLength) {
        if (setLength < 1 || setLength > BYTE_RANGE) {
            throw new ConfigurationException(
                "Character set size must be between 1 and " + BYTE_RANGE + ", got: " + setLength);
        }
        return (BYTE_RANGE / setLength) * setLength;
    }

    /// @return the configured batch multiplier
    public int batchMultiplier() {
        return batchMultiplier;
    }

    int batchSize(int length) {
        long size = (long) length * batchMultiplier;
        return (int) Math.min(size, MAX_BATCH_BYTES);
    }
}
