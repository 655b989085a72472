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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UnbiasedSamplerTest {

    @ParameterizedTest
    @CsvSource({
        "1, 256",
        "2, 256",
        "10, 250",
        "26, 234",
        "36, 252",
        "62, 248",
        "64, 256",
        "129, 129",
        "255, 255",
        "256, 256"
    })
    void testRejectionThreshold(int setLength, int expected) {
        assertEquals(expected, UnbiasedSampler.rejectionThreshold(setLength));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 257})
    void testRejectionThresholdOutOfRange(int setLength) {
        assertThrows(ConfigurationException.class, () -> UnbiasedSampler.rejectionThreshold(setLength));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5, Integer.MIN_VALUE})
    void testNonPositiveLengthDrawsNothing(int length) {
        CountingByteSource source = CountingByteSource.ascendingPerFill();
        UnbiasedSampler sampler = new UnbiasedSampler(source);

        ValidationException e = assertThrows(ValidationException.class,
            () -> sampler.sample(AlphabetResolver.expand(AlphabetTag.DIGITS), length));

        assertEquals("Length must be a positive integer.", e.getMessage());
        assertEquals(length, e.getRejectedValue());
        assertEquals(0, source.fillCount(), "No bytes should be drawn for an invalid length");
    }

    /// Every byte value appears exactly once, so each of the 10 digits must be
    /// selected exactly 25 times and bytes 250..255 must all be discarded.
    @Test
    void testExhaustiveBytesAreEvenlyMapped() {
        CountingByteSource source = CountingByteSource.ascendingPerFill();
        UnbiasedSampler sampler = new UnbiasedSampler(source);

        // the first 256 bytes of the batch yield exactly 250 characters
        String result = sampler.sample(AlphabetResolver.expand(AlphabetTag.DIGITS), 250);

        assertEquals(1, source.fillCount());
        Map<Character, Integer> counts = new HashMap<>();
        for (char c : result.toCharArray()) {
            counts.merge(c, 1, Integer::sum);
        }
        assertEquals(10, counts.size());
        for (int count : counts.values()) {
            assertEquals(25, count);
        }
    }

    @Test
    void testBytesAtOrAboveThresholdAreSkipped() {
        // 250..255 are rejected for a 10 character set
        CountingByteSource source = CountingByteSource.of(250, 251, 252, 253, 254, 255, 3, 249, 10, 0);
        UnbiasedSampler sampler = new UnbiasedSampler(source, 5);

        String result = sampler.sample(AlphabetResolver.expand(AlphabetTag.DIGITS), 4);

        assertEquals("3900", result);
    }

    @Test
    void testAcceptedByteMapsByModulo() {
        CountingByteSource source = CountingByteSource.of(0, 25, 26, 233);
        UnbiasedSampler sampler = new UnbiasedSampler(source);

        String result = sampler.sample(AlphabetResolver.expand(AlphabetTag.LOWERCASE), 4);

        assertEquals("azaz", result);
    }

    @Test
    void testSingleCharacterSetNeverRejects() {
        CountingByteSource source = CountingByteSource.of(255, 0, 128);
        UnbiasedSampler sampler = new UnbiasedSampler(source, 1);
        CharacterSet one = new CharacterSet("x");

        assertEquals("xxxxxx", sampler.sample(one, 6));
        assertEquals(6, source.bytesDrawn());
    }

    @Test
    void testBatchIsTwiceTheLengthByDefault() {
        CountingByteSource source = CountingByteSource.ascendingPerFill();
        UnbiasedSampler sampler = new UnbiasedSampler(source);

        sampler.sample(AlphabetResolver.expand(AlphabetTag.LOWERCASE), 16);

        assertEquals(1, source.fillCount());
        assertEquals(32, source.fillSizes().get(0));
    }

    @Test
    void testRefillsWithSameSizeWhenExhausted() {
        // every other byte rejected; 4 chars need 8 bytes in batches of 4
        CountingByteSource source = CountingByteSource.of(255, 1);
        UnbiasedSampler sampler = new UnbiasedSampler(source, 1);

        String result = sampler.sample(AlphabetResolver.expand(AlphabetTag.DIGITS), 4);
        assertEquals("1111", result);
        assertEquals(2, source.fillCount());
        assertTrue(source.fillSizes().stream().allMatch(size -> size == 4));
    }

    @Test
    void testBatchSizeIsCapped() {
        UnbiasedSampler sampler = new UnbiasedSampler(CountingByteSource.ascendingPerFill());
        assertEquals(UnbiasedSampler.MAX_BATCH_BYTES, sampler.batchSize(Integer.MAX_VALUE));
        assertEquals(UnbiasedSampler.MAX_BATCH_BYTES, sampler.batchSize(UnbiasedSampler.MAX_BATCH_BYTES));
        assertEquals(2, sampler.batchSize(1));
    }

    @Test
    void testLongRequestSpansManyBatches() {
        CountingByteSource source = CountingByteSource.ascendingPerFill();
        UnbiasedSampler sampler = new UnbiasedSampler(source, 1);
        CharacterSet all = AlphabetResolver.expand(AlphabetTag.values());

        String result = sampler.sample(all, UnbiasedSampler.MAX_BATCH_BYTES + 10);

        assertEquals(UnbiasedSampler.MAX_BATCH_BYTES + 10, result.length());
        assertEquals(2, source.fillCount());
    }

    @Test
    void testInvalidConstruction() {
        assertThrows(ConfigurationException.class, () -> new UnbiasedSampler(null));
        assertThrows(ConfigurationException.class,
            () -> new UnbiasedSampler(CountingByteSource.ascendingPerFill(), 0));
    }
}
