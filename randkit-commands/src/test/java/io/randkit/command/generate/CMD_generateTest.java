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

package io.randkit.command.generate;

import io.randkit.command.CMD_randkit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/// Unit tests for the generate command
class CMD_generateTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = CMD_randkit.newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private String[] lines() {
        return out.toString().trim().split("\\R");
    }

    @Test
    void testDefaultAlphabet() {
        int exitCode = commandLine.execute("generate", "--length", "16");

        assertEquals(0, exitCode, "Command should execute successfully");
        String[] lines = lines();
        assertEquals(1, lines.length);
        assertThat(lines[0]).hasSize(16).matches("[a-zA-Z0-9]+");
    }

    @Test
    void testRepeatedAlphabetsAndCount() {
        int exitCode = commandLine.execute("generate", "-l", "8", "-a", "A-Z", "-a", "0-9", "-n", "5");

        assertEquals(0, exitCode);
        String[] lines = lines();
        assertEquals(5, lines.length);
        for (String line : lines) {
            assertThat(line).hasSize(8).matches("[A-Z0-9]+");
        }
    }

    @Test
    void testTagNameAccepted() {
        int exitCode = commandLine.execute("generate", "-l", "12", "-a", "digits");

        assertEquals(0, exitCode);
        assertThat(lines()[0]).matches("[0-9]{12}");
    }

    @Test
    void testNamedAlgorithm() {
        int exitCode = commandLine.execute("generate", "-l", "10", "--alphabet=-_", "--algorithm", "SHA1PRNG");

        assertEquals(0, exitCode);
        assertThat(lines()[0]).matches("[-_]{10}");
    }

    @Test
    void testNonPositiveLength() {
        int exitCode = commandLine.execute("generate", "--length", "0");

        assertEquals(2, exitCode);
        assertThat(err.toString()).contains("Length must be a positive integer.");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testNonPositiveCount() {
        int exitCode = commandLine.execute("generate", "--length", "4", "--count", "0");

        assertEquals(2, exitCode);
        assertThat(err.toString()).contains("Count must be a positive integer.");
    }

    @Test
    void testUnknownAlgorithm() {
        int exitCode = commandLine.execute("generate", "-l", "4", "--algorithm", "NoSuchRandomAlgorithm");

        assertEquals(2, exitCode);
        assertThat(err.toString()).contains("Secure random source unavailable");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testUnknownAlphabetIsUsageError() {
        int exitCode = commandLine.execute("generate", "-l", "4", "-a", "a-f");

        assertNotEquals(0, exitCode);
        assertThat(err.toString()).contains("Unsupported alphabet: a-f");
    }

    @Test
    void testLengthIsRequired() {
        int exitCode = commandLine.execute("generate");

        assertNotEquals(0, exitCode);
        assertThat(err.toString()).contains("--length");
    }
}
