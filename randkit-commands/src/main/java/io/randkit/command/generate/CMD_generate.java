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

import io.randkit.command.common.AlphabetTagConverter;
import io.randkit.strings.AlphabetTag;
import io.randkit.strings.ConfigurationException;
import io.randkit.strings.RandomStringGenerator;
import io.randkit.strings.RandomStringOptions;
import io.randkit.strings.RandomStrings;
import io.randkit.strings.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Generate one or more random strings over the chosen alphabets.
///
/// ```
/// randkit generate --length 16
/// randkit generate -l 8 -a A-Z -a 0-9 --count 5
/// ```
///
/// Options not given on the command line fall back to the
/// `randkit.securerandom.algorithm` and `randkit.batch.multiplier` system properties.
@CommandLine.Command(name = "generate",
    description = "Generate random strings from a secure random source without modulo bias",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "2:error"})
public class CMD_generate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_generate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Option(names = {"-l", "--length"},
        description = "Number of characters per string",
        required = true)
    private int length;

    @CommandLine.Option(names = {"-a", "--alphabet"},
        description = "Alphabet to draw from, repeatable: a-z, A-Z, 0-9, -_ (default: a-z A-Z 0-9)",
        converter = AlphabetTagConverter.class)
    private List<AlphabetTag> alphabets = new ArrayList<>();

    @CommandLine.Option(names = {"-n", "--count"},
        description = "Number of strings to generate",
        defaultValue = "1")
    private int count = 1;

    @CommandLine.Option(names = {"--algorithm"},
        description = "SecureRandom algorithm, e.g. DRBG or NativePRNGNonBlocking (default: platform default)")
    private String algorithm;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// @return exit code (0 for success, 2 for invalid input or configuration)
    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (count <= 0) {
            err.println("Error: Count must be a positive integer.");
            return EXIT_ERROR;
        }

        try {
            RandomStringOptions options = RandomStringOptions.fromSystemProperties();
            if (algorithm != null) {
                options = options.toBuilder().secureRandomAlgorithm(algorithm).build();
            }
            List<AlphabetTag> tags = alphabets.isEmpty()
                ? List.of(AlphabetTag.LOWERCASE, AlphabetTag.UPPERCASE, AlphabetTag.DIGITS)
                : alphabets;
            logger.debug("Generating {} string(s) of length {} over {} with {}", count, length, tags, options);

            RandomStringGenerator generator =
                RandomStrings.createGenerator(options, tags.toArray(new AlphabetTag[0]));
            for (int i = 0; i < count; i++) {
                out.println(generator.generate(length));
            }
            out.flush();
            return EXIT_SUCCESS;
        } catch (ValidationException | ConfigurationException e) {
            logger.debug("Generation failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
