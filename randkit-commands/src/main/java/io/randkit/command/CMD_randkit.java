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

package io.randkit.command;

import io.randkit.command.alphabets.CMD_alphabets;
import io.randkit.command.generate.CMD_generate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Random string tools
///
/// This is the top level command which serves as an entry point for all sub-commands:
///
/// - `generate`: print random strings drawn without modulo bias from a secure source
/// - `alphabets`: list the alphabets `generate` accepts
@CommandLine.Command(name = "randkit",
    mixinStandardHelpOptions = true,
    version = "randkit 0.1.0",
    header = "Generate unbiased random strings for tokens, identifiers and secrets",
    subcommands = {CMD_generate.class, CMD_alphabets.class, CommandLine.HelpCommand.class})
public class CMD_randkit {

    /// run a randkit command
    /// @param args command line args
    public static void main(String[] args) {
        Logger logger = LogManager.getLogger(CMD_randkit.class);
        int exitCode = newCommandLine().execute(args);
        logger.debug("Exiting main with code: {}", exitCode);
        System.exit(exitCode);
    }

    /// @return a configured command line for the randkit command tree
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_randkit())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }
}
