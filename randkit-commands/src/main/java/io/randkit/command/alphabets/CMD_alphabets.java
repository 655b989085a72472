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

package io.randkit.command.alphabets;

import io.randkit.strings.AlphabetTag;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/// List the alphabets accepted by `generate --alphabet`.
@CommandLine.Command(name = "alphabets",
    description = "List the available alphabets with their sizes and characters")
public class CMD_alphabets implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        for (AlphabetTag tag : AlphabetTag.values()) {
            out.printf("%-4s %-16s %3d  %s%n",
                tag.symbol(), tag.name().toLowerCase(Locale.ROOT),
                tag.characters().length(), tag.characters());
        }
        out.flush();
        return 0;
    }
}
