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

package io.randkit.command.common;

import io.randkit.strings.AlphabetTag;
import io.randkit.strings.ConfigurationException;
import picocli.CommandLine;

/**
 * Picocli type converter accepting alphabet symbols such as {@code a-z} or tag names such as {@code digits}.
 */
public class AlphabetTagConverter implements CommandLine.ITypeConverter<AlphabetTag> {

    @Override
    public AlphabetTag convert(String value) {
        try {
            return AlphabetTag.fromSymbol(value);
        } catch (ConfigurationException e) {
            throw new CommandLine.TypeConversionException(
                e.getMessage() + ". Valid alphabets: a-z, A-Z, 0-9, -_");
        }
    }
}
