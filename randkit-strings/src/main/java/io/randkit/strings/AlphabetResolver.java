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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Expands alphabet tags into a concrete [CharacterSet].
///
/// Tags are concatenated in the order given. Duplicate tags, or tags sharing
/// characters, are kept as-is and weight the shared characters accordingly.
public final class AlphabetResolver {

    public static final String NO_CHARACTERS_MESSAGE =
        "No valid characters provided for random string generation.";

    private AlphabetResolver() {
    }

    /// @param tags tags to expand, in order
    /// @return the concatenated character set
    /// @throws ConfigurationException if the result is empty
    public static CharacterSet expand(AlphabetTag... tags) {
        return expand(tags == null ? List.of() : Arrays.asList(tags));
    }

    /// @param tags tags to expand, in order
    /// @return the concatenated character set
    /// @throws ConfigurationException if the result is empty
    public static CharacterSet expand(List<AlphabetTag> tags) {
        StringBuilder sb = new StringBuilder();
        if (tags != null) {
            for (AlphabetTag tag : tags) {
                if (tag == null) {
                    throw new ConfigurationException("Unsupported alphabet: null");
                }
                sb.append(tag.characters());
            }
        }
        if (sb.length() == 0) {
            throw new ConfigurationException(NO_CHARACTERS_MESSAGE);
        }
        return new CharacterSet(sb.toString());
    }

    /// Resolves symbols like `a-z` or `0-9` and expands them.
    ///
    /// @param symbols alphabet symbols, in order
    /// @return the concatenated character set
    /// @throws ConfigurationException if a symbol is unknown or the result is empty
    public static CharacterSet expandSymbols(String... symbols) {
        return expand(toTags(symbols));
    }

    /// @param symbols alphabet symbols
    /// @return the matching tags, in order
    /// @throws ConfigurationException if a symbol is unknown
    public static List<AlphabetTag> toTags(String... symbols) {
        List<AlphabetTag> tags = new ArrayList<>();
        if (symbols != null) {
            for (String symbol : symbols) {
                tags.add(AlphabetTag.fromSymbol(symbol));
            }
        }
        return tags;
    }
}
