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

import java.util.Locale;

/// Symbolic character classes which can be composed into a [CharacterSet].
///
/// | Tag | Symbol | Characters |
/// |-----|--------|------------|
/// | LOWERCASE | `a-z` | 26 |
/// | UPPERCASE | `A-Z` | 26 |
/// | DIGITS | `0-9` | 10 |
/// | DASH_UNDERSCORE | `-_` | 2 |
public enum AlphabetTag {

    LOWERCASE("a-z", "abcdefghijklmnopqrstuvwxyz"),
    UPPERCASE("A-Z", "ABCDEFGHIJKLMNOPQRSTUVWXYZ"),
    DIGITS("0-9", "0123456789"),
    DASH_UNDERSCORE("-_", "-_");

    private final String symbol;
    private final String characters;

    AlphabetTag(String symbol, String characters) {
        this.symbol = symbol;
        this.characters = characters;
    }

    /// @return the short symbol for this tag, like `a-z`
    public String symbol() {
        return symbol;
    }

    /// @return the characters this tag expands to, in order
    public String characters() {
        return characters;
    }

    /// Looks up a tag by its symbol (`a-z`, `A-Z`, `0-9`, `-_`) or by its
    /// enum name, ignoring case for the name.
    ///
    /// @param symbol the symbol or name to look up
    /// @return the matching tag
    /// @throws ConfigurationException if nothing matches
    public static AlphabetTag fromSymbol(String symbol) {
        if (symbol == null) {
            throw new ConfigurationException("Unsupported alphabet: null");
        }
        String trimmed = symbol.trim();
        for (AlphabetTag tag : values()) {
            if (tag.symbol.equals(trimmed)) {
                return tag;
            }
        }
        String upper = trimmed.toUpperCase(Locale.ROOT);
        for (AlphabetTag tag : values()) {
            if (tag.name().equals(upper)) {
                return tag;
            }
        }
        throw new ConfigurationException("Unsupported alphabet: " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
