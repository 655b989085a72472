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

import java.util.Arrays;

/// An immutable, ordered sequence of characters eligible for sampling.
///
/// Order only determines which character a sampled index maps to. Characters
/// are not deduplicated: one that occurs twice is drawn twice as often.
public final class CharacterSet {

    private final char[] chars;

    CharacterSet(String characters) {
        this.chars = characters.toCharArray();
    }

    /// @return the number of entries, counting duplicates
    public int length() {
        return chars.length;
    }

    /// @param index position within the set
    /// @return the character at that position
    public char charAt(int index) {
        return chars[index];
    }

    /// @param c the character to look for
    /// @return true if the set holds at least one entry equal to `c`
    public boolean contains(char c) {
        for (char candidate : chars) {
            if (candidate == c) {
                return true;
            }
        }
        return false;
    }

    /// @return a copy of the characters in order
    public char[] chars() {
        return chars.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CharacterSet)) {
            return false;
        }
        return Arrays.equals(chars, ((CharacterSet) o).chars);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(chars);
    }

    @Override
    public String toString() {
        return new String(chars);
    }
}
