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

/// Thrown when a generation request carries an invalid argument.
public class ValidationException extends RandomStringException {

    private final long rejectedValue;

    public ValidationException(String message, long rejectedValue) {
        super(message);
        this.rejectedValue = rejectedValue;
    }

    /// @return the argument value that failed validation
    public long getRejectedValue() {
        return rejectedValue;
    }
}
