/**
 * Copyright Pravega Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.prioq.common.util;

/**
 * Exception that is thrown whenever a Property value cannot be converted to the Property's type, or is out of range.
 */
public class InvalidPropertyValueException extends ConfigurationException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new instance of the InvalidPropertyValueException class.
     *
     * @param fullPropertyName The full name (namespace + property) of the property.
     * @param actualValue      The value that was about to be processed.
     * @param reason           Why the value was rejected.
     */
    public InvalidPropertyValueException(String fullPropertyName, String actualValue, String reason) {
        super(String.format("Value '%s' is invalid for property '%s': %s", actualValue, fullPropertyName, reason));
    }

    /**
     * Creates a new instance of the InvalidPropertyValueException class.
     *
     * @param fullPropertyName The full name (namespace + property) of the property.
     * @param actualValue      The value that was about to be processed.
     * @param cause            The causing Exception for this.
     */
    public InvalidPropertyValueException(String fullPropertyName, String actualValue, Throwable cause) {
        super(String.format("Value '%s' is invalid for property '%s'.", actualValue, fullPropertyName), cause);
    }
}
