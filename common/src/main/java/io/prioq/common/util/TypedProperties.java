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

import com.google.common.base.Preconditions;
import io.prioq.common.Exceptions;
import java.util.Properties;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Wrapper for a java.util.Properties object, that sections it based on a namespace. Each property in the wrapped object
 * is prefixed by the namespace.
 * <p>
 * Example:
 * <ul>
 * <li>priorityqueue.initialCapacity=64
 * <li>priorityqueue.reuseSortedSnapshots=false
 * <li>other.initialCapacity=8
 * </ul>
 * Namespace "priorityqueue" sees (initialCapacity=64, reuseSortedSnapshots=false); "other" sees (initialCapacity=8).
 */
@Slf4j
public class TypedProperties {
    private static final String SEPARATOR = ".";

    private final String keyPrefix;
    private final Properties properties;

    /**
     * Creates a new instance of the TypedProperties class.
     *
     * @param properties The java.util.Properties to wrap.
     * @param namespace  The namespace of this instance.
     */
    public TypedProperties(Properties properties, String namespace) {
        Preconditions.checkNotNull(properties, "properties");
        Exceptions.checkNotNullOrEmpty(namespace, "namespace");
        this.properties = properties;
        this.keyPrefix = namespace + SEPARATOR;
    }

    //region Getters

    /**
     * Gets the value of a String property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws MissingPropertyException If the property is not set and has no default value.
     */
    public String get(Property<String> property) throws ConfigurationException {
        return tryGet(property, s -> s);
    }

    /**
     * Gets the value of an Integer property.
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException If the property is not set and has no default value, or if its value cannot be
     *                                parsed as an Integer.
     */
    public int getInt(Property<Integer> property) throws ConfigurationException {
        return tryGet(property, Integer::parseInt);
    }

    /**
     * Gets the value of an Integer property only if it is non-negative (greater than or equal to 0).
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException If the property is not set and has no default value, or if its value is not a
     *                                non-negative Integer.
     */
    public int getNonNegativeInt(Property<Integer> property) throws ConfigurationException {
        int value = getInt(property);
        if (value < 0) {
            throw new InvalidPropertyValueException(this.keyPrefix + property.getName(), Integer.toString(value),
                    "must be a non-negative integer");
        }

        return value;
    }

    /**
     * Gets the value of a boolean property.
     * Notes:
     * <ul>
     * <li> "true", "yes" and "1" (case insensitive) map to boolean "true".
     * <li> "false", "no" and "0" (case insensitive) map to boolean "false".
     * </ul>
     *
     * @param property The Property to get.
     * @return The property value or default value, if no such is defined in the base Properties.
     * @throws ConfigurationException If the property is not set and has no default value, or if its value cannot be
     *                                interpreted as a Boolean.
     */
    public boolean getBoolean(Property<Boolean> property) throws ConfigurationException {
        return tryGet(property, this::parseBoolean);
    }

    private <T> T tryGet(Property<T> property, Function<String, T> converter) {
        String fullName = this.keyPrefix + property.getName();
        String propValue = this.properties.getProperty(fullName, null);
        if (propValue == null) {
            if (property.hasDefaultValue()) {
                log.debug("Property '{}' not set; using default value '{}'.", fullName, property.getDefaultValue());
                return property.getDefaultValue();
            } else {
                throw new MissingPropertyException(fullName);
            }
        }

        try {
            return converter.apply(propValue.trim());
        } catch (IllegalArgumentException ex) {
            throw new InvalidPropertyValueException(fullName, propValue, ex);
        }
    }

    private boolean parseBoolean(String value) {
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("yes") || value.equals("1")) {
            return true;
        } else if (value.equalsIgnoreCase("false") || value.equalsIgnoreCase("no") || value.equals("0")) {
            return false;
        } else {
            throw new IllegalArgumentException(String.format("String '%s' cannot be interpreted as a valid Boolean.", value));
        }
    }

    //endregion
}
