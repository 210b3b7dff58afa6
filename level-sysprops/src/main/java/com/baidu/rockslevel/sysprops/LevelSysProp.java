/*
 * Copyright (c) 2023. The BifroMQ Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *    http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */

package com.baidu.rockslevel.sysprops;

import com.baidu.rockslevel.sysprops.parser.PropParser;
import lombok.extern.slf4j.Slf4j;

/**
 * The base class for the tunables of RocksLevel which are resolved from system properties.
 *
 * @param <T> the value type of the system property after parsing
 * @param <P> the parser type for the system property
 */
@Slf4j
public abstract class LevelSysProp<T, P extends PropParser<T>> {
    private final String propKey;
    private final P parser;
    private final T defaultValue;
    private T currentValue;

    protected LevelSysProp(String propKey, T defaultValue, P parser) {
        this.propKey = propKey;
        this.defaultValue = defaultValue;
        this.parser = parser;
        resolve();
    }

    private String sysPropValue(final String key) {
        String value = null;
        try {
            value = System.getProperty(key);
        } catch (SecurityException e) {
            log.warn("Failed to retrieve a system property '{}'", key, e);
        }
        return value;
    }

    /**
     * Re-read the system property, falling back to the default value if it's absent or malformed.
     */
    public final synchronized void resolve() {
        String value = sysPropValue(propKey);
        if (value == null || value.isBlank()) {
            currentValue = defaultValue;
            return;
        }
        value = value.trim();
        try {
            currentValue = parser.parse(value);
        } catch (Throwable e) {
            log.warn("Failed to parse system prop '{}':{} - using the default value: {}", propKey, value, defaultValue);
            currentValue = defaultValue;
        }
    }

    public final String propKey() {
        return propKey;
    }

    public final T defaultValue() {
        return defaultValue;
    }

    public final synchronized T get() {
        return currentValue;
    }
}
