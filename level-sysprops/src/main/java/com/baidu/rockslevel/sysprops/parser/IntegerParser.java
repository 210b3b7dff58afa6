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

package com.baidu.rockslevel.sysprops.parser;

/**
 * Parses a decimal int and checks it against {@code [min, maxExclusive)}.
 */
public final class IntegerParser implements PropParser<Integer> {
    public static final IntegerParser POSITIVE = new IntegerParser(1, Integer.MAX_VALUE);

    private final int min;
    private final int maxExclusive;

    private IntegerParser(int min, int maxExclusive) {
        this.min = min;
        this.maxExclusive = maxExclusive;
    }

    public static IntegerParser between(int min, int maxExclusive) {
        if (min >= maxExclusive) {
            throw new IllegalArgumentException("Empty range [" + min + "," + maxExclusive + ")");
        }
        return new IntegerParser(min, maxExclusive);
    }

    @Override
    public Integer parse(String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new SysPropParseException("Not an integer: " + value, e);
        }
        if (parsed < min || parsed >= maxExclusive) {
            throw new SysPropParseException(
                String.format("Value %d is outside [%d,%d)", parsed, min, maxExclusive));
        }
        return parsed;
    }
}
