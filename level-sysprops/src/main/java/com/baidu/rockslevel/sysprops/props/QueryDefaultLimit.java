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

package com.baidu.rockslevel.sysprops.props;

import com.baidu.rockslevel.sysprops.LevelSysProp;
import com.baidu.rockslevel.sysprops.parser.IntegerParser;

/**
 * The number of rows a snapshot query returns when the caller doesn't specify a limit.
 */
public final class QueryDefaultLimit extends LevelSysProp<Integer, IntegerParser> {
    public static final QueryDefaultLimit INSTANCE = new QueryDefaultLimit();

    private QueryDefaultLimit() {
        super("rockslevel_query_default_limit", 1000, IntegerParser.POSITIVE);
    }
}
