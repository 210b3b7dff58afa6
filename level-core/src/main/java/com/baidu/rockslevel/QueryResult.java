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

package com.baidu.rockslevel;

import com.baidu.rockslevel.engine.KeyValue;
import java.util.List;

/**
 * One page of a range query.
 *
 * @param rows     the rows of the page
 * @param sequence the sequence number of the view the page was read from
 * @param finished true if the range holds no row past this page
 */
public record QueryResult(List<KeyValue> rows, long sequence, boolean finished) {
}
