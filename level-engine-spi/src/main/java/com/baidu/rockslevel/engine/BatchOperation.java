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

package com.baidu.rockslevel.engine;

import com.google.protobuf.ByteString;
import javax.annotation.Nullable;

/**
 * An operation of an atomic batch.
 */
public record BatchOperation(Type type, ByteString key, @Nullable ByteString value, @Nullable String column) {
    public enum Type {
        PUT,
        DELETE
    }

    public static BatchOperation put(ByteString key, ByteString value) {
        return new BatchOperation(Type.PUT, key, value, null);
    }

    public static BatchOperation put(ByteString key, ByteString value, String column) {
        return new BatchOperation(Type.PUT, key, value, column);
    }

    public static BatchOperation delete(ByteString key) {
        return new BatchOperation(Type.DELETE, key, null, null);
    }

    public static BatchOperation delete(ByteString key, String column) {
        return new BatchOperation(Type.DELETE, key, null, column);
    }
}
