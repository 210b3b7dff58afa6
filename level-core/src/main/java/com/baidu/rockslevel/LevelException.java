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

/**
 * Failures raised by the façade itself. Engine failures are surfaced as they are and never wrapped into this type.
 */
public abstract class LevelException extends RuntimeException {
    public final Code code;

    protected LevelException(Code code, String message) {
        super(message);
        this.code = code;
    }

    public static LevelException invalidArgument(String message) {
        return new InvalidArgumentException(message);
    }

    public static LevelException notOpen() {
        return new InvalidStateException("Database is not open");
    }

    public static LevelException invalidState(String message) {
        return new InvalidStateException(message);
    }

    public static LevelException protocolViolation(long expectedSequence, long actualSequence) {
        return new ProtocolViolationException(
            "Update feed gap: expected sequence " + expectedSequence + " but got " + actualSequence);
    }

    public enum Code {
        InvalidArgument,
        InvalidState,
        ProtocolViolation
    }

    public static class InvalidArgumentException extends LevelException {
        private InvalidArgumentException(String message) {
            super(Code.InvalidArgument, message);
        }
    }

    public static class InvalidStateException extends LevelException {
        private InvalidStateException(String message) {
            super(Code.InvalidState, message);
        }
    }

    public static class ProtocolViolationException extends LevelException {
        private ProtocolViolationException(String message) {
            super(Code.ProtocolViolation, message);
        }
    }
}
