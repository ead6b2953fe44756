/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.mediabridge.sync.source;

/**
 * Failure to materialize a variant. The {@link Type} decides whether the retry controller tries again.
 */
public class ExportException extends Exception {
    public enum Type {
        /**
         * the item is still being pulled from a slow or cold remote source
         */
        SlowFetchFailed(true),
        Timeout(true),
        /**
         * missing, corrupt or unauthorized source item
         */
        Unavailable(false),
        /**
         * stopped by the user
         */
        Cancelled(false),
        Failed(false);

        private final boolean retryable;

        Type(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Type type;

    public ExportException(Type type, String message) {
        super(message);
        this.type = type;
    }

    public ExportException(Type type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public Type getType() {
        return type;
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }

    @Override
    public String toString() {
        return getType() + ": " + getMessage();
    }
}
