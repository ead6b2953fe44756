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
package com.mediabridge.sync.remote;

/**
 * A failed call to the remote store. {@link #getStatus()} is the HTTP status, or 0 when no response was received.
 */
public class RemoteStoreException extends RuntimeException {
    public static final int MAX_BODY_LENGTH = 2000;

    private final int status;
    private final String body;

    public RemoteStoreException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.body = null;
    }

    public RemoteStoreException(String operation, int status, String body) {
        super(operation + " failed: HTTP " + status + (body == null || body.isEmpty() ? "" : " " + truncate(body)));
        this.status = status;
        this.body = truncate(body);
    }

    private static String truncate(String body) {
        if (body == null || body.length() <= MAX_BODY_LENGTH) return body;
        return body.substring(0, MAX_BODY_LENGTH);
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
