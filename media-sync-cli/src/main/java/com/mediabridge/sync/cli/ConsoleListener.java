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
package com.mediabridge.sync.cli;

import com.mediabridge.sync.event.SyncEvent;
import com.mediabridge.sync.event.SyncListener;

import java.io.PrintStream;

/**
 * Prints progress events as plain lines. Download progress is only shown in whole steps of 25% so that large exports
 * do not flood the console; errors go to the error stream.
 */
public class ConsoleListener implements SyncListener {
    private final PrintStream out;
    private final PrintStream err;
    private String lastDownload;
    private int lastQuarter;

    public ConsoleListener() {
        this(System.out, System.err);
    }

    public ConsoleListener(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public synchronized void onEvent(SyncEvent event) {
        if (event.getType() == SyncEvent.Type.Downloading) {
            int quarter = (int) Math.floor(event.getProgress() * 4);
            if (event.getSubject().equals(lastDownload) && quarter <= lastQuarter) return;
            lastDownload = event.getSubject();
            lastQuarter = quarter;
            if (quarter == 0) return;
        }
        if (event.isError()) err.println(event);
        else out.println(event);
    }
}
