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
package com.mediabridge.sync;

import java.util.concurrent.TimeUnit;

/**
 * Cooperative run control shared between a driving caller and a running sync. The engine polls {@link #getState()}
 * between items; callers that want to react faster can block in {@link #awaitChange(RunState, long, TimeUnit)}.
 */
public class RunControl {
    private RunState state = RunState.running;

    public synchronized RunState getState() {
        return state;
    }

    public synchronized void pause() {
        if (state == RunState.running) setState(RunState.paused);
    }

    public synchronized void resume() {
        if (state == RunState.paused) setState(RunState.running);
    }

    public synchronized void cancel() {
        setState(RunState.cancelled);
    }

    public synchronized boolean isCancelled() {
        return state == RunState.cancelled;
    }

    /**
     * Blocks until the state differs from {@code current} or the timeout elapses.
     *
     * @return the state at the time of return
     */
    public synchronized RunState awaitChange(RunState current, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (state == current) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remaining <= 0) break;
            wait(remaining);
        }
        return state;
    }

    private void setState(RunState state) {
        this.state = state;
        notifyAll();
    }
}
