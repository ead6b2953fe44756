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
package com.mediabridge.sync.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size pool with named daemon threads that keeps its own count of active and unfinished tasks.
 */
public class EnhancedThreadPoolExecutor extends ThreadPoolExecutor {
    private static final Logger log = LoggerFactory.getLogger(EnhancedThreadPoolExecutor.class);

    public static final String DEFAULT_POOL_NAME = "x-pool";

    private final AtomicLong unfinishedTasks = new AtomicLong();
    private final AtomicInteger activeTasks = new AtomicInteger();
    private final String poolName;

    public EnhancedThreadPoolExecutor(int poolSize, String poolName) {
        this(poolSize, new LinkedBlockingQueue<>(), poolName);
    }

    public EnhancedThreadPoolExecutor(int poolSize, BlockingQueue<Runnable> workQueue, String poolName) {
        super(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS, workQueue, new NamedThreadFactory(poolName));
        this.poolName = poolName == null ? DEFAULT_POOL_NAME : poolName;
    }

    @Override
    protected void beforeExecute(Thread t, Runnable r) {
        activeTasks.incrementAndGet();
        super.beforeExecute(t, r);
    }

    @Override
    protected void afterExecute(Runnable r, Throwable t) {
        activeTasks.decrementAndGet();
        unfinishedTasks.decrementAndGet();
        super.afterExecute(r, t);
    }

    @Override
    public Future<?> submit(Runnable task) {
        unfinishedTasks.incrementAndGet();
        try {
            return super.submit(task);
        } catch (RuntimeException e) {
            unfinishedTasks.decrementAndGet();
            throw e;
        }
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        unfinishedTasks.incrementAndGet();
        try {
            return super.submit(task);
        } catch (RuntimeException e) {
            unfinishedTasks.decrementAndGet();
            throw e;
        }
    }

    /**
     * Stops accepting work and waits for queued tasks to finish. Interrupts whatever is still running after the
     * timeout.
     */
    public void shutdownAndWait(long timeout, TimeUnit unit) {
        shutdown();
        try {
            if (!awaitTermination(timeout, unit)) {
                log.warn("{} did not finish within {} {}; interrupting {} active task(s)",
                        poolName, timeout, unit, getActiveCount());
                shutdownNow();
            }
        } catch (InterruptedException e) {
            shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public int getActiveCount() {
        return activeTasks.get();
    }

    public long getUnfinishedTasks() {
        return unfinishedTasks.get();
    }

    public String getPoolName() {
        return poolName;
    }

    static class ExceptionHandler implements Thread.UncaughtExceptionHandler {
        private final Thread.UncaughtExceptionHandler handler;

        ExceptionHandler(Thread.UncaughtExceptionHandler handler) {
            this.handler = handler;
        }

        @Override
        public void uncaughtException(Thread t, Throwable e) {
            log.warn("uncaught exception from task", e);
            if (handler != null) handler.uncaughtException(t, e);
        }
    }

    public static class NamedThreadFactory implements ThreadFactory {
        private static final AtomicInteger poolNumber = new AtomicInteger();
        private final AtomicInteger threadNumber = new AtomicInteger();
        private final String threadPrefix;

        public NamedThreadFactory(String poolName) {
            if (poolName == null) {
                this.threadPrefix = DEFAULT_POOL_NAME + "-" + poolNumber.incrementAndGet() + "-t-";
            } else {
                this.threadPrefix = poolName + "-t-";
            }
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, threadPrefix + threadNumber.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(new ExceptionHandler(t.getUncaughtExceptionHandler()));
            return t;
        }
    }
}
