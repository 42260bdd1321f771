////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.groovystyle;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pools shared by the language server and the batch runner.
 *
 * <ul>
 *   <li><b>Scheduling pool</b>: single daemon thread for {@code didChange}
 *       debounce timers. Scheduled tasks run the lint directly since a
 *       single-file check is cheap.</li>
 *   <li><b>Check pool</b>: fixed-size pool sized to the available
 *       processors, used to check files in parallel in batch mode.</li>
 * </ul>
 *
 * <p>All threads are daemon threads. Call {@link #shutdownAll()} when done.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ScheduledExecutorService schedulingPool;
    private final ExecutorService checkPool;

    public ExecutorPools() {
        this(Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    public ExecutorPools(int checkThreads) {
        this.schedulingPool = Executors.newSingleThreadScheduledExecutor(daemonThreads("groovy-style-scheduler"));
        this.checkPool = Executors.newFixedThreadPool(Math.max(1, checkThreads), daemonThreads("groovy-style-check"));
        logger.debug("Check pool threads: {}", Math.max(1, checkThreads));
    }

    /** Scheduled executor for debounce timers. */
    public ScheduledExecutorService getSchedulingPool() {
        return schedulingPool;
    }

    /** Pool for checking files in parallel. */
    public ExecutorService getCheckPool() {
        return checkPool;
    }

    /**
     * Shut down all pools, waiting up to 5 seconds for running tasks.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        schedulingPool.shutdownNow();
        checkPool.shutdownNow();
        try {
            schedulingPool.awaitTermination(5, TimeUnit.SECONDS);
            checkPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
