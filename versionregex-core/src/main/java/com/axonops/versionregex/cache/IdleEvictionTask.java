/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.versionregex.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daemon thread that periodically evicts idle entries from a {@link VersionPatternCache}.
 *
 * @since 1.0.0
 */
final class IdleEvictionTask {
    private static final Logger logger = LoggerFactory.getLogger(IdleEvictionTask.class);

    private final VersionPatternCache cache;
    private final VersionRegexConfig config;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    IdleEvictionTask(VersionPatternCache cache, VersionRegexConfig config) {
        this.cache = cache;
        this.config = config;
    }

    void start() {
        if (running.compareAndSet(false, true)) {
            thread = new Thread(this::run, "VersionRegex-IdleEviction");
            thread.setDaemon(true);
            thread.setPriority(Thread.MIN_PRIORITY);
            thread.start();

            logger.info("VersionRegex: Idle eviction thread started - interval: {}s",
                config.evictionScanIntervalSeconds());
        }
    }

    /**
     * Stops the thread and waits up to 5 seconds for it to exit.
     */
    void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("VersionRegex: Stopping idle eviction thread");

            Thread t = thread;
            if (t != null) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            logger.info("VersionRegex: Idle eviction thread stopped");
        }
    }

    private void run() {
        logger.debug("VersionRegex: Idle eviction thread running");

        long intervalMs = config.evictionScanIntervalSeconds() * 1000;

        while (running.get()) {
            try {
                Thread.sleep(intervalMs);

                int evicted = cache.evictIdlePatterns();
                logger.debug("VersionRegex: Idle eviction scan complete - evicted: {}", evicted);

            } catch (InterruptedException e) {
                logger.debug("VersionRegex: Idle eviction thread interrupted");
                break;
            } catch (RuntimeException e) {
                // Keep the thread alive; the next scan retries
                logger.error("VersionRegex: Error in idle eviction thread", e);
            }
        }

        logger.debug("VersionRegex: Idle eviction thread exiting");
    }

    boolean isRunning() {
        return running.get() && thread != null && thread.isAlive();
    }
}
