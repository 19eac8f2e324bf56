/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
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

package com.phonepe.tutorai.core.session;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes idle sessions from stores that cannot expire them on their own
 */
@Slf4j
public class SessionSweeper implements AutoCloseable {
    public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);

    private final SessionManager sessionManager;
    private final Duration interval;
    private final ScheduledExecutorService executorService;
    private ScheduledFuture<?> task;

    @Builder
    public SessionSweeper(@NonNull SessionManager sessionManager,
                          Duration interval,
                          ScheduledExecutorService executorService) {
        this.sessionManager = sessionManager;
        this.interval = Objects.requireNonNullElse(interval, DEFAULT_INTERVAL);
        Preconditions.checkArgument(!this.interval.isNegative() && !this.interval.isZero(),
                                    "Sweep interval must be positive");
        this.executorService = Objects.requireNonNullElseGet(
                executorService,
                () -> Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                         .setNameFormat("session-sweeper-%d")
                                                                         .setDaemon(true)
                                                                         .build()));
    }

    public synchronized SessionSweeper start() {
        Preconditions.checkState(task == null, "Sweeper already started");
        task = executorService.scheduleWithFixedDelay(this::sweep,
                                                      interval.toMillis(),
                                                      interval.toMillis(),
                                                      TimeUnit.MILLISECONDS);
        log.info("Session sweeper started with interval {}", interval);
        return this;
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        executorService.shutdownNow();
        log.info("Session sweeper stopped");
    }

    void sweep() {
        try {
            sessionManager.sweepExpired();
        }
        catch (RuntimeException e) {
            // An exception escaping here would cancel all further runs
            log.error("Error sweeping expired sessions: {}", e.getMessage(), e);
        }
    }
}
