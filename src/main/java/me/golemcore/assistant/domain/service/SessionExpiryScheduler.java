package me.golemcore.assistant.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background sweep that ends idle sessions on a fixed interval
 * ({@code assistant.chat.sweep-interval-seconds}, default 5 minutes).
 *
 * <p>
 * Each tick is isolated: an exception is logged and the next tick still runs.
 */
@Component
@Slf4j
public class SessionExpiryScheduler {

    private final SessionCoordinator sessionCoordinator;
    private final AssistantProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sweepTask;

    public SessionExpiryScheduler(SessionCoordinator sessionCoordinator, AssistantProperties properties) {
        this.sessionCoordinator = sessionCoordinator;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        long intervalSeconds = Math.max(1, properties.getChat().getSweepIntervalSeconds());
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-expiry-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepTask = scheduler.scheduleAtFixedRate(this::tick, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("[SessionSweep] Started with interval: {}s, timeout: {} min",
                intervalSeconds, properties.getChat().getSessionTimeoutMinutes());
    }

    @PreDestroy
    public void shutdown() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[SessionSweep] Stopped");
    }

    void tick() {
        try {
            int expired = sessionCoordinator.sweepExpired();
            if (expired > 0) {
                log.info("[SessionSweep] Expired {} idle session(s)", expired);
            }
        } catch (Exception e) {
            // a thrown exception would cancel the periodic task
            log.error("[SessionSweep] Sweep failed", e);
        }
    }
}
