package me.qbot.gateway.ratelimit;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.qbot.gateway.domain.model.RateLimitResult;
import me.qbot.gateway.domain.model.WindowState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory {@link RateLimiter} keeping one {@link HourlyWindow} per scope key.
 * Windows are not persisted; a restart starts every scope with a fresh
 * budget.
 *
 * <p>
 * A check consumes inside {@link ConcurrentHashMap#compute}, so it is atomic
 * per key against other checks and against eviction. The first check of a new
 * hour evicts every window left in an older bucket.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HourlyBucketRateLimiter implements RateLimiter {

    private final Clock clock;

    private final Map<String, HourlyWindow> windows = new ConcurrentHashMap<>();
    private final AtomicLong sweptBucket = new AtomicLong(Long.MIN_VALUE);

    @Override
    public RateLimitResult check(String scopeKey, int limitPerHour) {
        if (limitPerHour <= 0) {
            return RateLimitResult.unlimited();
        }
        Instant now = clock.instant();
        long bucket = HourlyWindow.bucketOf(now);
        evictExpired(bucket);
        RateLimitResult[] outcome = new RateLimitResult[1];
        windows.compute(scopeKey, (key, existing) -> {
            HourlyWindow window = existing != null ? existing : new HourlyWindow(bucket);
            outcome[0] = window.tryConsume(now, limitPerHour);
            return window;
        });
        RateLimitResult result = outcome[0];
        if (!result.isAllowed()) {
            log.debug("[RateLimit] {} exceeded {} messages/hour, resets at {}", scopeKey, limitPerHour,
                    result.getResetAt());
        }
        return result;
    }

    @Override
    public WindowState getWindowState(String scopeKey) {
        HourlyWindow window = windows.get(scopeKey);
        if (window == null) {
            return null;
        }
        return window.getState(scopeKey, clock.instant());
    }

    private void evictExpired(long currentBucket) {
        long swept = sweptBucket.get();
        if (currentBucket <= swept || !sweptBucket.compareAndSet(swept, currentBucket)) {
            return;
        }
        int before = windows.size();
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) -> window.isBefore(currentBucket) ? null : window);
        }
        if (before > windows.size()) {
            log.debug("[RateLimit] Evicted {} windows older than bucket {}", before - windows.size(), currentBucket);
        }
    }

    @Override
    public void reset() {
        int cleared = windows.size();
        windows.clear();
        log.info("[RateLimit] Cleared {} windows", cleared);
    }
}
