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

import me.qbot.gateway.domain.model.RateLimitResult;
import me.qbot.gateway.domain.model.WindowState;

import java.time.Instant;

/**
 * Fixed one-hour window. The counter belongs to the bucket
 * {@code floor(epochSecond / 3600)} and restarts lazily when a check sees a
 * newer bucket.
 *
 * <p>
 * Methods are synchronized so a check and its increment are one step.
 */
public class HourlyWindow {

    static final long BUCKET_SECONDS = 3600;

    private long bucketId;
    private int count;

    public HourlyWindow(long bucketId) {
        this.bucketId = bucketId;
    }

    public static long bucketOf(Instant now) {
        return Math.floorDiv(now.getEpochSecond(), BUCKET_SECONDS);
    }

    public static Instant bucketEnd(long bucketId) {
        return Instant.ofEpochSecond((bucketId + 1) * BUCKET_SECONDS);
    }

    public synchronized RateLimitResult tryConsume(Instant now, int limitPerHour) {
        roll(now);
        Instant resetAt = bucketEnd(bucketId);
        if (count >= limitPerHour) {
            return RateLimitResult.denied(resetAt,
                    "Hourly limit of " + limitPerHour + " messages reached");
        }
        count++;
        return RateLimitResult.allowed(limitPerHour - count, resetAt);
    }

    public synchronized boolean isBefore(long currentBucketId) {
        return bucketId < currentBucketId;
    }

    public synchronized WindowState getState(String scopeKey, Instant now) {
        roll(now);
        return WindowState.builder()
                .scopeKey(scopeKey)
                .bucketId(bucketId)
                .count(count)
                .resetAt(bucketEnd(bucketId))
                .build();
    }

    private void roll(Instant now) {
        long current = bucketOf(now);
        if (current > bucketId) {
            bucketId = current;
            count = 0;
        }
    }
}
