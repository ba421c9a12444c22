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

/**
 * Hourly message budget per scope.
 *
 * <p>
 * Each scope key ({@code group:<userId>} or {@code private:<userId>}, see
 * {@link RateLimitScope}) owns a fixed window
 * aligned to the hour. A check admits the message while fewer than
 * {@code limitPerHour} messages were admitted in the current window and counts
 * it; a denied check is not counted.
 *
 * @see HourlyBucketRateLimiter
 */
public interface RateLimiter {

    /**
     * Check and count one message.
     *
     * @param limitPerHour
     *            hourly budget; zero or negative means unlimited
     */
    RateLimitResult check(String scopeKey, int limitPerHour);

    /**
     * Get current window state, or {@code null} if the scope has not sent a
     * message yet.
     */
    WindowState getWindowState(String scopeKey);

    /**
     * Forget all windows.
     */
    void reset();
}
