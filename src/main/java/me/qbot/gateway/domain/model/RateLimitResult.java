package me.qbot.gateway.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Result of an hourly rate limit check.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the message was admitted</li>
 * <li>{@code remaining} - messages left in the current hour bucket</li>
 * <li>{@code resetAt} - start of the next bucket, {@code null} when
 * unlimited</li>
 * <li>{@code reason} - explanation for denial</li>
 * </ul>
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private long remaining;
    private Instant resetAt;
    private String reason;

    public static RateLimitResult allowed(long remaining, Instant resetAt) {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(remaining)
                .resetAt(resetAt)
                .build();
    }

    public static RateLimitResult denied(Instant resetAt, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .remaining(0)
                .resetAt(resetAt)
                .reason(reason)
                .build();
    }

    public static RateLimitResult unlimited() {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(Long.MAX_VALUE)
                .build();
    }
}
