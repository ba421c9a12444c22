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

import me.qbot.gateway.domain.model.ResolutionContext;

/**
 * Rate limit key of a sender per channel type. A sender shares one budget
 * across all groups.
 */
public record RateLimitScope(String channel, String userId) {

    public static RateLimitScope of(ResolutionContext context) {
        return new RateLimitScope(context.channelType().getToken(), context.userId());
    }

    public String key() {
        return channel + ":" + userId;
    }
}
