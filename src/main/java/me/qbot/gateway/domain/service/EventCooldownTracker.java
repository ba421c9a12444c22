package me.qbot.gateway.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.qbot.gateway.domain.model.ResolutionContext;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Cooldown-gated probabilistic trigger for random events.
 *
 * <p>
 * A non-negative personal interval gates the event per {@code (event, user)}.
 * An interval of {@code -1} in a group hands gating to the shared per
 * {@code (event, group)} interval when that is positive. A blocked gate returns
 * without drawing; otherwise one draw decides, and only the evaluated gate is
 * stamped when the event fires. Check, draw and stamp happen under one
 * monitor.
 *
 * <p>
 * Stamps older than the longest interval seen so far can no longer block
 * anything and are swept at most once per {@link #SWEEP_INTERVAL}.
 */
@Service
@Slf4j
public class EventCooldownTracker {

    public static final int SHARED_COOLDOWN = -1;

    static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final Clock clock;
    private final RandomSource randomSource;

    private final Map<PersonalKey, Instant> lastPersonal = new HashMap<>();
    private final Map<SharedKey, Instant> lastShared = new HashMap<>();
    private long longestIntervalSec;
    private Instant lastSweep;

    public EventCooldownTracker(Clock clock, RandomSource randomSource) {
        this.clock = clock;
        this.randomSource = randomSource;
    }

    public synchronized boolean tryTrigger(String eventId, ResolutionContext context, double probability,
            long personalIntervalSec, long sharedIntervalSec) {
        Instant now = clock.instant();
        longestIntervalSec = Math.max(longestIntervalSec, Math.max(personalIntervalSec, sharedIntervalSec));
        evictExpired(now);
        PersonalKey personalKey = null;
        SharedKey sharedKey = null;

        if (personalIntervalSec >= 0) {
            personalKey = new PersonalKey(eventId, context.userId());
            if (!elapsed(lastPersonal.get(personalKey), now, personalIntervalSec)) {
                log.debug("[Events] '{}' personal cooldown active for {}", eventId, context.userId());
                return false;
            }
        } else if (personalIntervalSec == SHARED_COOLDOWN && context.isGroup() && sharedIntervalSec > 0) {
            sharedKey = new SharedKey(eventId, context.groupId());
            if (!elapsed(lastShared.get(sharedKey), now, sharedIntervalSec)) {
                log.debug("[Events] '{}' shared cooldown active in group {}", eventId, context.groupId());
                return false;
            }
        }

        double draw = randomSource.nextDouble();
        if (draw >= probability) {
            return false;
        }
        if (personalKey != null) {
            lastPersonal.put(personalKey, now);
        } else if (sharedKey != null) {
            lastShared.put(sharedKey, now);
        }
        log.debug("[Events] '{}' fired for {} (draw {} < {})", eventId, context.describe(), draw, probability);
        return true;
    }

    public synchronized Instant lastPersonalTrigger(String eventId, String userId) {
        return lastPersonal.get(new PersonalKey(eventId, userId));
    }

    public synchronized Instant lastSharedTrigger(String eventId, String groupId) {
        return lastShared.get(new SharedKey(eventId, groupId));
    }

    public synchronized void reset() {
        lastPersonal.clear();
        lastShared.clear();
    }

    private void evictExpired(Instant now) {
        if (lastSweep != null && Duration.between(lastSweep, now).compareTo(SWEEP_INTERVAL) < 0) {
            return;
        }
        lastSweep = now;
        int before = lastPersonal.size() + lastShared.size();
        lastPersonal.values().removeIf(stamp -> elapsed(stamp, now, longestIntervalSec));
        lastShared.values().removeIf(stamp -> elapsed(stamp, now, longestIntervalSec));
        int evicted = before - lastPersonal.size() - lastShared.size();
        if (evicted > 0) {
            log.debug("[Events] Evicted {} expired cooldown stamps", evicted);
        }
    }

    private static boolean elapsed(Instant last, Instant now, long intervalSec) {
        return last == null || Duration.between(last, now).getSeconds() >= intervalSec;
    }

    private record PersonalKey(String eventId, String userId) {
    }

    private record SharedKey(String eventId, String groupId) {
    }
}
