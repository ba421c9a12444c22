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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.qbot.gateway.domain.model.ConfigDocument.RandomEventConfig;
import me.qbot.gateway.domain.model.ConfigKeys;
import me.qbot.gateway.domain.model.ResolutionContext;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fires configured random events. Parameters come from the resolver, so group
 * and role overrides of {@code random_events.<id>.*} apply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RandomEventService {

    private final ConfigStore configStore;
    private final ConfigResolver configResolver;
    private final PermissionRegistry permissionRegistry;
    private final EventCooldownTracker cooldownTracker;

    /**
     * @return true if the event fires for this message
     */
    public boolean tryFire(String eventId, ResolutionContext context) {
        if (!configResolver.resolveBoolean(ConfigKeys.ENABLE_RANDOM_EVENTS, context)) {
            return false;
        }
        if (permissionRegistry.isBlacklisted(context.userId(), context.groupId())) {
            return false;
        }
        RandomEventConfig event = configResolver.resolveEvent(eventId, context);
        if (!Boolean.TRUE.equals(event.getEnabled())) {
            return false;
        }
        boolean fired = cooldownTracker.tryTrigger(eventId, context, event.getProbability(),
                event.getMinInterval(), event.getSharedMinInterval());
        if (fired) {
            log.info("[Events] Event '{}' fired for {}", eventId, context.describe());
        }
        return fired;
    }

    /**
     * Event ids declared under the top-level {@code random_events} section.
     */
    public List<String> registeredEvents() {
        return configStore.read(doc -> new ArrayList<>(doc.getRandomEvents().keySet()));
    }
}
