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

/**
 * Conversational scope an inbound message arrives in.
 */
public enum ChannelType {

    GROUP("group"), PRIVATE("private");

    private final String token;

    ChannelType(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static ChannelType fromToken(String token) {
        for (ChannelType type : values()) {
            if (type.token.equalsIgnoreCase(token) || type.name().equalsIgnoreCase(token)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown channel type: " + token);
    }
}
