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

import java.util.Locale;

/**
 * Selects which role block of a scope node applies to a user: {@code user},
 * {@code manager} or {@code blacklisted}.
 */
public enum RoleType {

    USER("user"), MANAGER("manager"), BLACKLISTED("blacklisted");

    private final String token;

    RoleType(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static RoleType fromToken(String token) {
        if (token != null) {
            String normalized = token.trim().toLowerCase(Locale.ROOT);
            for (RoleType type : values()) {
                if (type.token.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown role block '" + token + "'. Valid: user, manager, blacklisted");
    }

    public static boolean isToken(String token) {
        for (RoleType type : values()) {
            if (type.token.equals(token)) {
                return true;
            }
        }
        return false;
    }
}
