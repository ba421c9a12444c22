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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import me.qbot.gateway.domain.exception.InvalidRoleException;

import java.util.Locale;

/**
 * Closed set of permission roles a user can hold. Per-group blacklisting is
 * not a role; it is the {@code blacklisted_in} relation of a
 * {@link ConfigDocument.PermissionEntry}.
 */
public enum Role {

    ADMIN("admin"), GROUP_MANAGER("group_manager"), PRIVATE_USER("private_user"), GLOBAL_BLACKLISTED(
            "global_blacklisted");

    private final String token;

    Role(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }

    /**
     * Parse a role token.
     *
     * @throws InvalidRoleException
     *             if the token is not one of the known roles
     */
    @JsonCreator
    public static Role fromToken(String token) {
        if (token == null) {
            throw new InvalidRoleException("null");
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.token.equals(normalized)) {
                return role;
            }
        }
        throw new InvalidRoleException(token);
    }
}
