package me.qbot.gateway.domain.exception;

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
 * Unknown role token passed to a permission mutation.
 */
public class InvalidRoleException extends PolicyException {

    private static final long serialVersionUID = 1L;

    private final String token;

    public InvalidRoleException(String token) {
        super("Unknown role: '" + token + "'. Valid roles: admin, group_manager, private_user, global_blacklisted");
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
