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
 * Cascade level that supplied a resolved value, most specific first.
 */
public enum ResolutionLevel {

    /** {@code group.<id>.__specific_user__.<userId>} */
    SPECIFIC_USER_GROUP,
    /** {@code private.__specific_user__.<userId>} */
    SPECIFIC_USER_PRIVATE,
    /** {@code group.<id>.<role>} */
    GROUP_ROLE,
    /** {@code group.<id>.settings} */
    GROUP_SETTINGS,
    /** {@code private.__default__.<role>} */
    PRIVATE_DEFAULT_ROLE,
    /** {@code group.__default__.<role>} */
    GROUP_DEFAULT_ROLE,
    TOP_LEVEL,
    COMPILED_DEFAULT,
    /** Top-level {@code settings.enable_*} switch forced the value off. */
    GLOBAL_VETO
}
