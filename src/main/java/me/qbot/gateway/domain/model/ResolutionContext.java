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
 * Who is asking and where: the scope, the group (group scope only), the
 * sender, and the role block to read. A null {@code roleType} is filled in by
 * {@code PolicyEngine} from the permission registry, or read as
 * {@link RoleType#USER} by the resolver.
 */
public record ResolutionContext(ChannelType channelType, String groupId, String userId, RoleType roleType) {

    public static final String DEFAULT_NODE = "__default__";

    public ResolutionContext {
        if (channelType == null) {
            throw new IllegalArgumentException("channelType is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        userId = userId.trim();
        if (channelType == ChannelType.GROUP) {
            if (groupId == null || groupId.isBlank()) {
                throw new IllegalArgumentException("groupId is required in group scope");
            }
            groupId = groupId.trim();
            if (DEFAULT_NODE.equals(groupId)) {
                throw new IllegalArgumentException("'" + DEFAULT_NODE + "' is not a group id");
            }
        } else {
            groupId = null;
        }
    }

    public static ResolutionContext group(String groupId, String userId) {
        return new ResolutionContext(ChannelType.GROUP, groupId, userId, null);
    }

    public static ResolutionContext privateChat(String userId) {
        return new ResolutionContext(ChannelType.PRIVATE, null, userId, null);
    }

    public ResolutionContext withRoleType(RoleType type) {
        return new ResolutionContext(channelType, groupId, userId, type);
    }

    public boolean isGroup() {
        return channelType == ChannelType.GROUP;
    }

    public RoleType roleTypeOrDefault() {
        return roleType != null ? roleType : RoleType.USER;
    }

    public String describe() {
        return isGroup() ? "group:" + groupId + "/user:" + userId : "private/user:" + userId;
    }
}
